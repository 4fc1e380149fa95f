package com.williamcallahan.setforge.domain.provider;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

class ProviderSettingParsingTest {

    @ParameterizedTest
    @ValueSource(strings = {"openai", "OpenAI_Compatible", "github-models", "digitalocean"})
    void openAiAliasesResolveToCompatibleTransport(String setting) {
        assertEquals(TransportKind.OPENAI_COMPATIBLE, TransportKind.fromSetting(setting));
    }

    @ParameterizedTest
    @ValueSource(strings = {"google_ai_studio", "google-ai-studio", " ai_studio "})
    void googleAliasesResolveToAiStudio(String setting) {
        assertEquals(TransportKind.GOOGLE_AI_STUDIO, TransportKind.fromSetting(setting));
    }

    @Test
    void unknownOrBlankTransportIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> TransportKind.fromSetting("carrier-pigeon"));
        assertThrows(IllegalArgumentException.class, () -> TransportKind.fromSetting(" "));
    }

    @Test
    void tierDefaultsToFreeAndPaidSortsFirst() {
        assertEquals(ProviderTier.FREE, ProviderTier.fromSetting(null));
        assertEquals(ProviderTier.PAID, ProviderTier.fromSetting("Paid"));
        assertThrows(IllegalArgumentException.class, () -> ProviderTier.fromSetting("gold"));
        assertEquals(0, ProviderTier.PAID.priority());
        assertEquals(1, ProviderTier.FREE.priority());
    }
}
