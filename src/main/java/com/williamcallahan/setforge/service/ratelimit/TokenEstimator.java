package com.williamcallahan.setforge.service.ratelimit;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingType;
import com.williamcallahan.setforge.domain.generation.GenerationPayload;
import org.springframework.stereotype.Component;

/**
 * Estimates the token weight a call places on a provider's tokens-per-minute budget.
 *
 * Uses the cl100k_base encoding for every provider; the count is an estimate for admission, not
 * billing.
 */
@Component
public class TokenEstimator {
    private final Encoding encoding;

    public TokenEstimator() {
        this.encoding = Encodings.newDefaultEncodingRegistry().getEncoding(EncodingType.CL100K_BASE);
    }

    /**
     * Prompt tokens plus the completion budget.
     */
    public long estimate(GenerationPayload payload) {
        return (long) countTokens(payload.prompt()) + payload.maxTokens();
    }

    public int countTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return encoding.countTokens(text);
    }
}
