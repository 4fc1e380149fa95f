package com.williamcallahan.setforge.config;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Root of the {@code app.*} configuration tree.
 */
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private static final String NO_PROVIDERS_MSG = "app.providers must list at least one provider.";
    private static final String DUPLICATE_FMT = "app.providers contains duplicate provider name '%s'.";

    private List<ProviderSettings> providers = new ArrayList<>();
    private GenerationSettings generation = new GenerationSettings();
    private SelectionSettings selection = new SelectionSettings();
    private StorageSettings checkpoint = StorageSettings.checkpoint();
    private StorageSettings deadLetter = StorageSettings.deadLetter();
    private InputSettings input = new InputSettings();

    /**
     * Validates every section; binding errors surface at startup rather than mid-run.
     */
    @PostConstruct
    public void validateConfiguration() {
        if (providers == null || providers.isEmpty()) {
            throw new IllegalArgumentException(NO_PROVIDERS_MSG);
        }
        Set<String> names = new HashSet<>();
        for (int index = 0; index < providers.size(); index++) {
            ProviderSettings provider = providers.get(index);
            provider.validateConfiguration(index);
            if (!names.add(provider.getName())) {
                throw new IllegalArgumentException(String.format(Locale.ROOT, DUPLICATE_FMT, provider.getName()));
            }
        }
        generation.validateConfiguration();
        selection.validateConfiguration();
        checkpoint.validateConfiguration();
        deadLetter.validateConfiguration();
        input.validateConfiguration();
    }

    public List<ProviderSettings> getProviders() {
        return providers;
    }

    public void setProviders(final List<ProviderSettings> providers) {
        this.providers = providers;
    }

    public GenerationSettings getGeneration() {
        return generation;
    }

    public void setGeneration(final GenerationSettings generation) {
        this.generation = generation;
    }

    public SelectionSettings getSelection() {
        return selection;
    }

    public void setSelection(final SelectionSettings selection) {
        this.selection = selection;
    }

    public StorageSettings getCheckpoint() {
        return checkpoint;
    }

    public StorageSettings getDeadLetter() {
        return deadLetter;
    }

    public InputSettings getInput() {
        return input;
    }

    public void setInput(final InputSettings input) {
        this.input = input;
    }
}
