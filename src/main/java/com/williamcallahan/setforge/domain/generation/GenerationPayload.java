package com.williamcallahan.setforge.domain.generation;

import java.util.Objects;

/**
 * Provider-neutral generation request.
 *
 * @param prompt fully rendered prompt text
 * @param maxTokens upper bound on generated tokens
 * @param temperature sampling temperature
 */
public record GenerationPayload(String prompt, int maxTokens, double temperature) {
    public GenerationPayload {
        Objects.requireNonNull(prompt, "prompt");
        if (prompt.isBlank()) {
            throw new IllegalArgumentException("prompt must not be blank");
        }
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive");
        }
        if (temperature < 0 || Double.isNaN(temperature)) {
            throw new IllegalArgumentException("temperature must be non-negative");
        }
    }
}
