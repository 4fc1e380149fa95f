package com.williamcallahan.setforge.domain.checkpoint;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Objects;

/**
 * One line of session output.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GeneratedArtifact(
        @JsonProperty("item_id") String itemId,
        @JsonProperty("provider") String provider,
        @JsonProperty("model") String model,
        @JsonProperty("content") String content,
        @JsonProperty("recorded_at") Instant recordedAt) {
    public GeneratedArtifact {
        Objects.requireNonNull(itemId, "itemId");
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(recordedAt, "recordedAt");
    }
}
