package com.williamcallahan.setforge.domain.generation;

import java.util.Objects;

/**
 * Normalized response returned by a transport adapter.
 *
 * <p>{@code success == false} marks a response the provider returned but that carried no usable
 * generation; {@code content} then holds a short description of what was wrong.</p>
 *
 * @param success whether the provider produced a usable generation
 * @param content generated text, or a diagnostic when {@code success} is false
 */
public record TransportResponse(boolean success, String content) {
    public TransportResponse {
        Objects.requireNonNull(content, "content");
    }

    public static TransportResponse success(String content) {
        return new TransportResponse(true, content);
    }

    public static TransportResponse malformed(String detail) {
        return new TransportResponse(false, detail);
    }
}
