package dev.forgelink.domain.enums;

import java.util.Optional;

/**
 * Closed set of webhook events we ingest, keyed by the {@code X-Gitea-Event} header value.
 */
public enum GiteaEventType {
    PUSH("push"),
    PULL_REQUEST("pull_request");

    private final String header;

    GiteaEventType(String header) {
        this.header = header;
    }

    public String header() {
        return header;
    }

    public static Optional<GiteaEventType> fromHeader(String value) {
        if (value == null) return Optional.empty();
        for (GiteaEventType type : values()) {
            if (type.header.equals(value)) return Optional.of(type);
        }
        return Optional.empty();
    }
}
