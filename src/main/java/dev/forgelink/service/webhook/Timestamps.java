package dev.forgelink.service.webhook;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * ISO-8601 timestamps from Gitea payloads, normalized to UTC. Values without an offset are read as UTC.
 */
final class Timestamps {

    private Timestamps() {
    }

    static Instant parseUtc(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Timestamp missing");
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e2) {
                throw new IllegalArgumentException("Unparseable timestamp: " + value, e2);
            }
        }
    }
}
