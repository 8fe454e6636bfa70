package dev.forgelink.domain.enums;

/**
 * Result of one webhook delivery, used as a metric tag.
 */
public enum WebhookOutcome {
    PROCESSED, REJECTED_AUTHENTICATION, REJECTED_VALIDATION, NOT_ACTIONABLE;

    public String tag() {
        return name().toLowerCase();
    }
}
