package dev.forgelink.domain.valueobject;

import java.util.Optional;

/**
 * The {@code secret} field Gitea echoes in every delivery: {@code "<external_id>#<webhook_secret>"}.
 *
 * <p>{@code raw} is the full composite and is the HMAC key material for the delivery signature;
 * {@code webhookSecret} is compared separately against the installation's stored secret.
 */
public record WebhookSecret(String raw, String externalId, String webhookSecret) {

    private static final char DELIMITER = '#';

    /**
     * Splits on the first {@code #}. Empty when the delimiter is missing or either half is empty.
     */
    public static Optional<WebhookSecret> parse(String raw) {
        if (raw == null) return Optional.empty();
        int idx = raw.indexOf(DELIMITER);
        if (idx <= 0 || idx == raw.length() - 1) return Optional.empty();
        return Optional.of(new WebhookSecret(raw, raw.substring(0, idx), raw.substring(idx + 1)));
    }

    @Override
    public String toString() {
        return "WebhookSecret[externalId=" + externalId + "]";
    }
}
