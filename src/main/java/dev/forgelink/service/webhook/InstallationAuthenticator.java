package dev.forgelink.service.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import dev.forgelink.domain.entity.Installation;
import dev.forgelink.domain.valueobject.WebhookSecret;
import dev.forgelink.exception.WebhookAuthenticationException;
import dev.forgelink.infrastructure.gitea.WebhookSignatureVerifier;
import dev.forgelink.repository.InstallationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Resolves the {@link Installation} a delivery belongs to and proves the sender knows its secret.
 *
 * <p>Checks run in a fixed order and stop at the first failure:
 * <ol>
 *   <li>signature header present</li>
 *   <li>{@code secret} field present and a string</li>
 *   <li>HMAC-SHA256 of the raw body keyed by the whole composite secret matches the header</li>
 *   <li>composite secret splits into {@code <external_id>#<webhook_secret>}</li>
 *   <li>an installation exists for (gitea, external id)</li>
 *   <li>the webhook secret half equals the installation's stored secret</li>
 * </ol>
 * Every failure is a {@link WebhookAuthenticationException}; nothing is written.
 */
@Service
public class InstallationAuthenticator {
    private static final Logger log = LoggerFactory.getLogger(InstallationAuthenticator.class);

    static final String SECRET_FIELD = "secret";

    private final WebhookSignatureVerifier signatureVerifier;
    private final InstallationRepository installationRepository;

    public InstallationAuthenticator(WebhookSignatureVerifier signatureVerifier,
                                     InstallationRepository installationRepository) {
        this.signatureVerifier = signatureVerifier;
        this.installationRepository = installationRepository;
    }

    public Installation authenticate(byte[] rawBody, JsonNode body, String signature) {
        if (signature == null || signature.isBlank()) {
            log.atWarn().setMessage("gitea.webhook.missing-signature").log();
            throw new WebhookAuthenticationException("Missing signature header");
        }

        JsonNode secretNode = body.get(SECRET_FIELD);
        if (secretNode == null || !secretNode.isTextual()) {
            log.atWarn().setMessage("gitea.webhook.missing-secret").log();
            throw new WebhookAuthenticationException("Missing secret field");
        }
        String composite = secretNode.asText();

        if (!signatureVerifier.isValid(rawBody, composite, signature)) {
            log.atWarn().setMessage("gitea.webhook.invalid-signature").log();
            throw new WebhookAuthenticationException("Invalid signature");
        }

        WebhookSecret secret = WebhookSecret.parse(composite).orElseThrow(() -> {
            log.atWarn().setMessage("gitea.webhook.invalid-secret-format").log();
            return new WebhookAuthenticationException("Malformed secret field");
        });

        Installation installation = installationRepository
                .findByProviderAndExternalId(Installation.PROVIDER_GITEA, secret.externalId())
                .orElseThrow(() -> {
                    log.atWarn().setMessage("gitea.webhook.installation-not-found")
                            .addKeyValue("external_id", secret.externalId()).log();
                    return new WebhookAuthenticationException("Unknown installation");
                });

        String stored = installation.getWebhookSecret();
        if (stored == null || !WebhookSignatureVerifier.constantTimeEquals(stored, secret.webhookSecret())) {
            log.atWarn().setMessage("gitea.webhook.secret-mismatch")
                    .addKeyValue("installation_id", installation.getId()).log();
            throw new WebhookAuthenticationException("Secret mismatch");
        }
        return installation;
    }
}
