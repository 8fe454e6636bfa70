package dev.forgelink.service.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.forgelink.domain.entity.Installation;
import dev.forgelink.domain.enums.GiteaEventType;
import dev.forgelink.domain.enums.WebhookOutcome;
import dev.forgelink.exception.NotActionableException;
import dev.forgelink.exception.WebhookAuthenticationException;
import dev.forgelink.exception.WebhookValidationException;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Entry point for one Gitea delivery: parse, authenticate, classify, dispatch.
 *
 * <p>Rejections surface as {@link WebhookAuthenticationException}, {@link WebhookValidationException}
 * or {@link NotActionableException}; the web layer maps them to 400/400/404.
 */
@Service
public class WebhookIngestionService {
    private static final Logger log = LoggerFactory.getLogger(WebhookIngestionService.class);

    private final ObjectMapper objectMapper;
    private final InstallationAuthenticator authenticator;
    private final WebhookEventDispatcher dispatcher;
    private final WebhookMetrics metrics;

    public WebhookIngestionService(ObjectMapper objectMapper, InstallationAuthenticator authenticator,
                                   WebhookEventDispatcher dispatcher, WebhookMetrics metrics) {
        this.objectMapper = objectMapper;
        this.authenticator = authenticator;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
    }

    public void ingest(byte[] rawBody, String eventHeader, String signature) {
        Timer.Sample sample = metrics.start();
        try {
            JsonNode body = parse(rawBody);
            Installation installation = authenticator.authenticate(rawBody, body, signature);

            GiteaEventType type = GiteaEventType.fromHeader(eventHeader).orElseThrow(() -> {
                log.atWarn().setMessage("gitea.webhook.unknown-event")
                        .addKeyValue("event", eventHeader)
                        .addKeyValue("installation_id", installation.getId()).log();
                return new WebhookValidationException("Unsupported event type");
            });

            int organizations = dispatcher.dispatch(installation, type, body);
            log.atInfo().setMessage("gitea.webhook.processed")
                    .addKeyValue("event", type.header())
                    .addKeyValue("installation_id", installation.getId())
                    .addKeyValue("organizations", organizations).log();
            metrics.record(eventHeader, WebhookOutcome.PROCESSED);
        } catch (WebhookAuthenticationException e) {
            metrics.record(eventHeader, WebhookOutcome.REJECTED_AUTHENTICATION);
            throw e;
        } catch (WebhookValidationException e) {
            metrics.record(eventHeader, WebhookOutcome.REJECTED_VALIDATION);
            throw e;
        } catch (NotActionableException e) {
            metrics.record(eventHeader, WebhookOutcome.NOT_ACTIONABLE);
            throw e;
        } finally {
            metrics.stop(sample);
        }
    }

    private JsonNode parse(byte[] rawBody) {
        JsonNode body;
        try {
            body = rawBody == null || rawBody.length == 0 ? null : objectMapper.readTree(rawBody);
        } catch (IOException e) {
            log.atWarn().setMessage("gitea.webhook.invalid-json").log();
            throw new WebhookValidationException("Body is not valid JSON", e);
        }
        if (body == null || !body.isObject()) {
            log.atWarn().setMessage("gitea.webhook.invalid-json").log();
            throw new WebhookValidationException("Body is not a JSON object");
        }
        return body;
    }
}
