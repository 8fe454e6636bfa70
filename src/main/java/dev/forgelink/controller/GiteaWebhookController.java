package dev.forgelink.controller;

import dev.forgelink.service.webhook.WebhookIngestionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Gitea webhook receiver. The raw body is handed over untouched: the HMAC is computed over the
 * exact bytes Gitea sent. Answers 204 on success; rejections are mapped by
 * {@link dev.forgelink.exception.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/extensions/gitea")
public class GiteaWebhookController {
    static final String SIGNATURE_HEADER = "X-Gitea-Signature";
    static final String EVENT_HEADER = "X-Gitea-Event";

    private final WebhookIngestionService ingestionService;

    public GiteaWebhookController(WebhookIngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @PostMapping("/webhook")
    public ResponseEntity<Void> handleWebhook(
            @RequestHeader(value = EVENT_HEADER, required = false) String eventType,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
            @RequestBody(required = false) byte[] rawBody) {
        ingestionService.ingest(rawBody, eventType, signature);
        return ResponseEntity.noContent().build();
    }
}
