package dev.forgelink.service.webhook;

import dev.forgelink.domain.enums.GiteaEventType;
import dev.forgelink.domain.enums.WebhookOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

/**
 * Delivery counters ({@code forgelink.webhook.deliveries}, tagged by event and outcome) and a
 * per-delivery timer. Event header values outside the known set are tagged {@code unknown}.
 */
@Component
public class WebhookMetrics {
    static final String DELIVERIES = "forgelink.webhook.deliveries";
    static final String UNKNOWN_EVENT = "unknown";

    private final MeterRegistry meterRegistry;
    private final Timer ingestionTimer;

    public WebhookMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.ingestionTimer = Timer.builder("forgelink.webhook.ingestion.duration")
                .description("Time spent ingesting one Gitea delivery")
                .register(meterRegistry);
    }

    public void record(String event, WebhookOutcome outcome) {
        Counter.builder(DELIVERIES)
                .description("Gitea webhook deliveries by event and outcome")
                .tag("event", GiteaEventType.fromHeader(event).map(GiteaEventType::header).orElse(UNKNOWN_EVENT))
                .tag("outcome", outcome.tag())
                .register(meterRegistry)
                .increment();
    }

    public Timer.Sample start() {
        return Timer.start(meterRegistry);
    }

    public void stop(Timer.Sample sample) {
        sample.stop(ingestionTimer);
    }
}
