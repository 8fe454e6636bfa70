package dev.forgelink.service.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.forgelink.domain.entity.Installation;
import dev.forgelink.domain.entity.Organization;
import dev.forgelink.domain.enums.GiteaEventType;
import dev.forgelink.dto.request.GiteaEvent;
import dev.forgelink.exception.NotActionableException;
import dev.forgelink.exception.WebhookValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Binds the delivery body to the event's payload type once, then runs the matching handler for
 * every organization the installation is linked to.
 *
 * <p>No transaction spans organizations. A handler failure for one organization is logged and the
 * remaining organizations are still processed.
 */
@Service
public class WebhookEventDispatcher {
    private static final Logger log = LoggerFactory.getLogger(WebhookEventDispatcher.class);

    private final Map<GiteaEventType, WebhookEventHandler<?>> handlers = new EnumMap<>(GiteaEventType.class);
    private final ObjectMapper objectMapper;

    public WebhookEventDispatcher(List<WebhookEventHandler<?>> handlers, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        for (WebhookEventHandler<?> handler : handlers) {
            WebhookEventHandler<?> previous = this.handlers.put(handler.eventType(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers registered for " + handler.eventType());
            }
        }
    }

    /**
     * @return number of organizations the event was handled for without error
     */
    public int dispatch(Installation installation, GiteaEventType type, JsonNode body) {
        WebhookEventHandler<?> handler = handlers.get(type);
        if (handler == null) {
            throw new WebhookValidationException("No handler for event " + type.header());
        }
        return dispatch(handler, installation, body);
    }

    private <E extends GiteaEvent> int dispatch(WebhookEventHandler<E> handler, Installation installation,
                                                JsonNode body) {
        E event;
        try {
            event = objectMapper.treeToValue(body, handler.payloadType());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new WebhookValidationException("Payload does not match " + handler.eventType().header(), e);
        }
        if (event.repository() == null || event.repository().fullName() == null) {
            log.atWarn().setMessage("gitea.webhook.repository-missing")
                    .addKeyValue("installation_id", installation.getId()).log();
            throw new NotActionableException("Event has no repository.full_name");
        }
        handler.validate(event);

        List<Organization> organizations = installation.getOrganizations().stream()
                .sorted(Comparator.comparing(Organization::getId))
                .toList();
        int handled = 0;
        for (Organization organization : organizations) {
            try {
                handler.handle(organization, installation, event);
                handled++;
            } catch (RuntimeException e) {
                log.atError().setMessage("gitea.webhook.organization-failed")
                        .addKeyValue("event", handler.eventType().header())
                        .addKeyValue("installation_id", installation.getId())
                        .addKeyValue("organization_id", organization.getId())
                        .setCause(e).log();
            }
        }
        return handled;
    }
}
