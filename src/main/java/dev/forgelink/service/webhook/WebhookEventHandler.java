package dev.forgelink.service.webhook;

import dev.forgelink.domain.entity.Installation;
import dev.forgelink.domain.entity.Organization;
import dev.forgelink.domain.enums.GiteaEventType;
import dev.forgelink.dto.request.GiteaEvent;

/**
 * Turns one typed Gitea event into domain records for one organization.
 *
 * @param <E> payload type bound from the delivery body
 */
public interface WebhookEventHandler<E extends GiteaEvent> {

    GiteaEventType eventType();

    Class<E> payloadType();

    /**
     * Called once per delivery, before any organization is handled.
     *
     * @throws dev.forgelink.exception.NotActionableException if the event lacks what ingestion needs
     */
    default void validate(E event) {
    }

    void handle(Organization organization, Installation installation, E event);
}
