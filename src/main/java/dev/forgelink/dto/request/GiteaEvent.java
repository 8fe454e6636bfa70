package dev.forgelink.dto.request;

/**
 * Common shape of the typed webhook payloads.
 */
public interface GiteaEvent {
    EventRepository repository();
}
