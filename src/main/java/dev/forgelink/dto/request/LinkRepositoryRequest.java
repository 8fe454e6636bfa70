package dev.forgelink.dto.request;

/**
 * {@code identifier} is the Gitea full name, {@code owner/repo}.
 */
public record LinkRepositoryRequest(long installationId, String identifier) {}
