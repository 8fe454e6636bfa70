package dev.forgelink.dto.response;

import java.time.Instant;

public record RepositoryResponse(Long id, String name, String url, String externalId, String provider,
                                 Long installationId, Instant createdAt) {}
