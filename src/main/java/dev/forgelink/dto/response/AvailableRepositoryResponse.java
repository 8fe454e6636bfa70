package dev.forgelink.dto.response;

public record AvailableRepositoryResponse(String identifier, String name) {}
