package dev.forgelink.dto.response;

public record IssueResponse(String key, String externalKey, String title, String description,
                            String url, String repo, String displayName) {}
