package dev.forgelink.dto.request;

/**
 * {@code externalIssue} is {@code owner/repo#index}; {@code comment} is optional.
 */
public record LinkIssueRequest(String externalIssue, String comment) {}
