package dev.forgelink.dto.request;

public record CreateIssueRequest(String repo, String title, String description) {}
