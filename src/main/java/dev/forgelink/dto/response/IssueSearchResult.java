package dev.forgelink.dto.response;

public record IssueSearchResult(String label, long value) {}
