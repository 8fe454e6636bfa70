package dev.forgelink.service.webhook;

import dev.forgelink.config.GiteaProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Commits whose message matches one of {@code forgelink.gitea.ignore-commit-patterns} are not ingested.
 */
@Component
public class CommitMessageFilter {
    private final List<Pattern> patterns;

    public CommitMessageFilter(GiteaProperties properties) {
        this.patterns = properties.ignoreCommitPatterns().stream()
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
                .toList();
    }

    public boolean isIgnored(String message) {
        if (message == null) return false;
        return patterns.stream().anyMatch(p -> p.matcher(message).find());
    }
}
