package dev.forgelink.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Gitea integration settings.
 *
 * <p>{@code webhookUrl} is the public address Gitea posts deliveries to; it is embedded in every
 * webhook we register. {@code ignoreCommitPatterns} are regular expressions matched against commit
 * messages; a match suppresses ingestion of that commit.
 */
@ConfigurationProperties(prefix = "forgelink.gitea")
public record GiteaProperties(String webhookUrl, List<String> ignoreCommitPatterns,
                              Duration connectTimeout, Duration responseTimeout) {
    public GiteaProperties {
        if (ignoreCommitPatterns == null) ignoreCommitPatterns = List.of("#skipforgelink");
        if (connectTimeout == null) connectTimeout = Duration.ofSeconds(10);
        if (responseTimeout == null) responseTimeout = Duration.ofSeconds(30);
    }
}
