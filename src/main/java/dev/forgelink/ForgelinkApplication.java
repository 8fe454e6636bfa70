package dev.forgelink;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Forgelink: Gitea integration service.
 *
 * <p>Architecture overview:
 * <pre>
 * Gitea Webhook → GiteaWebhookController → InstallationAuthenticator (HMAC + secret)
 *   → WebhookEventDispatcher → per organization: RepositoryResolver → Push/PullRequest handler
 *   → native upserts (commits, commit authors, pull requests)
 * </pre>
 *
 * <p>Outbound side: {@code GiteaApiClient} registers repository webhooks and bridges issues.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ForgelinkApplication {

    public static void main(String[] args) {
        SpringApplication.run(ForgelinkApplication.class, args);
    }
}
