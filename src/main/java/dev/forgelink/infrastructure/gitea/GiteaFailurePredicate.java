package dev.forgelink.infrastructure.gitea;

import dev.forgelink.exception.InstallationConfigurationException;

import java.util.function.Predicate;

/**
 * Circuit breaker failure classification: transport errors and 5xx count, client errors
 * (404 on a deleted hook, 403 rate limit) and installations missing their base URL or token do not.
 */
public class GiteaFailurePredicate implements Predicate<Throwable> {
    @Override
    public boolean test(Throwable throwable) {
        if (throwable instanceof GiteaApiException api) {
            return api.getStatus() == 0 || api.getStatus() >= 500;
        }
        if (throwable instanceof InstallationConfigurationException) {
            return false;
        }
        return true;
    }
}
