package dev.forgelink.exception;

/**
 * Gitea refused a call because our token is over its rate limit. Answered with 429.
 */
public class UpstreamRateLimitException extends RuntimeException {
    public UpstreamRateLimitException(String message, Throwable cause) {
        super(message, cause);
    }
}
