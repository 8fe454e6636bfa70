package dev.forgelink.exception;

/**
 * Well-formed delivery that cannot be ingested (e.g. pull request without author email). Answered with 404.
 */
public class NotActionableException extends RuntimeException {
    public NotActionableException(String message) {
        super(message);
    }
}
