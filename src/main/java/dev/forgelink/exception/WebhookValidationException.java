package dev.forgelink.exception;

/**
 * Authenticated but unusable delivery: unparseable JSON or unknown event type. Answered with 400.
 */
public class WebhookValidationException extends RuntimeException {
    public WebhookValidationException(String message) {
        super(message);
    }

    public WebhookValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
