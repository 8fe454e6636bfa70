package dev.forgelink.exception;

/**
 * Delivery could not be attributed to an installation: bad or missing signature, malformed secret,
 * unknown installation or secret mismatch. Answered with 400.
 */
public class WebhookAuthenticationException extends RuntimeException {
    public WebhookAuthenticationException(String message) {
        super(message);
    }
}
