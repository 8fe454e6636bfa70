package dev.forgelink.exception;

import dev.forgelink.infrastructure.gitea.GiteaApiException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.net.URI;
import java.time.Instant;

/**
 * Global exception handler using RFC 7807 Problem Details.
 *
 * <p>Webhook rejections carry a fixed detail string: the provider only needs the status code and
 * the reason for a rejection is written to the log, not to the caller. Standard Spring MVC
 * exceptions (405, missing parameters, unreadable bodies) keep their statuses through
 * {@link ResponseEntityExceptionHandler}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler({WebhookAuthenticationException.class, WebhookValidationException.class})
    public ProblemDetail handleRejectedDelivery(RuntimeException ex) {
        return problem(HttpStatus.BAD_REQUEST, "Webhook delivery rejected.",
                "webhook-rejected", "Rejected Delivery");
    }

    @ExceptionHandler(NotActionableException.class)
    public ProblemDetail handleNotActionable(NotActionableException ex) {
        return problem(HttpStatus.NOT_FOUND, "Webhook delivery is not actionable.",
                "webhook-not-actionable", "Not Actionable");
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ProblemDetail handleNotFound(ResourceNotFoundException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return problem(HttpStatus.NOT_FOUND, ex.getMessage(), "not-found", "Not Found");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleBadRequest(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "bad-request", "Invalid Request");
    }

    @ExceptionHandler(IllegalStateException.class)
    public ProblemDetail handleConflict(IllegalStateException ex) {
        log.warn("State conflict: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, ex.getMessage(), "state-conflict", "State Conflict");
    }

    @ExceptionHandler(InstallationConfigurationException.class)
    public ProblemDetail handleMisconfiguredInstallation(InstallationConfigurationException ex) {
        log.error("Installation misconfigured: {}", ex.getMessage());
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "The integration is not fully configured.",
                "installation-misconfigured", "Installation Misconfigured");
    }

    @ExceptionHandler(GiteaApiException.class)
    public ProblemDetail handleGiteaApi(GiteaApiException ex) {
        log.warn("Gitea API error: status={}, message={}", ex.getStatus(), ex.getMessage());
        return problem(HttpStatus.BAD_GATEWAY, "Gitea returned an error (status " + ex.getStatus() + ").",
                "upstream-error", "Upstream Error");
    }

    @ExceptionHandler(RequestNotPermitted.class)
    public ProblemDetail handleRateLimited(RequestNotPermitted ex) {
        log.warn("Rate limited: {}", ex.getMessage());
        return problem(HttpStatus.TOO_MANY_REQUESTS, "Too many requests. Please retry later.",
                "rate-limited", "Rate Limited");
    }

    @ExceptionHandler(UpstreamRateLimitException.class)
    public ProblemDetail handleUpstreamRateLimited(UpstreamRateLimitException ex) {
        log.warn("Gitea rate limit: {}", ex.getMessage());
        return problem(HttpStatus.TOO_MANY_REQUESTS, "Rate limit exceeded", "rate-limited", "Rate Limited");
    }

    @ExceptionHandler(CallNotPermittedException.class)
    public ProblemDetail handleCircuitOpen(CallNotPermittedException ex) {
        log.warn("Circuit breaker open: {}", ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable. Please retry later.",
                "service-unavailable", "Service Unavailable");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred. Please try again later.", "internal", "Internal Server Error");
    }

    private static ProblemDetail problem(HttpStatus status, String detail, String type, String title) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(URI.create("https://forgelink.dev/errors/" + type));
        problem.setTitle(title);
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }
}
