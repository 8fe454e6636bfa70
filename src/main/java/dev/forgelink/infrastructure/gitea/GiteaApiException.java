package dev.forgelink.infrastructure.gitea;

/**
 * Non-2xx answer (or transport failure, status 0) from the Gitea REST API.
 */
public class GiteaApiException extends RuntimeException {
    private final int status;

    public GiteaApiException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }

    public boolean isNotFound() {
        return status == 404;
    }

    public boolean isForbidden() {
        return status == 403;
    }
}
