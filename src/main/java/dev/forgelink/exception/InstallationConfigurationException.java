package dev.forgelink.exception;

/**
 * The stored installation lacks what a Gitea call needs (base URL, access token). A fault on our
 * side, answered with 500.
 */
public class InstallationConfigurationException extends RuntimeException {
    public InstallationConfigurationException(String message) {
        super(message);
    }
}
