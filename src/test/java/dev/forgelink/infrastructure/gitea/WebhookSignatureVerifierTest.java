package dev.forgelink.infrastructure.gitea;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class WebhookSignatureVerifierTest {

    private final WebhookSignatureVerifier verifier = new WebhookSignatureVerifier();
    private final byte[] body = "{\"secret\":\"a#b\"}".getBytes(StandardCharsets.UTF_8);

    @Test
    @DisplayName("sign() produces the well-known HMAC-SHA256 test vector")
    void knownVector() throws Exception {
        byte[] message = "The quick brown fox jumps over the lazy dog".getBytes(StandardCharsets.UTF_8);
        assertThat(WebhookSignatureVerifier.sign(message, "key"))
                .isEqualTo("f7bc83f430538424b13298e6aa6fb143ef4d59a14946175997479dbc2d1a3cd8");
    }

    @Test
    @DisplayName("accepts the lowercase hex signature of the exact body")
    void acceptsValidSignature() throws Exception {
        String signature = WebhookSignatureVerifier.sign(body, "a#b");
        assertThat(verifier.isValid(body, "a#b", signature)).isTrue();
    }

    @Test
    @DisplayName("rejects a signature computed with another secret")
    void rejectsWrongSecret() throws Exception {
        String signature = WebhookSignatureVerifier.sign(body, "other");
        assertThat(verifier.isValid(body, "a#b", signature)).isFalse();
    }

    @Test
    @DisplayName("rejects when a single byte of the body changes")
    void rejectsTamperedBody() throws Exception {
        String signature = WebhookSignatureVerifier.sign(body, "a#b");
        byte[] tampered = "{\"secret\":\"a#c\"}".getBytes(StandardCharsets.UTF_8);
        assertThat(verifier.isValid(tampered, "a#b", signature)).isFalse();
    }

    @Test
    @DisplayName("returns false instead of throwing for null, blank or malformed signatures")
    void rejectsMissingOrMalformed() {
        assertThat(verifier.isValid(body, "a#b", null)).isFalse();
        assertThat(verifier.isValid(body, "a#b", "")).isFalse();
        assertThat(verifier.isValid(body, "a#b", "not-hex")).isFalse();
        assertThat(verifier.isValid(body, "a#b", "sha256=deadbeef")).isFalse();
        assertThat(verifier.isValid(body, "", "deadbeef")).isFalse();
        assertThat(verifier.isValid(body, null, "deadbeef")).isFalse();
    }

    @Test
    @DisplayName("constantTimeEquals compares by content")
    void constantTimeEquals() {
        assertThat(WebhookSignatureVerifier.constantTimeEquals("abc", "abc")).isTrue();
        assertThat(WebhookSignatureVerifier.constantTimeEquals("abc", "abd")).isFalse();
        assertThat(WebhookSignatureVerifier.constantTimeEquals("abc", "abcd")).isFalse();
    }
}
