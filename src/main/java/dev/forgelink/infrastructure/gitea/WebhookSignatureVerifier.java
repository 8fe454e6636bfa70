package dev.forgelink.infrastructure.gitea;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * HMAC-SHA256 verification for Gitea webhooks ({@code X-Gitea-Signature}, bare lowercase hex).
 * Uses constant-time comparison to prevent timing attacks.
 */
@Component
public class WebhookSignatureVerifier {
    private static final Logger log = LoggerFactory.getLogger(WebhookSignatureVerifier.class);
    private static final String ALGORITHM = "HmacSHA256";

    public boolean isValid(byte[] payload, String secret, String signature) {
        if (payload == null || signature == null || signature.isBlank()) return false;
        if (secret == null || secret.isEmpty()) return false;
        try {
            String expected = sign(payload, secret);
            return constantTimeEquals(expected, signature);
        } catch (GeneralSecurityException e) {
            log.error("HMAC failed", e);
            return false;
        }
    }

    /** Lowercase hex HMAC-SHA256 of {@code payload} keyed by the UTF-8 bytes of {@code secret}. */
    public static String sign(byte[] payload, String secret) throws GeneralSecurityException {
        Mac mac = Mac.getInstance(ALGORITHM);
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
        return HexFormat.of().formatHex(mac.doFinal(payload));
    }

    public static boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null) return false;
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }
}
