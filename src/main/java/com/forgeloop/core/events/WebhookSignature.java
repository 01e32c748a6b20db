package com.forgeloop.core.events;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * HMAC-SHA-256 request signatures in the {@code sha256=<hex>} form.
 */
public final class WebhookSignature {

    public static final String PREFIX = "sha256=";
    private static final String ALGORITHM = "HmacSHA256";

    private WebhookSignature() {}

    public static String sign(String payload, String secret) {
        return sign(payload.getBytes(StandardCharsets.UTF_8), secret);
    }

    public static String sign(byte[] payload, String secret) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return PREFIX + HexFormat.of().formatHex(mac.doFinal(payload));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    public static boolean validate(String payload, String signature, String secret) {
        return validate(payload.getBytes(StandardCharsets.UTF_8), signature, secret);
    }

    /**
     * Constant-time comparison of the expected signature with the presented one.
     */
    public static boolean validate(byte[] payload, String signature, String secret) {
        if (signature == null || secret == null) {
            return false;
        }
        byte[] expected = sign(payload, secret).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, signature.getBytes(StandardCharsets.US_ASCII));
    }
}
