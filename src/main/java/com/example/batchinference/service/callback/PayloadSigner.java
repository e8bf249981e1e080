package com.example.batchinference.service.callback;

import com.example.batchinference.config.InferenceProperties;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Optional;

/**
 * HMAC-SHA256 signing of callback payloads. Without a configured shared secret
 * signing is disabled and payloads are sent unsigned.
 */
@Component
public class PayloadSigner {

    public static final String SIGNATURE_HEADER = "X-Signature";
    static final String SIGNATURE_PREFIX = "sha256=";
    private static final String ALGORITHM = "HmacSHA256";

    private final byte[] secret;

    public PayloadSigner(InferenceProperties properties) {
        String configured = properties.getSharedSecret();
        this.secret = configured == null || configured.isEmpty() ? null : configured.getBytes(StandardCharsets.UTF_8);
    }

    public boolean isEnabled() {
        return secret != null;
    }

    /**
     * @return lower-case hex HMAC of {@code payload}, or empty when signing is disabled
     */
    public Optional<String> sign(byte[] payload) {
        if (secret == null) {
            return Optional.empty();
        }
        return Optional.of(HexFormat.of().formatHex(hmac(payload)));
    }

    /**
     * @return the value of the {@value #SIGNATURE_HEADER} header for {@code payload}
     */
    public Optional<String> signatureHeader(byte[] payload) {
        return sign(payload).map(digest -> SIGNATURE_PREFIX + digest);
    }

    /**
     * Checks a {@code sha256=<hex>} header against the exact payload bytes.
     * Always false when signing is disabled.
     */
    public boolean verify(byte[] payload, String header) {
        if (secret == null || header == null || !header.startsWith(SIGNATURE_PREFIX)) {
            return false;
        }
        byte[] expected;
        try {
            expected = HexFormat.of().parseHex(header.substring(SIGNATURE_PREFIX.length()).trim());
        } catch (IllegalArgumentException ex) {
            return false;
        }
        return MessageDigest.isEqual(expected, hmac(payload));
    }

    private byte[] hmac(byte[] payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret, ALGORITHM));
            return mac.doFinal(payload);
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("HMAC-SHA256 is not available", ex);
        }
    }
}
