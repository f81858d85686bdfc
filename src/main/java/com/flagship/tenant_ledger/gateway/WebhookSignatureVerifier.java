package com.flagship.tenant_ledger.gateway;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * HMAC-SHA256 verification of webhook bodies against the shared secret.
 */
@Component
@Slf4j
public class WebhookSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";
    private static final String PREFIX = "sha256=";

    private final GatewayProperties properties;

    public WebhookSignatureVerifier(GatewayProperties properties) {
        this.properties = properties;
    }

    /**
     * Computes the lowercase hex signature of the raw payload.
     */
    public String sign(String payload) {
        String secret = properties.getWebhookSecret();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("gateway.webhook-secret is not configured");
        }
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("Unable to compute webhook signature", e);
        }
    }

    /**
     * Constant-time comparison of the expected and presented signatures.
     * A missing secret or signature never verifies.
     */
    public boolean verify(String payload, String signature) {
        if (payload == null || signature == null || signature.isBlank()) {
            return false;
        }
        if (properties.getWebhookSecret() == null || properties.getWebhookSecret().isBlank()) {
            log.error("Webhook received but gateway.webhook-secret is not configured; rejecting");
            return false;
        }
        String presented = signature.trim().toLowerCase(Locale.ROOT);
        if (presented.startsWith(PREFIX)) {
            presented = presented.substring(PREFIX.length());
        }
        byte[] expected = sign(payload).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, presented.getBytes(StandardCharsets.US_ASCII));
    }
}
