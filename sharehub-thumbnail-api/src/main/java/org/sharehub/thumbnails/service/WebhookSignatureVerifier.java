package org.sharehub.thumbnails.service;

import lombok.RequiredArgsConstructor;
import org.sharehub.thumbnails.config.ConversionProperties;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Checks the HMAC-SHA256 signature CloudConvert puts on every webhook body.
 */
@Component
@RequiredArgsConstructor
public class WebhookSignatureVerifier {

    private static final String HMAC_SHA256 = "HmacSHA256";

    private final ConversionProperties conversionProperties;

    public boolean isValid(byte[] rawPayload, String signature) {
        String secret = conversionProperties.getWebhookSecret();
        if (secret == null || secret.isBlank() || signature == null || signature.isBlank() || rawPayload == null) {
            return false;
        }
        byte[] expected = sign(rawPayload, secret).getBytes(StandardCharsets.US_ASCII);
        byte[] provided = signature.trim().toLowerCase().getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, provided);
    }

    public static String sign(byte[] payload, String secret) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
            return HexFormat.of().formatHex(mac.doFinal(payload));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 is not available", e);
        }
    }
}
