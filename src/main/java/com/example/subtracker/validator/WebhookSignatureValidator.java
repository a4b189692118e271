package com.example.subtracker.validator;

import com.example.subtracker.client.TwitchCredentials;
import com.example.subtracker.util.Constants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Verifies EventSub deliveries: {@code sha256=hex(HMAC-SHA256(secret, id + timestamp + body))}
 * must equal the signature header. Must run before the body is parsed.
 */
@Component
@Slf4j
public class WebhookSignatureValidator {

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final TwitchCredentials credentials;

    public WebhookSignatureValidator(TwitchCredentials credentials) {
        this.credentials = credentials;
    }

    public boolean verify(String messageId, String timestamp, byte[] rawBody, String providedSignature) {
        return verify(messageId, timestamp, rawBody, providedSignature, credentials.webhookSecret());
    }

    /**
     * @return false when any input is missing or the signatures differ; never throws
     */
    public boolean verify(String messageId, String timestamp, byte[] rawBody, String providedSignature,
                          String secret) {
        if (messageId == null || timestamp == null || rawBody == null
                || providedSignature == null || secret == null || secret.isEmpty()) {
            log.debug("Signature check skipped: missing message id, timestamp, body, signature or secret");
            return false;
        }

        String expected = computeSignature(messageId, timestamp, rawBody, secret);
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                providedSignature.getBytes(StandardCharsets.UTF_8));
    }

    public String computeSignature(String messageId, String timestamp, byte[] rawBody, String secret) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            mac.update(messageId.getBytes(StandardCharsets.UTF_8));
            mac.update(timestamp.getBytes(StandardCharsets.UTF_8));
            mac.update(rawBody);
            return Constants.Twitch.SIGNATURE_PREFIX + HexFormat.of().formatHex(mac.doFinal());
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            // Every JRE ships HmacSHA256 and any non-empty key is valid for it.
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
