package com.coachportal.nudge.infrastructure.slack;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;

/**
 * Verifies Slack request signatures.
 *
 * Signature = "v0=" + hex(HMAC-SHA256(signingSecret, "v0:" + timestamp + ":" + rawBody)).
 * The timestamp must also be fresh, otherwise a captured request could be replayed.
 */
public class SlackSignatureVerifier {
    private static final Logger log = LoggerFactory.getLogger(SlackSignatureVerifier.class);

    private static final String VERSION = "v0";
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final byte[] signingSecret;
    private final Duration tolerance;
    private final Clock clock;

    public SlackSignatureVerifier(String signingSecret, Duration tolerance, Clock clock) {
        this.signingSecret = signingSecret == null ? new byte[0] : signingSecret.getBytes(StandardCharsets.UTF_8);
        this.tolerance = tolerance;
        this.clock = clock;
    }

    /**
     * @param signature Value of X-Slack-Signature
     * @param timestamp Value of X-Slack-Request-Timestamp (epoch seconds)
     * @param rawBody   Request body exactly as received
     * @return true if the request was signed with the shared secret and is fresh
     */
    public boolean verify(String signature, String timestamp, String rawBody) {
        if (signingSecret.length == 0) {
            log.error("[SLACK] Signing secret not configured, rejecting callback");
            return false;
        }
        if (signature == null || signature.isEmpty() || timestamp == null || timestamp.isEmpty()) {
            return false;
        }

        long requestEpoch;
        try {
            requestEpoch = Long.parseLong(timestamp.trim());
        } catch (NumberFormatException e) {
            log.warn("[SLACK] Malformed request timestamp: {}", timestamp);
            return false;
        }
        long skew = Math.abs(clock.instant().getEpochSecond() - requestEpoch);
        if (skew > tolerance.toSeconds()) {
            log.warn("[SLACK] Stale request timestamp (skew={}s)", skew);
            return false;
        }

        String expected = sign(timestamp, rawBody == null ? "" : rawBody);
        return MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.UTF_8),
            signature.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Compute the signature header value for a timestamp and body.
     */
    public String sign(String timestamp, String rawBody) {
        String baseString = VERSION + ":" + timestamp + ":" + rawBody;
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(signingSecret, HMAC_ALGORITHM));
            byte[] digest = mac.doFinal(baseString.getBytes(StandardCharsets.UTF_8));
            return VERSION + "=" + toHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    private static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
