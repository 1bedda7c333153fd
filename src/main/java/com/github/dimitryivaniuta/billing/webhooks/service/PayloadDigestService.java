package com.github.dimitryivaniuta.billing.webhooks.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import org.springframework.stereotype.Service;

/**
 * Computes the digest stored next to every audited payload.
 *
 * <p>The digest is SHA-256 over the raw body bytes exactly as received, Base64-encoded. It lets an operator
 * match an audit row to a gateway delivery without comparing full payloads.</p>
 */
@Service
public class PayloadDigestService {

    /**
     * Computes Base64(SHA-256(rawBody)).
     *
     * @param rawBody raw request body, may be null
     * @return digest, or null for a null body
     */
    public String digest(String rawBody) {
        if (rawBody == null) {
            return null;
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] h = digest.digest(rawBody.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(h);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unable to compute payload digest", e);
        }
    }
}
