package com.github.dimitryivaniuta.billing.webhooks.domain;

/**
 * Outcome of checking the {@code hashstring} header.
 *
 * <p>None of these blocks processing on its own: the authoritative charge fetch always runs.</p>
 */
public enum SignatureVerdict {
    /** Computed HMAC matches the header. */
    VALID,
    /** Header present but does not match. */
    INVALID,
    /** No header was sent. */
    UNVERIFIABLE,
    /** Computing the HMAC threw; we could not check. Kept distinct from {@link #VALID}. */
    VERIFICATION_ERROR_BYPASSED
}
