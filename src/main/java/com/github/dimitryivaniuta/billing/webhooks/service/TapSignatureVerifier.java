package com.github.dimitryivaniuta.billing.webhooks.service;

import com.github.dimitryivaniuta.billing.webhooks.config.AppProperties;
import com.github.dimitryivaniuta.billing.webhooks.domain.SignatureVerdict;
import com.github.dimitryivaniuta.billing.webhooks.service.dto.TapNotification;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Currency;
import java.util.HexFormat;
import java.util.Locale;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Verifies Tap's {@code hashstring} header.
 *
 * <p>Tap signs a fixed concatenation of charge fields:
 * {@code x_id{id}x_amount{amount}x_currency{currency}x_gateway_reference{gw}x_payment_reference{pay}x_status{status}x_created{created}}
 * with HMAC-SHA256 keyed by the merchant secret, hex encoded. The amount is rendered with the currency's
 * minor-unit precision (3 decimals for KWD).</p>
 *
 * <p>The verdict is an audit signal. It never blocks processing: state only changes after the charge is
 * fetched from the gateway.</p>
 */
@Component
public class TapSignatureVerifier {

    private static final Logger log = LoggerFactory.getLogger(TapSignatureVerifier.class);

    static final String HMAC_ALGORITHM = "HmacSHA256";

    /**
     * Precision used when the currency is absent or unknown.
     */
    private static final int DEFAULT_FRACTION_DIGITS = 3;

    private final AppProperties properties;

    public TapSignatureVerifier(AppProperties properties) {
        this.properties = properties;
    }

    /**
     * Verifies the claimed signature of a notification.
     *
     * @param notification parsed notification
     * @return verdict
     */
    public SignatureVerdict verify(TapNotification notification) {
        if (!notification.hasSignature()) {
            log.warn("No hashstring header for charge {}; relying on gateway verification", notification.chargeId());
            return SignatureVerdict.UNVERIFIABLE;
        }

        String computed;
        try {
            computed = sign(canonicalString(notification));
        } catch (GeneralSecurityException | RuntimeException e) {
            log.warn("Signature computation failed for charge {}; verdict bypassed. error={}",
                    notification.chargeId(), e.toString());
            return SignatureVerdict.VERIFICATION_ERROR_BYPASSED;
        }

        byte[] expected = computed.getBytes(StandardCharsets.US_ASCII);
        byte[] received = notification.signature().trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expected, received)) {
            log.warn("Signature mismatch for charge {}", notification.chargeId());
            return SignatureVerdict.INVALID;
        }
        return SignatureVerdict.VALID;
    }

    /**
     * Builds the string Tap signs. Absent fields render as empty strings.
     *
     * @param n notification
     * @return canonical string
     */
    public String canonicalString(TapNotification n) {
        return "x_id" + nullToEmpty(n.chargeId())
                + "x_amount" + formatAmount(n.amount(), n.currency())
                + "x_currency" + nullToEmpty(n.currency())
                + "x_gateway_reference" + nullToEmpty(n.gatewayReference())
                + "x_payment_reference" + nullToEmpty(n.paymentReference())
                + "x_status" + nullToEmpty(n.status())
                + "x_created" + nullToEmpty(n.created());
    }

    /**
     * HMAC-SHA256 of {@code data} with the configured secret, lowercase hex.
     *
     * @param data data to sign
     * @return hex signature
     * @throws GeneralSecurityException if the MAC cannot be initialized
     */
    public String sign(String data) throws GeneralSecurityException {
        String secret = properties.getTap().getSecretKey();
        if (secret == null || secret.isEmpty()) {
            throw new GeneralSecurityException("Tap secret key is not configured");
        }
        Mac mac = Mac.getInstance(HMAC_ALGORITHM);
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
        return HexFormat.of().formatHex(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
    }

    static String formatAmount(BigDecimal amount, String currency) {
        if (amount == null) {
            return "";
        }
        return amount.setScale(fractionDigits(currency), RoundingMode.HALF_UP).toPlainString();
    }

    private static int fractionDigits(String currency) {
        if (currency == null || currency.isBlank()) {
            return DEFAULT_FRACTION_DIGITS;
        }
        try {
            int digits = Currency.getInstance(currency.trim().toUpperCase(Locale.ROOT)).getDefaultFractionDigits();
            return digits < 0 ? DEFAULT_FRACTION_DIGITS : digits;
        } catch (IllegalArgumentException e) {
            return DEFAULT_FRACTION_DIGITS;
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
