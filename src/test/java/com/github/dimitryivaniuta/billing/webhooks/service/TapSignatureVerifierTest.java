package com.github.dimitryivaniuta.billing.webhooks.service;

import com.github.dimitryivaniuta.billing.webhooks.config.AppProperties;
import com.github.dimitryivaniuta.billing.webhooks.domain.SignatureVerdict;
import com.github.dimitryivaniuta.billing.webhooks.service.dto.TapNotification;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TapSignatureVerifierTest {

    private AppProperties properties;
    private TapSignatureVerifier verifier;

    @BeforeEach
    void setUp() {
        properties = new AppProperties();
        properties.getTap().setSecretKey("sk_test_secret");
        verifier = new TapSignatureVerifier(properties);
    }

    @Test
    void canonicalStringFollowsTapFieldOrderWithThreeDecimalsForKwd() {
        TapNotification n = notification(new BigDecimal("25"), "CAPTURED", "gw_1", "pay_1", "1700000000000", null);

        Assertions.assertEquals(
                "x_idchg_1x_amount25.000x_currencyKWDx_gateway_referencegw_1x_payment_referencepay_1x_statusCAPTUREDx_created1700000000000",
                verifier.canonicalString(n));
    }

    @Test
    void absentFieldsRenderAsEmptyStrings() {
        TapNotification n = new TapNotification("{}", "sig", "1.2.3.4", "chg_1", null, null, null,
                null, null, null, null, Map.of());

        Assertions.assertEquals("x_idchg_1x_amountx_currencyx_gateway_referencex_payment_referencex_statusx_created",
                verifier.canonicalString(n));
    }

    @Test
    void amountUsesCurrencyMinorUnits() {
        Assertions.assertEquals("25.001", TapSignatureVerifier.formatAmount(new BigDecimal("25.0005"), "KWD"));
        Assertions.assertEquals("10.50", TapSignatureVerifier.formatAmount(new BigDecimal("10.5"), "USD"));
        Assertions.assertEquals("1200", TapSignatureVerifier.formatAmount(new BigDecimal("1200"), "JPY"));
        Assertions.assertEquals("7.000", TapSignatureVerifier.formatAmount(new BigDecimal("7"), null));
        Assertions.assertEquals("", TapSignatureVerifier.formatAmount(null, "KWD"));
    }

    @Test
    void signMatchesReferenceHmacSha256() throws Exception {
        properties.getTap().setSecretKey("key");

        Assertions.assertEquals("f7bc83f430538424b13298e6aa6fb143ef4d59a14946175997479dbc2d1a3cd8",
                verifier.sign("The quick brown fox jumps over the lazy dog"));
    }

    @Test
    void validSignatureIsAcceptedCaseInsensitively() throws Exception {
        TapNotification unsigned = notification(new BigDecimal("25.000"), "CAPTURED", "gw_1", "pay_1", "1700000000000", null);
        String signature = verifier.sign(verifier.canonicalString(unsigned));

        Assertions.assertEquals(SignatureVerdict.VALID,
                verifier.verify(withSignature(unsigned, signature)));
        Assertions.assertEquals(SignatureVerdict.VALID,
                verifier.verify(withSignature(unsigned, signature.toUpperCase(Locale.ROOT))));
    }

    @Test
    void signatureIsDeterministic() throws Exception {
        TapNotification n = notification(new BigDecimal("25.000"), "CAPTURED", "gw_1", "pay_1", "1700000000000", null);

        Assertions.assertEquals(verifier.sign(verifier.canonicalString(n)), verifier.sign(verifier.canonicalString(n)));
    }

    @Test
    void alteringAnySignedFieldInvalidatesTheSignature() throws Exception {
        TapNotification original = notification(new BigDecimal("25.000"), "CAPTURED", "gw_1", "pay_1", "1700000000000", null);
        String signature = verifier.sign(verifier.canonicalString(original));

        Assertions.assertEquals(SignatureVerdict.INVALID, verifier.verify(
                notification(new BigDecimal("2.500"), "CAPTURED", "gw_1", "pay_1", "1700000000000", signature)));
        Assertions.assertEquals(SignatureVerdict.INVALID, verifier.verify(
                notification(new BigDecimal("25.000"), "FAILED", "gw_1", "pay_1", "1700000000000", signature)));
        Assertions.assertEquals(SignatureVerdict.INVALID, verifier.verify(
                notification(new BigDecimal("25.000"), "CAPTURED", "gw_2", "pay_1", "1700000000000", signature)));
        Assertions.assertEquals(SignatureVerdict.INVALID, verifier.verify(
                notification(new BigDecimal("25.000"), "CAPTURED", "gw_1", "pay_2", "1700000000000", signature)));
        Assertions.assertEquals(SignatureVerdict.INVALID, verifier.verify(
                notification(new BigDecimal("25.000"), "CAPTURED", "gw_1", "pay_1", "1700000000001", signature)));
    }

    @Test
    void missingHeaderIsUnverifiable() {
        TapNotification n = notification(new BigDecimal("25.000"), "CAPTURED", "gw_1", "pay_1", "1", null);

        Assertions.assertEquals(SignatureVerdict.UNVERIFIABLE, verifier.verify(n));
        Assertions.assertEquals(SignatureVerdict.UNVERIFIABLE, verifier.verify(withSignature(n, "  ")));
    }

    @Test
    void computationErrorIsReportedAsBypassed() {
        properties.getTap().setSecretKey("");
        TapNotification n = notification(new BigDecimal("25.000"), "CAPTURED", "gw_1", "pay_1", "1", "abcdef");

        Assertions.assertEquals(SignatureVerdict.VERIFICATION_ERROR_BYPASSED, verifier.verify(n));
    }

    private static TapNotification notification(BigDecimal amount, String status, String gw, String pay,
                                                String created, String signature) {
        return new TapNotification("{}", signature, "1.2.3.4", "chg_1", status, amount, "KWD",
                gw, pay, created, "evt_1", Map.of());
    }

    private static TapNotification withSignature(TapNotification n, String signature) {
        return new TapNotification(n.rawBody(), signature, n.sourceAddress(), n.chargeId(), n.status(), n.amount(),
                n.currency(), n.gatewayReference(), n.paymentReference(), n.created(), n.providerEventId(), n.metadata());
    }
}
