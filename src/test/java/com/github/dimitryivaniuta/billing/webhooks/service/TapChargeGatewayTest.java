package com.github.dimitryivaniuta.billing.webhooks.service;

import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withResourceNotFound;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.billing.webhooks.service.dto.GatewayVerification;
import java.math.BigDecimal;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class TapChargeGatewayTest {

    private MockRestServiceServer server;
    private TapChargeGateway gateway;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder()
                .baseUrl("https://api.tap.test")
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer sk_test");
        server = MockRestServiceServer.bindTo(builder).build();
        gateway = new TapChargeGateway(builder.build(), new ObjectMapper());
    }

    @Test
    void returnsAuthoritativeCharge() {
        server.expect(requestTo("https://api.tap.test/v2/charges/chg_1"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer sk_test"))
                .andRespond(withSuccess("""
                        {"id":"chg_1","status":"CAPTURED","amount":25.000,"currency":"KWD",
                         "reference":{"gateway":"gw_1","payment":"pay_1"},
                         "metadata":{"user_id":"u1","service_id":"s1","discount_code_id":"d1"},
                         "response":{"code":"000","message":"Captured"},
                         "customer":{"first_name":"ignored"}}
                        """, MediaType.APPLICATION_JSON));

        GatewayVerification v = gateway.verify("chg_1");

        server.verify();
        Assertions.assertTrue(v.success());
        Assertions.assertEquals("CAPTURED", v.charge().status());
        Assertions.assertEquals(0, new BigDecimal("25.000").compareTo(v.charge().amount()));
        Assertions.assertEquals("KWD", v.charge().currency());
        Assertions.assertEquals("u1", v.charge().metadataValue("user_id"));
        Assertions.assertEquals("gw_1", v.charge().reference().gateway());
        Assertions.assertEquals("Captured", v.charge().failureReason());
        Assertions.assertNotNull(v.rawJson());
    }

    @Test
    void nonSuccessStatusIsReportedWithCode() {
        server.expect(requestTo("https://api.tap.test/v2/charges/chg_404")).andRespond(withResourceNotFound());

        GatewayVerification v = gateway.verify("chg_404");

        Assertions.assertFalse(v.success());
        Assertions.assertNull(v.charge());
        Assertions.assertEquals("TAP API: 404", v.error());
    }

    @Test
    void serverErrorIsReportedWithCode() {
        server.expect(requestTo("https://api.tap.test/v2/charges/chg_5")).andRespond(withServerError());

        Assertions.assertEquals("TAP API: 500", gateway.verify("chg_5").error());
    }

    @Test
    void unparsableBodyIsAFailure() {
        server.expect(requestTo("https://api.tap.test/v2/charges/chg_1"))
                .andRespond(withSuccess("<html>maintenance</html>", MediaType.TEXT_HTML));

        GatewayVerification v = gateway.verify("chg_1");

        Assertions.assertFalse(v.success());
        Assertions.assertTrue(v.error().startsWith("TAP API:"));
    }

    @Test
    void chargeWithoutStatusIsAFailure() {
        server.expect(requestTo("https://api.tap.test/v2/charges/chg_1"))
                .andRespond(withSuccess("{\"id\":\"chg_1\"}", MediaType.APPLICATION_JSON));

        Assertions.assertFalse(gateway.verify("chg_1").success());
    }

    @Test
    void chargeForAnotherIdIsAFailure() {
        server.expect(requestTo("https://api.tap.test/v2/charges/chg_1"))
                .andRespond(withSuccess("{\"id\":\"chg_2\",\"status\":\"CAPTURED\"}", MediaType.APPLICATION_JSON));

        GatewayVerification v = gateway.verify("chg_1");

        Assertions.assertFalse(v.success());
        Assertions.assertTrue(v.error().contains("chg_2"));
    }
}
