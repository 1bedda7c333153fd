package com.github.dimitryivaniuta.billing.webhooks.web;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.github.dimitryivaniuta.billing.webhooks.service.TapWebhookProcessor;
import com.github.dimitryivaniuta.billing.webhooks.service.dto.WebhookResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class TapWebhookControllerTest {

    private TapWebhookProcessor processor;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        processor = Mockito.mock(TapWebhookProcessor.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new TapWebhookController(processor))
                .setControllerAdvice(new ErrorHandlingAdvice())
                .addFilters(new CorrelationIdFilter())
                .build();
    }

    @Test
    void passesRawBodySignatureAndForwardedAddressToTheProcessor() throws Exception {
        String body = "{\"id\":\"chg_1\",\"status\":\"CAPTURED\"}";
        Mockito.when(processor.process(ArgumentMatchers.any(), ArgumentMatchers.any(), ArgumentMatchers.any(),
                ArgumentMatchers.any())).thenReturn(WebhookResult.processed("activated"));

        mockMvc.perform(post("/api/webhooks/tap")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(TapWebhookController.SIGNATURE_HEADER, "abc123")
                        .header(ClientAddresses.FORWARDED_FOR_HEADER, "203.0.113.7, 10.0.0.1")
                        .header(CorrelationIdFilter.CORRELATION_ID_HEADER, "corr-1")
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(true))
                .andExpect(jsonPath("$.processed").value(true))
                .andExpect(jsonPath("$.result").value("activated"))
                .andExpect(jsonPath("$.duplicate").doesNotExist())
                .andExpect(jsonPath("$.error").doesNotExist());

        Mockito.verify(processor).process(body, "abc123", "203.0.113.7", "corr-1");
    }

    @Test
    void emptyBodyIsStillHandedToTheProcessor() throws Exception {
        Mockito.when(processor.process(ArgumentMatchers.isNull(), ArgumentMatchers.isNull(), ArgumentMatchers.any(),
                ArgumentMatchers.any())).thenReturn(WebhookResult.ignored("invalid_payload"));

        mockMvc.perform(post("/api/webhooks/tap").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ignored").value(true))
                .andExpect(jsonPath("$.reason").value("invalid_payload"));
    }

    @Test
    void unexpectedExceptionIsAcknowledgedWithOk() throws Exception {
        Mockito.when(processor.process(ArgumentMatchers.any(), ArgumentMatchers.any(), ArgumentMatchers.any(),
                ArgumentMatchers.any())).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/api/webhooks/tap")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(true))
                .andExpect(jsonPath("$.error").value("internal_error"));
    }
}
