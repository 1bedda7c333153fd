package com.github.dimitryivaniuta.billing.webhooks.config;

import java.net.http.HttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * HTTP client for the Tap REST API.
 *
 * <p>Both timeouts are bounded: a hung gateway call must degrade to {@code verification_failed},
 * never block the webhook handler indefinitely.</p>
 */
@Configuration
public class TapClientConfig {

    /**
     * Rest client pre-configured with base URL, bearer credential and timeouts.
     *
     * @param builder Spring Boot managed builder
     * @param props   application properties
     * @return rest client
     */
    @Bean
    public RestClient tapRestClient(RestClient.Builder builder, AppProperties props) {
        AppProperties.Tap tap = props.getTap();

        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(tap.getConnectTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(tap.getReadTimeout());

        return builder
                .baseUrl(tap.getBaseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + tap.getSecretKey())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
