package com.flagship.payout_settlement.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client for the payment rail. Connect and read timeouts bound every rail call.
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate railRestTemplate(SettlementProperties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) properties.getRail().getConnectTimeout().toMillis());
        factory.setReadTimeout((int) properties.getRail().getReadTimeout().toMillis());
        return new RestTemplate(factory);
    }
}
