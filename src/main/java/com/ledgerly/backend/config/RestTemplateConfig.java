package com.ledgerly.backend.config;

import java.time.Duration;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * RestTemplate usado pela fonte de cotações.
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, ExchangeRateProperties exchangeRateProperties) {
        int timeoutSeconds = exchangeRateProperties != null ? exchangeRateProperties.getTimeoutSeconds() : 5;
        if (timeoutSeconds <= 0) timeoutSeconds = 5;

        Duration timeout = Duration.ofSeconds(timeoutSeconds);

        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }
}
