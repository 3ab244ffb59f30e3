package com.legal.consult.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP client for the LLM providers. Both timeouts are capped so a stalled provider cannot hold a request forever.
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate providerRestTemplate(RestTemplateBuilder builder,
                                             @Value("${ai.connect-timeout:10s}") Duration connectTimeout,
                                             @Value("${ai.read-timeout:60s}") Duration readTimeout) {
        return builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
    }
}
