package com.fieldreport.impound.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP client for the SMS gateway.
 */
@Configuration
@Slf4j
public class RestClientConfig {

    @Bean
    public RestTemplate smsRestTemplate(
            RestTemplateBuilder builder,
            @Value("${app.sms.connect-timeout:5s}") Duration connectTimeout,
            @Value("${app.sms.read-timeout:10s}") Duration readTimeout) {
        log.info("Creating SMS RestTemplate: connectTimeout={}, readTimeout={}", connectTimeout, readTimeout);
        return builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
    }
}
