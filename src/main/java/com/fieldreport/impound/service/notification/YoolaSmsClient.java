package com.fieldreport.impound.service.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Yoola SMS HTTP API: {@code POST /api/v1/send} with {@code {phone, message, api_key}}.
 * Several recipients are sent comma-separated in one request.
 */
@Component
@Slf4j
public class YoolaSmsClient implements SmsGateway {

    static final String SEND_PATH = "/api/v1/send";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;

    public YoolaSmsClient(@Qualifier("smsRestTemplate") RestTemplate restTemplate,
                          ObjectMapper objectMapper,
                          @Value("${app.sms.base-url:https://yoolasms.com}") String baseUrl,
                          @Value("${app.sms.api-key:}") String apiKey) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        if (apiKey.isBlank()) {
            log.warn("app.sms.api-key is not set; the SMS gateway will reject messages");
        }
    }

    @Override
    public void send(Collection<String> phones, String message) {
        if (phones == null || phones.isEmpty()) {
            throw new SmsDeliveryException("No recipients");
        }
        Map<String, String> body = new LinkedHashMap<>();
        body.put("phone", String.join(",", phones));
        body.put("message", message);
        body.put("api_key", apiKey);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(baseUrl + SEND_PATH, new HttpEntity<>(body, headers), String.class);
        } catch (RestClientResponseException e) {
            String text = e.getResponseBodyAsString();
            throw new SmsDeliveryException("SMS failed (" + e.getStatusCode().value() + "): "
                    + (text.isBlank() ? "Unknown error" : text), e);
        } catch (RestClientException e) {
            throw new SmsDeliveryException("SMS gateway unreachable: " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new SmsDeliveryException("SMS failed (" + response.getStatusCode().value() + ")");
        }
        verifyJsonBody(response.getBody());
        log.debug("SMS accepted for {} recipient(s)", phones.size());
    }

    private void verifyJsonBody(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return;
        }
        try {
            objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new SmsDeliveryException("SMS gateway returned a malformed response: " + abbreviate(responseBody), e);
        }
    }

    private static String abbreviate(String s) {
        return s.length() <= 200 ? s : s.substring(0, 200) + "...";
    }
}
