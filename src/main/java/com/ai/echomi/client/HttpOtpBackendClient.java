package com.ai.echomi.client;

import com.ai.echomi.dto.OtpFetchResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * Fetches delivery OTPs from the companion backend at
 * {@code GET {backend}/api/delivery/otp/{uid}}.
 */
public class HttpOtpBackendClient implements OtpBackendClient {

    private static final Logger log = LoggerFactory.getLogger(HttpOtpBackendClient.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;
    private final String backendUrl;
    private final String internalApiKey;

    public HttpOtpBackendClient(RestTemplate restTemplate, ObjectMapper mapper, String backendUrl, String internalApiKey) {
        this.restTemplate = restTemplate;
        this.mapper = mapper;
        this.backendUrl = backendUrl;
        this.internalApiKey = internalApiKey;
    }

    @Override
    public OtpFetchResult fetchOtp(String userId, String company, String orderId) {
        if (StringUtils.isAnyBlank(backendUrl, internalApiKey)) {
            log.warn("OTP backend not configured; returning placeholder OTP for order {}", orderId);
            return PlaceholderOtp.of(company, orderId, "Backend not configured");
        }
        URI uri = UriComponentsBuilder.fromHttpUrl(StringUtils.removeEnd(backendUrl.trim(), "/"))
                .path("/api/delivery/otp/{uid}")
                .queryParam("sender", company)
                .queryParam("orderId", orderId)
                .buildAndExpand(userId)
                .encode()
                .toUri();

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(internalApiKey);
        try {
            ResponseEntity<String> response = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), String.class);
            JsonNode body = mapper.readTree(response.getBody());
            String otp = body.path("otp").asText("");
            if (otp.isEmpty()) {
                log.warn("OTP backend answered without an OTP for order {}", orderId);
                return PlaceholderOtp.of(company, orderId, "No OTP in backend response");
            }
            return OtpFetchResult.builder().otp(otp).company(company).orderId(orderId).fallback(false).build();
        } catch (Exception ex) {
            log.error("OTP backend request failed for order {}", orderId, ex);
            return PlaceholderOtp.of(company, orderId, ex.getMessage());
        }
    }
}
