package com.ai.echomi.client;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Push notification through the companion backend's
 * {@code POST /api/send-notification}.
 */
public class BackendNotificationDispatcher implements NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(BackendNotificationDispatcher.class);

    private final RestTemplate restTemplate;
    private final String backendUrl;
    private final String internalApiKey;

    public BackendNotificationDispatcher(RestTemplate restTemplate, String backendUrl, String internalApiKey) {
        this.restTemplate = restTemplate;
        this.backendUrl = backendUrl;
        this.internalApiKey = internalApiKey;
    }

    @Override
    public boolean send(String recipientPhone, String title, String message, String type) {
        if (StringUtils.isBlank(backendUrl)) {
            log.warn("Notification backend URL not set; skipping notification");
            return false;
        }
        String url = StringUtils.removeEnd(backendUrl.trim(), "/") + "/api/send-notification";

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (StringUtils.isNotBlank(internalApiKey)) {
            headers.setBearerAuth(internalApiKey);
        }

        Map<String, Object> body = new HashMap<>();
        body.put("user_phone", recipientPhone);
        body.put("title", title);
        body.put("message", message);
        body.put("type", type);
        body.put("approval_token", UUID.randomUUID().toString());
        body.put("action_required", true);
        body.put("timestamp", Instant.now().getEpochSecond());

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                log.warn("Notification backend returned {}", response.getStatusCode());
                return false;
            }
            log.info("Notification '{}' sent to {}", type, recipientPhone);
            return true;
        } catch (Exception ex) {
            log.error("Notification backend request failed", ex);
            return false;
        }
    }
}
