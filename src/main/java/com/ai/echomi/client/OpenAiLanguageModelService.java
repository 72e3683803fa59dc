package com.ai.echomi.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * OpenAI Chat Completions over plain REST.
 */
public class OpenAiLanguageModelService implements LanguageModelService {

    private static final Logger log = LoggerFactory.getLogger(OpenAiLanguageModelService.class);

    static final String CHAT_COMPLETIONS_URL = "https://api.openai.com/v1/chat/completions";

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;
    private final String apiKey;
    private final String model;

    public OpenAiLanguageModelService(RestTemplate restTemplate, ObjectMapper mapper, String apiKey, String model) {
        this.restTemplate = restTemplate;
        this.mapper = mapper;
        this.apiKey = apiKey;
        this.model = StringUtils.defaultIfBlank(model, "gpt-4o-mini");
    }

    @Override
    public boolean isAvailable() {
        return StringUtils.isNotBlank(apiKey);
    }

    @Override
    public Optional<String> complete(String systemPrompt, String userPrompt, boolean jsonObject, double temperature) {
        if (!isAvailable()) {
            log.error("OPENAI_API_KEY is not set");
            return Optional.empty();
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);

        List<Map<String, String>> messages = new ArrayList<>();
        if (StringUtils.isNotBlank(systemPrompt)) {
            messages.add(Map.of("role", "system", "content", systemPrompt));
        }
        messages.add(Map.of("role", "user", "content", userPrompt));

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("temperature", temperature);
        body.put("messages", messages);
        if (jsonObject) {
            body.put("response_format", Map.of("type", "json_object"));
        }

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(CHAT_COMPLETIONS_URL, new HttpEntity<>(body, headers), String.class);
            JsonNode root = mapper.readTree(response.getBody());
            String content = root.path("choices").path(0).path("message").path("content").asText("").trim();
            return content.isEmpty() ? Optional.empty() : Optional.of(content);
        } catch (Exception ex) {
            log.error("Failed to get completion from {}", model, ex);
            return Optional.empty();
        }
    }
}
