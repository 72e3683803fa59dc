package com.ai.echomi.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OpenAiLanguageModelServiceTest {

    private RestTemplate restTemplate;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
    }

    @Test
    void shouldSendJsonModeRequestAndReturnContent() {
        OpenAiLanguageModelService service =
                new OpenAiLanguageModelService(restTemplate, new ObjectMapper(), "sk-test", "gpt-4o-mini");
        server.expect(requestTo(OpenAiLanguageModelService.CHAT_COMPLETIONS_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer sk-test"))
                .andExpect(jsonPath("$.model").value("gpt-4o-mini"))
                .andExpect(jsonPath("$.response_format.type").value("json_object"))
                .andExpect(jsonPath("$.messages[0].role").value("system"))
                .andRespond(withSuccess("{\"choices\": [{\"message\": {\"content\": \" {\\\"name\\\": \\\"Priya\\\"} \"}}]}",
                        MediaType.APPLICATION_JSON));

        Optional<String> answer = service.complete("extract", "My name is Priya", true, 0.1);

        assertEquals(Optional.of("{\"name\": \"Priya\"}"), answer);
        server.verify();
    }

    @Test
    void shouldReturnEmptyOnServerError() {
        OpenAiLanguageModelService service =
                new OpenAiLanguageModelService(restTemplate, new ObjectMapper(), "sk-test", null);
        server.expect(requestTo(OpenAiLanguageModelService.CHAT_COMPLETIONS_URL)).andRespond(withServerError());

        assertTrue(service.complete("summarize", "history", false, 0.3).isEmpty());
    }

    @Test
    void shouldBeUnavailableWithoutKey() {
        OpenAiLanguageModelService service =
                new OpenAiLanguageModelService(restTemplate, new ObjectMapper(), " ", null);

        assertFalse(service.isAvailable());
        assertTrue(service.complete("s", "u", false, 0.3).isEmpty());
        server.verify();
    }
}
