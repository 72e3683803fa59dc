package com.ai.echomi.config;

import com.ai.echomi.client.BackendNotificationDispatcher;
import com.ai.echomi.client.HttpOtpBackendClient;
import com.ai.echomi.client.LanguageModelService;
import com.ai.echomi.client.LedgerOtpBackendClient;
import com.ai.echomi.client.LocationService;
import com.ai.echomi.client.MapboxLocationService;
import com.ai.echomi.client.MockLocationService;
import com.ai.echomi.client.NotificationDispatcher;
import com.ai.echomi.client.OfflineLanguageModelService;
import com.ai.echomi.client.OpenAiLanguageModelService;
import com.ai.echomi.client.OtpBackendClient;
import com.ai.echomi.client.TwilioSmsNotificationDispatcher;
import com.ai.echomi.service.OrderLedger;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Picks the real or the mock implementation of each external collaborator once,
 * at startup. {@code echomi.mock-mode=true} runs the service with no network
 * dependencies at all.
 */
@Configuration
public class CollaboratorConfig {

    private static final Logger log = LoggerFactory.getLogger(CollaboratorConfig.class);

    @Value("${echomi.mock-mode:false}")
    private boolean mockMode;

    @Bean
    public RestTemplate collaboratorRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(Duration.ofSeconds(15))
                .build();
    }

    @Bean
    public LanguageModelService languageModelService(RestTemplate collaboratorRestTemplate, ObjectMapper mapper,
                                                     @Value("${openai.api-key:}") String apiKey,
                                                     @Value("${openai.model:gpt-4o-mini}") String model) {
        if (mockMode) {
            log.info("Language model: offline (mock mode)");
            return new OfflineLanguageModelService();
        }
        log.info("Language model: OpenAI {}", model);
        return new OpenAiLanguageModelService(collaboratorRestTemplate, mapper, apiKey, model);
    }

    @Bean
    public LocationService locationService(RestTemplate collaboratorRestTemplate, ObjectMapper mapper,
                                           @Value("${mapbox.access-token:}") String accessToken,
                                           @Value("${echomi.destination.lat:12.9716}") double lat,
                                           @Value("${echomi.destination.lng:77.5946}") double lng,
                                           @Value("${echomi.destination.max-distance-km:10}") double maxDistanceKm) {
        if (mockMode) {
            log.info("Location service: landmark table (mock mode)");
            return new MockLocationService(maxDistanceKm);
        }
        return new MapboxLocationService(collaboratorRestTemplate, mapper, accessToken, lat, lng, maxDistanceKm);
    }

    @Bean
    public OtpBackendClient otpBackendClient(RestTemplate collaboratorRestTemplate, ObjectMapper mapper, OrderLedger ledger,
                                             @Value("${echomi.backend.url:}") String backendUrl,
                                             @Value("${echomi.backend.internal-api-key:}") String internalApiKey) {
        if (mockMode) {
            return new LedgerOtpBackendClient(ledger);
        }
        return new HttpOtpBackendClient(collaboratorRestTemplate, mapper, backendUrl, internalApiKey);
    }

    @Bean
    public NotificationDispatcher notificationDispatcher(RestTemplate collaboratorRestTemplate,
                                                         @Value("${echomi.notification.channel:backend}") String channel,
                                                         @Value("${echomi.backend.url:}") String backendUrl,
                                                         @Value("${echomi.backend.internal-api-key:}") String internalApiKey,
                                                         @Value("${twilio.account-sid:}") String accountSid,
                                                         @Value("${twilio.auth-token:}") String authToken,
                                                         @Value("${twilio.from-number:}") String fromNumber) {
        if ("twilio".equalsIgnoreCase(channel)) {
            log.info("Owner notifications: Twilio SMS");
            return new TwilioSmsNotificationDispatcher(accountSid, authToken, fromNumber);
        }
        log.info("Owner notifications: backend push");
        return new BackendNotificationDispatcher(collaboratorRestTemplate, backendUrl, internalApiKey);
    }
}
