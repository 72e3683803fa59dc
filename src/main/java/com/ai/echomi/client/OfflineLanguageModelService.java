package com.ai.echomi.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Used in mock mode or when no API key is configured. Every caller ends up on
 * its rule-based fallback.
 */
public class OfflineLanguageModelService implements LanguageModelService {

    private static final Logger log = LoggerFactory.getLogger(OfflineLanguageModelService.class);

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public Optional<String> complete(String systemPrompt, String userPrompt, boolean jsonObject, double temperature) {
        log.debug("Language model offline; skipping completion");
        return Optional.empty();
    }
}
