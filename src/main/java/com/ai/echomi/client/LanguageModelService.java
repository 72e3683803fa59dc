package com.ai.echomi.client;

import java.util.Optional;

/**
 * Chat-completion style language model. Implementations never throw: an empty
 * result means "no answer", and callers fall back to their rule-based path.
 */
public interface LanguageModelService {

    boolean isAvailable();

    /**
     * @param jsonObject ask the model for a single JSON object instead of prose
     */
    Optional<String> complete(String systemPrompt, String userPrompt, boolean jsonObject, double temperature);
}
