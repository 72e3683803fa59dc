package com.ai.echomi.service;

import com.ai.echomi.client.LanguageModelService;
import com.ai.echomi.dto.ExtractedFacts;
import com.ai.echomi.utils.PhoneNumbers;
import com.ai.echomi.utils.TextUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

/**
 * Pulls name, purpose, phone and company out of a caller utterance. The language
 * model is asked first; its absence or any unusable answer falls through to
 * {@link RuleBasedFactExtractor}.
 */
@Service
public class InformationExtractor {

    private static final Logger log = LoggerFactory.getLogger(InformationExtractor.class);

    private static final String SYSTEM_PROMPT =
            "You extract caller details from one phone-call utterance. "
                    + "Respond with a single JSON object with the keys name, purpose, phone, company. "
                    + "Use null for anything not stated. Do not guess. "
                    + "company is a delivery or e-commerce company name if one is mentioned.";

    private final LanguageModelService languageModel;
    private final RuleBasedFactExtractor ruleBased;
    private final ObjectMapper mapper;

    public InformationExtractor(LanguageModelService languageModel, RuleBasedFactExtractor ruleBased, ObjectMapper mapper) {
        this.languageModel = languageModel;
        this.ruleBased = ruleBased;
        this.mapper = mapper;
    }

    public ExtractedFacts extract(String utterance, Map<String, Object> knownFacts) {
        if (StringUtils.isBlank(utterance)) {
            return ExtractedFacts.empty();
        }
        if (languageModel.isAvailable()) {
            Optional<ExtractedFacts> fromModel = extractWithModel(utterance, knownFacts);
            if (fromModel.isPresent()) {
                return fromModel.get();
            }
        }
        return ruleBased.extract(utterance);
    }

    private Optional<ExtractedFacts> extractWithModel(String utterance, Map<String, Object> knownFacts) {
        String userPrompt = "Already known: " + (knownFacts == null ? "{}" : knownFacts)
                + "\nUtterance: \"" + utterance + "\"";
        Optional<String> raw = languageModel.complete(SYSTEM_PROMPT, userPrompt, true, 0.1);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        String content = raw.get();
        int start = content.indexOf('{');
        if (start < 0) {
            log.warn("Extraction answer had no JSON object, using rules");
            return Optional.empty();
        }
        try {
            JsonNode node = mapper.readTree(content.substring(start));
            if (node == null || !node.isObject()) {
                log.warn("Extraction answer was not a JSON object, using rules");
                return Optional.empty();
            }
            String phone = text(node, "phone");
            String company = text(node, "company");
            return Optional.of(ExtractedFacts.builder()
                    .name(text(node, "name"))
                    .purpose(text(node, "purpose"))
                    .phone(phone == null ? null : PhoneNumbers.normalize(phone))
                    .company(company == null ? null : TextUtils.titleCase(company))
                    .build());
        } catch (JsonProcessingException e) {
            log.warn("Extraction answer was malformed, using rules: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        String s = TextUtils.nullIfEmpty(value.asText());
        return s == null || "null".equalsIgnoreCase(s) ? null : s;
    }
}
