package com.ai.echomi.service;

import com.ai.echomi.client.LanguageModelService;
import com.ai.echomi.dto.FollowupPlan;
import com.ai.echomi.utils.TextUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Decides whether an unknown caller's purpose deserves up to two screening
 * questions before the callback number is taken.
 */
@Service
public class FollowupPlanner {

    private static final Logger log = LoggerFactory.getLogger(FollowupPlanner.class);

    private static final List<String> PROFESSIONAL_KEYWORDS = List.of(
            "sponsorship", "business", "collaboration", "partnership",
            "investment", "project", "proposal", "meeting", "interview",
            "opportunity", "deal", "funding", "venture", "startup",
            "media", "press", "journalist", "article", "feature"
    );

    private static final List<String> INVESTMENT = List.of("investment", "funding", "venture");
    private static final List<String> BUSINESS = List.of("business", "collaboration", "partnership");
    private static final List<String> MEDIA = List.of("media", "press", "journalist", "article");

    private final LanguageModelService languageModel;
    private final ObjectMapper mapper;
    private final String ownerName;

    public FollowupPlanner(LanguageModelService languageModel, ObjectMapper mapper,
                           @Value("${echomi.owner-name:Ruchit}") String ownerName) {
        this.languageModel = languageModel;
        this.mapper = mapper;
        this.ownerName = ownerName;
    }

    public FollowupPlan plan(String purpose, String callerName) {
        if (StringUtils.isBlank(purpose)) {
            return FollowupPlan.none("No purpose given");
        }
        if (languageModel.isAvailable()) {
            Optional<FollowupPlan> fromModel = planWithModel(purpose, callerName);
            if (fromModel.isPresent()) {
                return fromModel.get();
            }
        }
        return planByRules(purpose);
    }

    FollowupPlan planByRules(String purpose) {
        String lower = purpose.toLowerCase();
        if (!TextUtils.containsAny(lower, PROFESSIONAL_KEYWORDS)) {
            return FollowupPlan.none("Simple inquiry that doesn't require detailed follow-up");
        }
        if (lower.contains("sponsorship")) {
            return new FollowupPlan(true, "high",
                    "I see you're interested in sponsorship. What type of sponsorship opportunity are you proposing?",
                    "And what's the scale or budget range you're considering?",
                    "Sponsorship needs type and scale");
        }
        if (TextUtils.containsAny(lower, INVESTMENT)) {
            return new FollowupPlan(true, "high",
                    "I understand this is about investment. What kind of investment opportunity are you proposing?",
                    "What stage is your company or project currently at?",
                    "Investment needs type and maturity stage");
        }
        if (TextUtils.containsAny(lower, BUSINESS)) {
            return new FollowupPlan(true, "medium",
                    "That sounds interesting! Can you tell me more about the nature of this business opportunity?",
                    "What timeline are you looking at for this collaboration?",
                    "Business opportunities need scope and timeline");
        }
        if (TextUtils.containsAny(lower, MEDIA)) {
            return new FollowupPlan(true, "medium",
                    "I see this is a media inquiry. What publication or outlet are you with?",
                    "What's the focus or angle of the story you're working on?",
                    "Media requests need outlet and story angle");
        }
        return new FollowupPlan(true, "medium",
                "That sounds important! Could you provide a bit more detail about what you'd like to discuss?",
                "What would be the best time frame for " + ownerName + " to get back to you on this?",
                "Professional inquiry needs context and timing");
    }

    private Optional<FollowupPlan> planWithModel(String purpose, String callerName) {
        String system = "You screen calls for " + ownerName + ". Decide if the caller's purpose needs follow-up "
                + "questions so " + ownerName + " can prioritize the callback. Ask follow-ups for business, "
                + "investment, partnership, sponsorship, collaboration, job or media matters; not for simple "
                + "inquiries, personal calls or complaints. At most two short, conversational questions. "
                + "Respond with a JSON object: {\"needs_followup\": bool, \"importance_level\": \"high|medium|low\", "
                + "\"first_question\": string|null, \"second_question\": string|null, \"reasoning\": string}.";
        String user = "Caller " + StringUtils.defaultIfBlank(callerName, "the caller")
                + " said the reason for calling is: \"" + purpose + "\"";
        Optional<String> raw = languageModel.complete(system, user, true, 0.3);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        String content = raw.get();
        int start = content.indexOf('{');
        if (start < 0) {
            log.warn("Followup answer had no JSON object, using rules");
            return Optional.empty();
        }
        try {
            JsonNode node = mapper.readTree(content.substring(start));
            boolean needs = node.path("needs_followup").asBoolean(false);
            String first = text(node, "first_question");
            if (needs && first == null) {
                log.warn("Followup answer asked for a followup without a question, using rules");
                return Optional.empty();
            }
            if (!needs) {
                return Optional.of(FollowupPlan.none(text(node, "reasoning")));
            }
            String importance = StringUtils.defaultIfBlank(text(node, "importance_level"), "medium").toLowerCase();
            return Optional.of(new FollowupPlan(true, importance, first, text(node, "second_question"),
                    text(node, "reasoning")));
        } catch (JsonProcessingException e) {
            log.warn("Followup answer was malformed, using rules: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        return TextUtils.nullIfEmpty(value.asText());
    }
}
