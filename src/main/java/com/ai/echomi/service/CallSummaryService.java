package com.ai.echomi.service;

import com.ai.echomi.client.LanguageModelService;
import com.ai.echomi.conversation.FactKeys;
import com.ai.echomi.dto.HistoryEntry;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Short written summary of a finished call for the owner.
 */
@Service
public class CallSummaryService {

    static final int MAX_WORDS = 70;

    private final LanguageModelService languageModel;
    private final String ownerName;

    public CallSummaryService(LanguageModelService languageModel,
                              @Value("${echomi.owner-name:Ruchit}") String ownerName) {
        this.languageModel = languageModel;
        this.ownerName = ownerName;
    }

    public String summarize(List<HistoryEntry> history, Map<String, Object> facts) {
        if (history == null || history.isEmpty()) {
            return "No conversation to summarize";
        }
        if (languageModel.isAvailable()) {
            String system = "Summarize this phone call handled by an assistant for " + ownerName + " in 50 to 70 words. "
                    + "Mention who called, why, what the assistant did and the outcome. Plain prose, no lists.";
            StringBuilder transcript = new StringBuilder();
            for (HistoryEntry e : history) {
                transcript.append(e.getRole()).append(": ").append(e.getContent()).append('\n');
            }
            if (facts != null && !facts.isEmpty()) {
                transcript.append("Collected info: ").append(facts);
            }
            Optional<String> summary = languageModel.complete(system, transcript.toString(), false, 0.3);
            if (summary.isPresent() && StringUtils.isNotBlank(summary.get())) {
                return limitWords(summary.get().trim(), MAX_WORDS);
            }
        }
        return fallback(facts);
    }

    String fallback(Map<String, Object> facts) {
        Object company = facts == null ? null : facts.get(FactKeys.COMPANY);
        if (company != null && StringUtils.isNotBlank(company.toString())) {
            return "Delivery person from " + company + " called for assistance. "
                    + "Provided directions and OTP as needed. Call completed successfully.";
        }
        return "Unknown caller contacted for assistance. Collected contact information and forwarded to "
                + ownerName + ". Call completed successfully.";
    }

    static String limitWords(String text, int maxWords) {
        String[] words = text.split("\\s+");
        if (words.length <= maxWords) return text;
        String cut = String.join(" ", Arrays.copyOf(words, maxWords));
        return StringUtils.stripEnd(cut, ",;:") + (cut.endsWith(".") ? "" : "...");
    }
}
