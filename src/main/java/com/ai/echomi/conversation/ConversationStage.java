package com.ai.echomi.conversation;

import java.util.Optional;

/**
 * A position inside one caller role's stage graph. Implemented by one enum per
 * graph so that branching on stages is checked for exhaustiveness by the compiler.
 */
public interface ConversationStage {

    String START_LABEL = "start";

    String label();

    CallerRole role();

    boolean isTerminal();

    static Optional<ConversationStage> parse(CallerRole role, String label) {
        String normalized = label == null || label.isBlank() ? START_LABEL : label.trim().toLowerCase();
        switch (role) {
            case DELIVERY:
                return DeliveryStage.fromLabel(normalized).<ConversationStage>map(s -> s);
            case UNKNOWN:
                return UnknownStage.fromLabel(normalized).<ConversationStage>map(s -> s);
            default:
                return Optional.empty();
        }
    }

    static ConversationStage startOf(CallerRole role) {
        return role == CallerRole.DELIVERY ? DeliveryStage.START : UnknownStage.START;
    }
}
