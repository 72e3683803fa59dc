package com.ai.echomi.conversation;

import java.util.Optional;

public enum UnknownStage implements ConversationStage {
    START("start"),
    ASKING_NAME("asking_name"),
    ASKING_PURPOSE("asking_purpose"),
    ASKING_FOLLOWUP("asking_followup"),
    ASKING_SECOND_FOLLOWUP("asking_second_followup"),
    COLLECTING_CONTACT("collecting_contact"),
    END_OF_CALL("end_of_call");

    private final String label;

    UnknownStage(String label) {
        this.label = label;
    }

    @Override
    public String label() {
        return label;
    }

    @Override
    public CallerRole role() {
        return CallerRole.UNKNOWN;
    }

    @Override
    public boolean isTerminal() {
        return this == END_OF_CALL;
    }

    public static Optional<UnknownStage> fromLabel(String label) {
        for (UnknownStage stage : values()) {
            if (stage.label.equals(label)) {
                return Optional.of(stage);
            }
        }
        return Optional.empty();
    }
}
