package com.ai.echomi.conversation;

import java.util.Optional;

/**
 * Who is on the other end of the line. UNDETERMINED only lives until the first
 * utterance has been looked at.
 */
public enum CallerRole {
    DELIVERY("delivery"),
    UNKNOWN("unknown"),
    UNDETERMINED("undetermined");

    private final String label;

    CallerRole(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Blank input means the role has not been decided yet.
     */
    public static Optional<CallerRole> fromLabel(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.of(UNDETERMINED);
        }
        String normalized = raw.trim().toLowerCase();
        for (CallerRole role : values()) {
            if (role.label.equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
