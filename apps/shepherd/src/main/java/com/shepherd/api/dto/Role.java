package com.shepherd.api.dto;

import java.util.Locale;

public enum Role {
    USER,
    ASSISTANT;

    /** Lower-case name as it appears in the conversation log and in prompts. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Returns null for anything that is not a user or assistant turn. */
    public static Role fromWire(String type) {
        if (type == null) return null;
        return switch (type.trim().toLowerCase(Locale.ROOT)) {
            case "user" -> USER;
            case "assistant" -> ASSISTANT;
            default -> null;
        };
    }
}
