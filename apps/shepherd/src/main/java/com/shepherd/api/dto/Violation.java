package com.shepherd.api.dto;

import org.springframework.lang.Nullable;

/**
 * An active, deduplicated rule violation. Lives while
 * {@code firstSeenIndex >= currentIndex - windowSize}.
 */
public record Violation(String ruleId, long firstSeenIndex, long lastSeenIndex, @Nullable String suggestion) {

    public static Violation first(String ruleId, long index, @Nullable String suggestion) {
        return new Violation(ruleId, index, index, suggestion);
    }

    public Violation seenAt(long index) {
        return new Violation(ruleId, firstSeenIndex, Math.max(lastSeenIndex, index), suggestion);
    }
}
