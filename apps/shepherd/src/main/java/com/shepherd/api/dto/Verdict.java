package com.shepherd.api.dto;

import org.springframework.lang.Nullable;

/** One finding returned by a single analysis call. */
public record Verdict(String ruleId, String reasoning, @Nullable String suggestion, boolean stopRequest) {

    public static Verdict of(String ruleId, String reasoning, @Nullable String suggestion) {
        return new Verdict(ruleId, reasoning, suggestion, RuleSet.STOP_REQUEST_ID.equals(ruleId));
    }

    public boolean hasSuggestion() {
        return suggestion != null && !suggestion.isBlank();
    }
}
