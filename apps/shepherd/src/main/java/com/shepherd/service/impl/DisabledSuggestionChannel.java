package com.shepherd.service.impl;

import com.shepherd.service.SuggestionChannel;

import java.util.Optional;

/** Feedback switched off: violations only reach the alert stream. */
public class DisabledSuggestionChannel implements SuggestionChannel {

    @Override
    public boolean enabled() {
        return false;
    }

    @Override
    public void publish(String projectId, String suggestion) {
        // inert
    }

    @Override
    public Optional<String> consume(String projectId) {
        return Optional.empty();
    }
}
