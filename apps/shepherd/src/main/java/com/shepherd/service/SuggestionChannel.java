package com.shepherd.service;

import com.shepherd.error.SuggestionWriteException;

import java.util.Optional;

/**
 * File based hand-off of one suggestion into the host tool's next turn. Latest write wins and
 * the consumer removes what it read, so a suggestion is delivered at most once.
 */
public interface SuggestionChannel {

    boolean enabled();

    /**
     * Replaces any unconsumed suggestion of the project.
     *
     * @throws SuggestionWriteException when the suggestion could not be stored
     */
    void publish(String projectId, String suggestion);

    /** Takes the pending suggestion of the project, removing it. */
    Optional<String> consume(String projectId);
}
