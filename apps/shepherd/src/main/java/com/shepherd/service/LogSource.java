package com.shepherd.service;

import com.shepherd.error.LogAccessException;

/**
 * Incremental reader over a project's growing conversation log.
 *
 * <p>Every message of a batch must reach the context window; only the newest one is a candidate
 * for a fresh analysis round. Implementations never block longer than one bounded read.</p>
 */
public interface LogSource {

    /**
     * @throws LogAccessException when the log location cannot be located or read at all
     */
    LogHandle open(String projectId);

    /**
     * New messages since the previous poll, possibly none.
     *
     * @throws LogAccessException when the attached log became unreadable; callers retry next poll
     */
    PollResult poll(LogHandle handle);

    /** Moves the cursor to the current end of the attached log, dropping anything unread. */
    void resetToTail(LogHandle handle);
}
