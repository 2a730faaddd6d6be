package com.shepherd.service;

import com.shepherd.api.dto.Message;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Outcome of one poll: new messages in index order, plus a rotation note when the cursor had to
 * jump to the tail of a new or truncated file.
 */
public record PollResult(boolean attached, List<Message> messages, @Nullable String rotation) {

    public PollResult {
        messages = (messages == null) ? List.of() : List.copyOf(messages);
    }

    public static PollResult unattached() {
        return new PollResult(false, List.of(), null);
    }

    public static PollResult of(List<Message> messages) {
        return new PollResult(true, messages, null);
    }

    public static PollResult rotated(String detail, List<Message> messages) {
        return new PollResult(true, messages, detail);
    }

    public boolean hasRotation() {
        return rotation != null;
    }
}
