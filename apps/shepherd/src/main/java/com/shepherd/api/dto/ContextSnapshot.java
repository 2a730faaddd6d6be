package com.shepherd.api.dto;

import java.util.List;

/** Immutable copy of the context window, most recent message last. */
public record ContextSnapshot(List<Message> messages) {

    public ContextSnapshot {
        messages = (messages == null) ? List.of() : List.copyOf(messages);
    }

    public static ContextSnapshot empty() { return new ContextSnapshot(List.of()); }

    public int size() { return messages.size(); }

    public boolean isEmpty() { return messages.isEmpty(); }

    public Message latest() {
        return messages.isEmpty() ? null : messages.get(messages.size() - 1);
    }

    public long latestIndex() {
        Message m = latest();
        return m == null ? 0L : m.index();
    }
}
