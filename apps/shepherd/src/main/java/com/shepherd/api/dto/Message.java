package com.shepherd.api.dto;

import java.time.Instant;
import java.util.Objects;

/** One conversation turn read from the log. Index is assigned per project and only ever grows. */
public record Message(long index, Role role, String content, Instant timestamp) {

    public Message {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(content, "content");
        if (timestamp == null) timestamp = Instant.now();
    }

    public static Message of(long index, Role role, String content) {
        return new Message(index, role, content, Instant.now());
    }

    /** "role: content", the shape used when the message is rendered into a prompt. */
    public String render() {
        return role.wireName() + ": " + content;
    }
}
