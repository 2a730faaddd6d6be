package com.shepherd.monitor;

import com.shepherd.api.dto.ContextSnapshot;
import com.shepherd.api.dto.Message;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding buffer of the last {@code capacity} messages of one project, oldest evicted first.
 * Capacity is fixed for the life of the window. Not thread-safe: only the owning supervisor
 * touches it.
 */
public final class ContextWindow {

    private final int capacity;
    private final Deque<Message> buffer;

    public ContextWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, was " + capacity);
        }
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>(capacity + 1);
    }

    public void append(Message message) {
        Message last = buffer.peekLast();
        if (last != null && message.index() <= last.index()) {
            throw new IllegalArgumentException("message index " + message.index()
                    + " does not follow " + last.index());
        }
        buffer.addLast(message);
        while (buffer.size() > capacity) {
            buffer.removeFirst();
        }
    }

    public ContextSnapshot snapshot() {
        return new ContextSnapshot(buffer.stream().toList());
    }

    public int size() { return buffer.size(); }

    /** Index of the newest message, 0 when empty. */
    public long latestIndex() {
        Message last = buffer.peekLast();
        return last == null ? 0L : last.index();
    }
}
