package com.shepherd.api.dto;

import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Objects;

/** One record of the merged output stream, always tagged with the project it belongs to. */
public record MonitorEvent(Type type, String projectId, Instant ts, Object data) {

    public enum Type { ALERT, HEARTBEAT, FAILURE, ROTATION, STOPPED }

    public enum FailureKind { LOG_ACCESS, ANALYSIS, CONFIG, SUGGESTION_WRITE, SUPERVISOR_CRASH }

    public record Alert(String ruleId, String reasoning, @Nullable String suggestion,
                        boolean stopRequest, long messageIndex) {}

    public record Heartbeat(long messagesProcessed, long alertsRaised) {}

    public record Failure(FailureKind kind, String message) {}

    public record Rotation(String detail) {}

    public record Stopped(String reason) {}

    public MonitorEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(projectId, "projectId");
        if (ts == null) ts = Instant.now();
    }

    public static MonitorEvent alert(String projectId, Verdict v, long messageIndex) {
        return new MonitorEvent(Type.ALERT, projectId, Instant.now(),
                new Alert(v.ruleId(), v.reasoning(), v.hasSuggestion() ? v.suggestion() : null,
                        v.stopRequest(), messageIndex));
    }

    public static MonitorEvent heartbeat(String projectId, long messagesProcessed, long alertsRaised) {
        return new MonitorEvent(Type.HEARTBEAT, projectId, Instant.now(), new Heartbeat(messagesProcessed, alertsRaised));
    }

    public static MonitorEvent failure(String projectId, FailureKind kind, String message) {
        String msg = (message == null || message.isBlank()) ? "<no message>" : message;
        return new MonitorEvent(Type.FAILURE, projectId, Instant.now(), new Failure(kind, msg));
    }

    public static MonitorEvent failure(String projectId, FailureKind kind, Throwable t) {
        return failure(projectId, kind, formatThrowable(t));
    }

    public static MonitorEvent rotation(String projectId, String detail) {
        return new MonitorEvent(Type.ROTATION, projectId, Instant.now(), new Rotation(detail));
    }

    public static MonitorEvent stopped(String projectId, String reason) {
        return new MonitorEvent(Type.STOPPED, projectId, Instant.now(), new Stopped(reason));
    }

    public <T> T dataAs(Class<T> type) {
        return type.cast(data);
    }

    private static String formatThrowable(Throwable t) {
        if (t == null) return "<null>";
        String msg = t.getMessage();
        if (msg == null || msg.isBlank()) msg = t.toString();
        Throwable c = t.getCause();
        if (c != null && c != t) msg += " | cause: " + c;
        return msg;
    }
}
