package com.shepherd.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shepherd.api.dto.Role;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns one JSONL line of the host tool's conversation log into a turn.
 *
 * <p>User turns carry {@code message.content} as a string; assistant turns carry an array of
 * content blocks of which only {@code type=text} blocks count. Tool traffic, summaries and other
 * line types are not conversation turns and are skipped.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConversationLineParser {

    public record Turn(Role role, String content, Instant timestamp) {}

    private final ObjectMapper mapper;

    public Optional<Turn> parse(String line) {
        if (line == null || line.isBlank()) return Optional.empty();
        JsonNode root;
        try {
            root = mapper.readTree(line);
        } catch (Exception e) {
            log.debug("[ConversationLineParser] unparseable line skipped: {}", e.getMessage());
            return Optional.empty();
        }
        if (root == null || !root.isObject()) return Optional.empty();

        Role role = Role.fromWire(root.path("type").asText(null));
        if (role == null) return Optional.empty();

        String content = extractContent(root);
        if (content == null || content.isBlank()) return Optional.empty();

        return Optional.of(new Turn(role, content.trim(), timestamp(root)));
    }

    static String extractContent(JsonNode root) {
        JsonNode nested = root.path("message");
        if (nested.isObject()) {
            JsonNode content = nested.path("content");
            if (content.isTextual()) {
                return content.asText();
            }
            if (content.isArray()) {
                List<String> parts = new ArrayList<>();
                for (JsonNode block : content) {
                    if (block.isObject() && "text".equals(block.path("type").asText())) {
                        parts.add(block.path("text").asText(""));
                    }
                }
                return String.join(" ", parts);
            }
        }
        JsonNode top = root.path("content");
        return top.isTextual() ? top.asText() : null;
    }

    private static Instant timestamp(JsonNode root) {
        String ts = root.path("timestamp").asText(null);
        if (ts == null || ts.isBlank()) return Instant.now();
        try {
            return Instant.parse(ts);
        } catch (DateTimeParseException e) {
            return Instant.now();
        }
    }
}
