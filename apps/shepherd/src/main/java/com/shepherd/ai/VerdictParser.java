package com.shepherd.ai;

import com.shepherd.api.dto.RuleSet;
import com.shepherd.api.dto.Verdict;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the plain text answer format:
 * <pre>
 * ALERT: rule-id
 * REASON: why, may continue on following lines
 * SUGGESTION: optional advice
 * </pre>
 * No {@code ALERT:} at all means no violations.
 */
@Slf4j
public final class VerdictParser {

    static final String ALERT = "ALERT:";
    static final String REASON = "REASON:";
    static final String SUGGESTION = "SUGGESTION:";

    private VerdictParser() {}

    /**
     * @param wellFormed false when the text mentions an alert but does not open with one, or a
     *                   block lacks its id or reason
     */
    public record Parsed(List<Verdict> verdicts, boolean wellFormed) {
        public boolean isEmpty() { return verdicts.isEmpty(); }
    }

    public static Parsed parse(String raw, RuleSet ruleSet) {
        String text = raw == null ? "" : raw.strip();
        if (!text.contains(ALERT)) {
            return new Parsed(List.of(), true);
        }

        List<Block> blocks = new ArrayList<>();
        boolean wellFormed = true;
        Block current = null;
        String section = null;

        for (String rawLine : text.split("\\R")) {
            String line = unquote(rawLine.strip());
            if (line.isEmpty() || line.startsWith("```")) {
                continue;
            }
            if (line.startsWith(ALERT)) {
                current = new Block(cleanId(line.substring(ALERT.length())));
                blocks.add(current);
                section = null;
            } else if (current == null) {
                // 开头不是 ALERT:，说明模型加了前言
                wellFormed = false;
            } else if (line.startsWith(REASON)) {
                current.reason.append(line.substring(REASON.length()).strip());
                section = REASON;
            } else if (line.startsWith(SUGGESTION)) {
                current.suggestion.append(line.substring(SUGGESTION.length()).strip());
                section = SUGGESTION;
            } else if (REASON.equals(section)) {
                appendLine(current.reason, line);
            } else if (SUGGESTION.equals(section)) {
                appendLine(current.suggestion, line);
            }
        }

        List<Verdict> verdicts = new ArrayList<>();
        for (Block b : blocks) {
            if (b.id.isEmpty() || b.reason.length() == 0) {
                wellFormed = false;
            }
            if (b.id.isEmpty()) {
                continue;
            }
            String ruleId = ruleSet.resolve(b.id).orElseGet(() -> {
                log.warn("[VerdictParser] unknown rule id '{}' in analysis response, keeping it verbatim", b.id);
                return b.id;
            });
            String suggestion = b.suggestion.toString().strip();
            verdicts.add(Verdict.of(ruleId, b.reason.toString().strip(), suggestion.isEmpty() ? null : suggestion));
        }
        return new Parsed(List.copyOf(verdicts), wellFormed);
    }

    /** Strips the quotes, brackets, backticks and emphasis models like to put around ids. */
    static String cleanId(String raw) {
        String id = raw.strip();
        int start = 0;
        int end = id.length();
        while (start < end && isDecoration(id.charAt(start))) start++;
        while (end > start && isDecoration(id.charAt(end - 1))) end--;
        return id.substring(start, end).strip();
    }

    private static boolean isDecoration(char c) {
        return c == '"' || c == '\'' || c == '`' || c == '[' || c == ']' || c == '*' || c == '<' || c == '>';
    }

    private static String unquote(String line) {
        String s = line;
        if (s.startsWith("\"")) s = s.substring(1);
        if (s.endsWith("\"") && !s.endsWith("\\\"")) s = s.substring(0, s.length() - 1);
        return s.strip();
    }

    private static void appendLine(StringBuilder sb, String line) {
        if (sb.length() > 0) sb.append(' ');
        sb.append(line);
    }

    private static final class Block {
        final String id;
        final StringBuilder reason = new StringBuilder();
        final StringBuilder suggestion = new StringBuilder();

        Block(String id) {
            this.id = id;
        }
    }
}
