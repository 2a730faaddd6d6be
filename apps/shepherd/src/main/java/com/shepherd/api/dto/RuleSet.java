package com.shepherd.api.dto;

import com.shepherd.error.ConfigException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Persona plus the ordered rules a project is supervised against.
 *
 * <p>The built-in {@link #STOP_REQUEST_ID} rule is always evaluated and travels with the user
 * rules in one list, so stop requests come back as ordinary verdicts.</p>
 */
public record RuleSet(String persona, List<Rule> rules) {

    public static final String STOP_REQUEST_ID = "stop-request";
    public static final String DEFAULT_PERSONA = "Act as a software engineering supervisor";

    public static final Rule STOP_REQUEST = new Rule(STOP_REQUEST_ID,
            "The user explicitly asked the assistant to stop, pause or halt, and the assistant's "
                    + "later turns kept working instead of stopping and waiting for the user.");

    public RuleSet {
        persona = (persona == null || persona.isBlank()) ? DEFAULT_PERSONA : persona.trim();
        rules = List.copyOf(rules);
    }

    /**
     * Validates a user supplied id → description mapping once, keeps its order and appends the
     * built-in stop-request rule.
     */
    public static RuleSet of(String persona, Map<String, String> userRules) {
        List<Rule> out = new ArrayList<>();
        Map<String, String> seen = new LinkedHashMap<>();
        Map<String, String> source = (userRules == null) ? Map.of() : userRules;
        for (Map.Entry<String, String> e : source.entrySet()) {
            String id = e.getKey() == null ? "" : e.getKey().trim();
            String description = e.getValue() == null ? "" : e.getValue().trim();
            if (id.isEmpty()) {
                throw new ConfigException("Rule id must not be blank");
            }
            if (description.isEmpty()) {
                throw new ConfigException("Rule '" + id + "' has no description");
            }
            String folded = id.toLowerCase(Locale.ROOT);
            if (STOP_REQUEST_ID.equals(folded)) {
                throw new ConfigException("Rule id '" + id + "' is reserved for the built-in stop check");
            }
            if (seen.putIfAbsent(folded, id) != null) {
                throw new ConfigException("Rule id '" + id + "' is defined twice (ids are case-insensitive)");
            }
            out.add(new Rule(id, description));
        }
        out.add(STOP_REQUEST);
        return new RuleSet(persona, out);
    }

    /** Rules loaded from configuration, without the built-in one. */
    public List<Rule> userRules() {
        List<Rule> user = new ArrayList<>(rules);
        user.removeIf(r -> STOP_REQUEST_ID.equals(r.id()));
        return Collections.unmodifiableList(user);
    }

    /** Maps a rule id as echoed by the reasoning service back to the configured spelling. */
    public Optional<String> resolve(String rawId) {
        if (rawId == null) return Optional.empty();
        String folded = rawId.trim().toLowerCase(Locale.ROOT);
        for (Rule r : rules) {
            if (r.id().toLowerCase(Locale.ROOT).equals(folded)) {
                return Optional.of(r.id());
            }
        }
        return Optional.empty();
    }
}
