package com.shepherd.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shepherd.api.dto.RuleSet;
import com.shepherd.error.ConfigException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads {@code settings.json}:
 * <pre>
 * { "seed": "persona text", "rules": { "test-coverage": "...", "error-handling": "..." } }
 * </pre>
 * Rule order in the file is the order the rules are presented to the reasoning service.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RuleSetLoader {

    public static final String FILE_NAME = "settings.json";

    private final ObjectMapper om;
    private final ShepherdProperties props;

    /** The shared rule set, located through the usual lookup order. */
    public RuleSet loadDefault() {
        Path file = ConfigFiles.locate(props.getSettingsFile(), FILE_NAME)
                .orElseThrow(() -> new ConfigException("No shepherd settings found, searched: "
                        + ConfigFiles.candidates(props.getSettingsFile(), FILE_NAME)));
        return load(file);
    }

    /** A project specific file when given, otherwise the shared one. */
    public RuleSet loadFor(@Nullable Path override) {
        return override != null ? load(override) : loadDefault();
    }

    public RuleSet load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigException("Settings file not found: " + file);
        }
        JsonNode root;
        try {
            root = om.readTree(file.toFile());
        } catch (JsonProcessingException e) {
            throw new ConfigException("Invalid JSON in " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigException("Cannot read " + file, e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigException("Settings file " + file + " must contain a JSON object");
        }

        String seed = root.path("seed").isTextual() ? root.path("seed").asText() : null;
        JsonNode rulesNode = root.path("rules");
        Map<String, String> rules = new LinkedHashMap<>();
        if (!rulesNode.isMissingNode() && !rulesNode.isNull()) {
            if (!rulesNode.isObject()) {
                throw new ConfigException("'rules' in " + file + " must be an object of id -> description");
            }
            Iterator<Map.Entry<String, JsonNode>> it = rulesNode.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                if (!e.getValue().isTextual()) {
                    throw new ConfigException("Rule '" + e.getKey() + "' in " + file + " must have a text description");
                }
                rules.put(e.getKey(), e.getValue().asText());
            }
        }

        RuleSet ruleSet = RuleSet.of(seed, rules);
        log.info("[RuleSetLoader] loaded {} rule(s) from {}", ruleSet.userRules().size(), file);
        if (props.isVerbose()) {
            ruleSet.userRules().forEach(r -> log.info("[RuleSetLoader]   {}: {}", r.id(), r.description()));
        }
        return ruleSet;
    }
}
