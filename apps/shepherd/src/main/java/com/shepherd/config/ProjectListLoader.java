package com.shepherd.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shepherd.api.dto.ProjectDefinition;
import com.shepherd.error.ConfigException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@code projects.json} for multi-project mode. Entries are either a path or
 * {@code {"path": "...", "settings": "..."}} when a project brings its own rules.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProjectListLoader {

    public static final String FILE_NAME = "projects.json";

    private final ObjectMapper om;
    private final ShepherdProperties props;

    public List<ProjectDefinition> loadDefault() {
        Path file = ConfigFiles.locate(props.getProjectsFile(), FILE_NAME)
                .orElseThrow(() -> new ConfigException("No projects config found, searched: "
                        + ConfigFiles.candidates(props.getProjectsFile(), FILE_NAME)
                        + " (expected {\"projects\": [\"/path/to/project\"]})"));
        return load(file);
    }

    public List<ProjectDefinition> load(Path file) {
        JsonNode root;
        try {
            root = om.readTree(file.toFile());
        } catch (JsonProcessingException e) {
            throw new ConfigException("Invalid JSON in " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigException("Cannot read " + file, e);
        }
        JsonNode list = root == null ? null : root.path("projects");
        if (list == null || !list.isArray() || list.isEmpty()) {
            throw new ConfigException("No projects found in " + file);
        }

        List<ProjectDefinition> out = new ArrayList<>();
        for (JsonNode entry : list) {
            if (entry.isTextual() && StringUtils.hasText(entry.asText())) {
                out.add(ProjectDefinition.of(entry.asText().trim()));
            } else if (entry.isObject() && StringUtils.hasText(entry.path("path").asText(""))) {
                String settings = entry.path("settings").asText("");
                out.add(new ProjectDefinition(Path.of(entry.path("path").asText().trim()),
                        StringUtils.hasText(settings) ? Path.of(settings.trim()) : null));
            } else {
                log.warn("[ProjectListLoader] skipping unusable entry {} in {}", entry, file);
            }
        }
        if (out.isEmpty()) {
            throw new ConfigException("No usable project entries in " + file);
        }
        log.info("[ProjectListLoader] loaded {} project(s) from {}", out.size(), file);
        return out;
    }
}
