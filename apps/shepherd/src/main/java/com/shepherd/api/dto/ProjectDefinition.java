package com.shepherd.api.dto;

import org.springframework.lang.Nullable;

import java.nio.file.Path;

/** A project to supervise, optionally with its own settings file instead of the shared one. */
public record ProjectDefinition(Path path, @Nullable Path settingsFile) {

    public ProjectDefinition {
        path = path.toAbsolutePath().normalize();
    }

    public static ProjectDefinition of(String path) {
        return new ProjectDefinition(Path.of(path), null);
    }

    public String projectId() {
        return path.toString();
    }
}
