package com.shepherd.util;

import java.nio.file.Path;

/**
 * The host tool names per-project directories after the project path with every
 * {@code /} replaced by {@code -}, e.g. {@code /home/me/app -> -home-me-app}.
 */
public final class ProjectKeys {
    private ProjectKeys() {}

    public static String keyFor(String projectPath) {
        String normalized = Path.of(projectPath).toAbsolutePath().normalize().toString();
        return normalized.replace('\\', '/').replace('/', '-');
    }

    public static String keyFor(Path projectPath) {
        return keyFor(projectPath.toString());
    }
}
