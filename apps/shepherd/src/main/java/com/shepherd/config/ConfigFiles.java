package com.shepherd.config;

import org.springframework.util.StringUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Lookup order for shepherd's JSON files: explicit path, ./.shepherd, ~/.shepherd. */
final class ConfigFiles {
    private ConfigFiles() {}

    static List<Path> candidates(String explicit, String fileName) {
        List<Path> out = new ArrayList<>();
        if (StringUtils.hasText(explicit)) {
            out.add(Paths.get(explicit.trim()));
            return out;
        }
        out.add(Paths.get(".shepherd", fileName));
        out.add(Paths.get(System.getProperty("user.home"), ".shepherd", fileName));
        return out;
    }

    static Optional<Path> locate(String explicit, String fileName) {
        return candidates(explicit, fileName).stream().filter(Files::isRegularFile).findFirst();
    }
}
