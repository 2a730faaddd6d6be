package com.shepherd.service.impl;

import com.shepherd.error.SuggestionWriteException;
import com.shepherd.service.SuggestionChannel;
import com.shepherd.util.ProjectKeys;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.UUID;

/**
 * One file per project: {@code <suggestionsDir>/<projectKey>.md}.
 *
 * <p>Writes go to a temp file in the same directory and are renamed over the target, so the hook
 * never sees half a suggestion. Consumers first rename the file to a private claim name, which
 * keeps a concurrent overwrite from being deleted unread.</p>
 */
@Slf4j
public class FileSuggestionChannel implements SuggestionChannel {

    public static final String SUBDIR = "suggestions";

    private final Path dir;

    public FileSuggestionChannel(Path suggestionsDir) {
        this.dir = suggestionsDir;
    }

    /** Channel rooted at {@code <stateDir>/suggestions}. */
    public static FileSuggestionChannel underStateDir(Path stateDir) {
        return new FileSuggestionChannel(stateDir.resolve(SUBDIR));
    }

    @Override
    public boolean enabled() {
        return true;
    }

    public Path fileFor(String projectId) {
        return dir.resolve(ProjectKeys.keyFor(projectId) + ".md");
    }

    @Override
    public void publish(String projectId, String suggestion) {
        Path target = fileFor(projectId);
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
            Files.writeString(tmp, suggestion.trim(), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("[Suggestion] wrote {} ({} chars)", target, suggestion.length());
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new SuggestionWriteException("Cannot write suggestion file " + target, e);
        }
    }

    @Override
    public Optional<String> consume(String projectId) {
        Path target = fileFor(projectId);
        if (!Files.exists(target)) {
            return Optional.empty();
        }
        Path claimed = target.resolveSibling(target.getFileName() + ".claimed-" + UUID.randomUUID());
        try {
            Files.move(target, claimed, StandardCopyOption.ATOMIC_MOVE);
        } catch (NoSuchFileException e) {
            return Optional.empty(); // 另一个消费者先拿走了
        } catch (IOException e) {
            log.debug("[Suggestion] cannot claim {}: {}", target, e.toString());
            return Optional.empty();
        }
        try {
            String text = Files.readString(claimed, StandardCharsets.UTF_8).trim();
            return text.isEmpty() ? Optional.empty() : Optional.of(text);
        } catch (IOException e) {
            log.debug("[Suggestion] cannot read {}: {}", claimed, e.toString());
            return Optional.empty();
        } finally {
            deleteQuietly(claimed);
        }
    }

    private static void deleteQuietly(Path p) {
        if (p == null) return;
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.debug("[Suggestion] cannot delete {}: {}", p, e.toString());
        }
    }
}
