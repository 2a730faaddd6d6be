package com.shepherd.service.impl;

import com.shepherd.api.dto.Message;
import com.shepherd.config.ShepherdProperties;
import com.shepherd.error.LogAccessException;
import com.shepherd.service.LogHandle;
import com.shepherd.service.LogSource;
import com.shepherd.service.PollResult;
import com.shepherd.util.ProjectKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Tails the host tool's per-project session logs:
 * {@code <conversationsRoot>/<projectKey>/*.jsonl}.
 *
 * <ul>
 *   <li>the most recently modified {@code .jsonl} is the live session; a newer one means the
 *       session rotated and reading continues at the new file's tail</li>
 *   <li>a file shorter than the cursor was truncated; the cursor jumps to the tail</li>
 *   <li>only newline-terminated lines are consumed, a partial line is re-read next poll</li>
 *   <li>one poll reads at most {@code maxPollBytes}; the rest waits for the next poll. A line
 *       longer than that is scanned budget by budget and read whole once its newline arrives</li>
 * </ul>
 * Indices continue across rotations so the context window keeps the previous session's turns.
 */
@Slf4j
@Component
public class ClaudeJsonlLogSource implements LogSource {

    private static final String SUFFIX = ".jsonl";

    private final Path root;
    private final long maxPollBytes;
    private final ConversationLineParser parser;

    @Autowired
    public ClaudeJsonlLogSource(ShepherdProperties props, ConversationLineParser parser) {
        this(Paths.get(props.getConversationsRoot()), props.getMaxPollBytes(), parser);
    }

    public ClaudeJsonlLogSource(Path root, long maxPollBytes, ConversationLineParser parser) {
        this.root = root;
        this.maxPollBytes = maxPollBytes;
        this.parser = parser;
    }

    @Override
    public LogHandle open(String projectId) {
        if (!Files.isDirectory(root)) {
            throw new LogAccessException("Conversations directory not found: " + root);
        }
        if (!Files.isReadable(root)) {
            throw new LogAccessException("Conversations directory is not readable: " + root);
        }
        Path dir = root.resolve(ProjectKeys.keyFor(projectId));
        JsonlHandle h = new JsonlHandle(projectId, dir);
        Path newest = newestLog(dir);
        if (newest != null) {
            attachAtTail(h, newest);
            log.info("[LogSource] {}: found log {} starting at byte {}", projectId, newest.getFileName(), h.offset);
        } else {
            log.info("[LogSource] {}: no log yet under {}", projectId, dir);
        }
        return h;
    }

    @Override
    public PollResult poll(LogHandle handle) {
        JsonlHandle h = cast(handle);
        Path newest = newestLog(h.dir);
        if (newest == null) {
            if (h.file != null) {
                log.info("[LogSource] {}: log {} disappeared, waiting for a new one", h.projectId, h.file.getFileName());
                h.file = null;
                h.offset = 0;
            }
            return PollResult.unattached();
        }

        String rotation = null;
        if (h.file == null) {
            boolean reattach = h.seenAnyFile;
            attachAtTail(h, newest);
            if (reattach) {
                rotation = "new log " + newest.getFileName();
            }
            log.info("[LogSource] {}: attached to {}", h.projectId, newest.getFileName());
            return rotation == null ? PollResult.of(List.of()) : PollResult.rotated(rotation, List.of());
        }
        if (!newest.equals(h.file)) {
            rotation = "switched from " + h.file.getFileName() + " to " + newest.getFileName();
            attachAtTail(h, newest);
            return PollResult.rotated(rotation, List.of());
        }

        long size = sizeOf(h.file);
        if (size < h.offset) {
            rotation = "truncated " + h.file.getFileName() + " (" + size + " < " + h.offset + ")";
            h.offset = size;
            h.scanned = 0;
            return PollResult.rotated(rotation, List.of());
        }
        if (size == h.offset) {
            return PollResult.of(List.of());
        }
        return PollResult.of(readNew(h, size));
    }

    @Override
    public void resetToTail(LogHandle handle) {
        JsonlHandle h = cast(handle);
        if (h.file != null) {
            h.offset = sizeOf(h.file);
            h.scanned = 0;
        }
    }

    // ---------- internals ----------

    private List<Message> readNew(JsonlHandle h, long size) {
        if (h.scanned > 0) {
            return finishLongLine(h, size);
        }
        long unread = size - h.offset;
        long want = Math.min(unread, maxPollBytes);
        byte[] chunk = read(h.file, h.offset, want);
        int lastNewline = lastIndexOf(chunk, (byte) '\n');
        if (lastNewline < 0) {
            if (want < unread) {
                // a single line longer than the poll budget; look for its end on later polls
                h.scanned = chunk.length;
                log.debug("[LogSource] {}: line longer than {} bytes, still unterminated", h.projectId, maxPollBytes);
            }
            return List.of();
        }
        return consume(h, chunk, lastNewline);
    }

    /** Scans the next budget of bytes for the end of an oversized line and takes it whole once found. */
    private List<Message> finishLongLine(JsonlHandle h, long size) {
        long from = h.offset + h.scanned;
        long want = Math.min(size - from, maxPollBytes);
        if (want <= 0) {
            if (size < from) {
                h.scanned = 0;
            }
            return List.of();
        }
        byte[] next = read(h.file, from, want);
        int newline = indexOf(next, (byte) '\n');
        if (newline < 0) {
            h.scanned += next.length;
            return List.of();
        }
        long lineEnd = h.scanned + newline;
        h.scanned = 0;
        byte[] chunk = read(h.file, h.offset, lineEnd + 1);
        return consume(h, chunk, chunk.length - 1);
    }

    private List<Message> consume(JsonlHandle h, byte[] chunk, int lastNewline) {
        List<Message> out = new ArrayList<>();
        int start = 0;
        for (int i = 0; i <= lastNewline; i++) {
            if (chunk[i] != '\n') continue;
            String line = new String(chunk, start, i - start, StandardCharsets.UTF_8);
            start = i + 1;
            parser.parse(line).ifPresent(t ->
                    out.add(new Message(++h.lastIndex, t.role(), t.content(), t.timestamp())));
        }
        h.offset += lastNewline + 1;
        return out;
    }

    private static byte[] read(Path file, long position, long length) {
        int len = (int) Math.min(length, Integer.MAX_VALUE - 8);
        ByteBuffer buf = ByteBuffer.allocate(len);
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ)) {
            ch.position(position);
            while (buf.hasRemaining()) {
                if (ch.read(buf) < 0) break;
            }
        } catch (IOException e) {
            throw new LogAccessException("Cannot read " + file, e);
        }
        byte[] out = new byte[buf.position()];
        buf.flip();
        buf.get(out);
        return out;
    }

    private static int indexOf(byte[] data, byte b) {
        for (int i = 0; i < data.length; i++) {
            if (data[i] == b) return i;
        }
        return -1;
    }

    private static int lastIndexOf(byte[] data, byte b) {
        for (int i = data.length - 1; i >= 0; i--) {
            if (data[i] == b) return i;
        }
        return -1;
    }

    private static void attachAtTail(JsonlHandle h, Path file) {
        h.file = file;
        h.offset = sizeOf(file);
        h.scanned = 0;
        h.seenAnyFile = true;
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (NoSuchFileException e) {
            return 0L;
        } catch (IOException e) {
            throw new LogAccessException("Cannot stat " + file, e);
        }
    }

    @Nullable
    private static Path newestLog(Path dir) {
        if (!Files.isDirectory(dir)) {
            return null;
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                    .filter(Files::isRegularFile)
                    .max(Comparator.comparing(ClaudeJsonlLogSource::modified)
                            .thenComparing(p -> p.getFileName().toString()))
                    .orElse(null);
        } catch (IOException e) {
            throw new LogAccessException("Cannot list " + dir, e);
        }
    }

    private static FileTime modified(Path p) {
        try {
            return Files.getLastModifiedTime(p);
        } catch (IOException e) {
            return FileTime.fromMillis(0);
        }
    }

    private static JsonlHandle cast(LogHandle handle) {
        if (handle instanceof JsonlHandle h) {
            return h;
        }
        throw new IllegalArgumentException("Handle was not opened by this log source: " + handle);
    }

    static final class JsonlHandle implements LogHandle {
        final String projectId;
        final Path dir;
        Path file;
        long offset;
        long lastIndex;
        // bytes past offset already known to hold no newline
        long scanned;
        boolean seenAnyFile;

        JsonlHandle(String projectId, Path dir) {
            this.projectId = projectId;
            this.dir = dir;
        }

        @Override public String projectId() { return projectId; }
        @Override public boolean attached() { return file != null; }
        @Override public Path currentFile() { return file; }

        @Override
        public String toString() {
            return "JsonlHandle[" + projectId + " -> " + file + "@" + offset + "]";
        }
    }
}
