package com.shepherd.hook;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shepherd.service.impl.FileSuggestionChannel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class SuggestionHookTest {

    @TempDir
    Path stateDir;

    private String runHook(FileSuggestionChannel channel, String stdin) {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buf, true, StandardCharsets.UTF_8);
        int code = new SuggestionHook(new ObjectMapper(), channel)
                .run(new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)), out);
        assertEquals(0, code);
        return buf.toString(StandardCharsets.UTF_8);
    }

    @Test
    void printsPendingSuggestionOnceFollowedByBlankLine() {
        FileSuggestionChannel channel = FileSuggestionChannel.underStateDir(stateDir);
        channel.publish("/home/me/app", "add unit tests");

        String first = runHook(channel, "{\"cwd\": \"/home/me/app\", \"prompt\": \"go on\"}");
        String second = runHook(channel, "{\"cwd\": \"/home/me/app\"}");

        assertEquals("add unit tests" + System.lineSeparator() + System.lineSeparator(), first);
        assertThat(second).isEmpty();
    }

    @Test
    void neverFailsTheHost() {
        FileSuggestionChannel channel = FileSuggestionChannel.underStateDir(stateDir);
        assertThat(runHook(channel, "not json at all")).isEmpty();
        assertThat(runHook(channel, "{}")).isEmpty();
        assertThat(runHook(channel, "")).isEmpty();
    }
}
