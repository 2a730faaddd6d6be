package com.shepherd.hook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shepherd.service.SuggestionChannel;
import com.shepherd.service.impl.FileSuggestionChannel;
import lombok.extern.slf4j.Slf4j;

import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Prompt-submit hook of the host tool. Reads the hook payload from stdin, looks up the pending
 * suggestion for {@code cwd} and prints it so the host adds it to the next turn.
 *
 * <p>Never fails the host: any problem ends with exit code 0 and nothing on stdout.</p>
 */
@Slf4j
public class SuggestionHook {

    static final String STATE_DIR_ENV = "SHEPHERD_STATE_DIR";

    private final ObjectMapper om;
    private final SuggestionChannel channel;

    public SuggestionHook(ObjectMapper om, SuggestionChannel channel) {
        this.om = om;
        this.channel = channel;
    }

    public static void main(String[] args) {
        SuggestionHook hook = new SuggestionHook(new ObjectMapper(),
                FileSuggestionChannel.underStateDir(stateDir()));
        System.exit(hook.run(System.in, System.out));
    }

    /** @return the process exit code, always 0 */
    public int run(InputStream in, PrintStream out) {
        try {
            JsonNode payload = om.readTree(in);
            String cwd = payload == null ? "" : payload.path("cwd").asText("");
            if (cwd.isBlank()) {
                return 0;
            }
            channel.consume(cwd).ifPresent(s -> {
                out.println(s);
                out.println();
            });
        } catch (Exception e) {
            log.debug("[Hook] no suggestion delivered: {}", e.toString());
        }
        out.flush();
        return 0;
    }

    static Path stateDir() {
        String explicit = System.getProperty("shepherd.state-dir", System.getenv(STATE_DIR_ENV));
        if (explicit != null && !explicit.isBlank()) {
            return Paths.get(explicit.trim());
        }
        return Paths.get(System.getProperty("user.home"), ".shepherd");
    }
}
