package com.shepherd.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runtime parameters of the supervision engine.
 *
 * <p>yml 结构：</p>
 * <pre>
 * shepherd:
 *   projects: [/path/to/project]
 *   context-size: 10
 *   heartbeat-interval: 10
 *   feedback:
 *     enabled: true
 *   analysis:
 *     backend: claude-cli
 *     timeout: PT30S
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "shepherd")
public class ShepherdProperties {

    public enum Backend {
        CLAUDE_CLI, CHAT_MODEL
    }

    /** Project paths given directly; when empty the projects file is consulted. */
    private List<String> projects = new ArrayList<>();

    /** Explicit projects.json location (optional). */
    private String projectsFile;

    /** Explicit settings.json location (optional). */
    private String settingsFile;

    /** Where the host tool keeps per-project conversation logs. */
    @NotBlank
    private String conversationsRoot = System.getProperty("user.home") + "/.claude/projects";

    private boolean verbose = false;

    /** Heartbeat every N processed messages; 0 disables. */
    @Min(0)
    private int heartbeatInterval = 10;

    /** Context window capacity K. */
    @Min(1)
    private int contextSize = 10;

    @NotNull
    private Duration pollInterval = Duration.ofMillis(100);

    /** Upper bound on bytes read from a log in one poll. */
    @Min(1024)
    private long maxPollBytes = 4L * 1024 * 1024;

    /** How long an in-flight analysis may still finish once shutdown starts. */
    @NotNull
    private Duration shutdownGrace = Duration.ofSeconds(5);

    @Valid
    private Backoff backoff = new Backoff();
    @Valid
    private Feedback feedback = new Feedback();
    @Valid
    private Analysis analysis = new Analysis();
    private Runner runner = new Runner();

    @Data
    public static class Backoff {
        @NotNull
        private Duration initial = Duration.ofSeconds(1);
        @NotNull
        private Duration max = Duration.ofSeconds(30);
        @DecimalMin("1.0")
        private double multiplier = 2.0;
    }

    @Data
    public static class Feedback {
        /** Write suggestions for the host hook to pick up. */
        private boolean enabled = false;
        @NotBlank
        private String stateDir = System.getProperty("user.home") + "/.shepherd";
    }

    @Data
    public static class Analysis {
        @NotNull
        private Backend backend = Backend.CLAUDE_CLI;
        @NotNull
        private Duration timeout = Duration.ofSeconds(30);
        /** Ask the service once more to fix a response that breaks the answer format. */
        private boolean reformatMalformed = true;
        @NotBlank
        private String cliCommand = "claude";
        @Valid
        private ModelProfile profile = new ModelProfile();
    }

    @Data
    public static class ModelProfile {
        /**
         * 提供方：
         *   - openai / openai-compatible / deepseek → OpenAI 协议
         *   - ollama
         */
        private String provider = "openai";
        private String baseUrl;
        private String apiKey;
        private String modelId = "gpt-4o-mini";
        private Double temperature;
    }

    @Data
    public static class Runner {
        /** Start supervising as soon as the application is up. Tests switch this off. */
        private boolean enabled = true;
    }
}
