package com.shepherd.config;

import com.shepherd.ai.AnalysisChatModelFactory;
import com.shepherd.ai.AnalysisClient;
import com.shepherd.ai.impl.ChatModelAnalysisClient;
import com.shepherd.ai.impl.ClaudeCliAnalysisClient;
import com.shepherd.ai.impl.CliProcessRunner;
import com.shepherd.service.SuggestionChannel;
import com.shepherd.service.impl.DisabledSuggestionChannel;
import com.shepherd.service.impl.FileSuggestionChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;

/**
 * Picks the analysis backend and the suggestion channel from {@link ShepherdProperties}.
 *
 * <p>{@code analysis.backend=claude-cli} shells out to the assistant CLI; {@code chat-model}
 * builds a Spring AI {@code ChatModel} from {@code analysis.profile.*}. Feedback off means the
 * inert channel.</p>
 */
@Configuration
@EnableConfigurationProperties(ShepherdProperties.class)
@Slf4j
public class ShepherdConfig {

    private final ShepherdProperties properties;

    public ShepherdConfig(ShepherdProperties properties) {
        this.properties = properties;
    }

    @Bean
    public CliProcessRunner cliProcessRunner() {
        return new CliProcessRunner();
    }

    @Bean
    public AnalysisClient analysisClient(AnalysisChatModelFactory chatModelFactory, CliProcessRunner runner) {
        ShepherdProperties.Analysis a = properties.getAnalysis();
        boolean verbose = properties.isVerbose();
        AnalysisClient client = switch (a.getBackend()) {
            case CLAUDE_CLI -> new ClaudeCliAnalysisClient(a.getCliCommand(), a.getTimeout(),
                    a.isReformatMalformed(), verbose, runner);
            case CHAT_MODEL -> new ChatModelAnalysisClient(chatModelFactory.create(a.getProfile()),
                    a.isReformatMalformed(), verbose);
        };
        log.info("[ShepherdConfig] analysis backend={} timeout={}", a.getBackend(), a.getTimeout());
        return client;
    }

    @Bean
    public SuggestionChannel suggestionChannel() {
        ShepherdProperties.Feedback f = properties.getFeedback();
        if (!f.isEnabled()) {
            log.info("[ShepherdConfig] feedback disabled, suggestions stay in the alert stream");
            return new DisabledSuggestionChannel();
        }
        FileSuggestionChannel channel = FileSuggestionChannel.underStateDir(Paths.get(f.getStateDir()));
        log.info("[ShepherdConfig] feedback enabled, suggestions under {}", Paths.get(f.getStateDir()).resolve(FileSuggestionChannel.SUBDIR));
        return channel;
    }
}
