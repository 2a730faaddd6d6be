package com.shepherd.config;

import com.shepherd.ai.AnalysisClient;
import com.shepherd.ai.impl.ClaudeCliAnalysisClient;
import com.shepherd.service.SuggestionChannel;
import com.shepherd.service.impl.FileSuggestionChannel;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 简单测试：确认 shepherd.* 能正确绑到 ShepherdProperties，并据此装配 bean。
 */
@SpringBootTest
class ShepherdPropertiesTest {

    @Autowired
    private ShepherdProperties props;

    @Autowired
    private AnalysisClient analysisClient;

    @Autowired
    private SuggestionChannel suggestionChannel;

    @Test
    void shouldBindShepherdConfig() {
        assertThat(props.getContextSize()).isEqualTo(7);
        assertThat(props.getHeartbeatInterval()).isEqualTo(3);
        assertThat(props.getPollInterval()).isEqualTo(Duration.ofMillis(50));
        assertThat(props.getRunner().isEnabled()).isFalse();

        assertThat(props.getBackoff().getInitial()).isEqualTo(Duration.ofMillis(500));
        assertThat(props.getBackoff().getMax()).isEqualTo(Duration.ofSeconds(4));
        assertThat(props.getBackoff().getMultiplier()).isEqualTo(3.0);

        assertThat(props.getAnalysis().getBackend()).isEqualTo(ShepherdProperties.Backend.CLAUDE_CLI);
        assertThat(props.getAnalysis().getTimeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(props.getAnalysis().getCliCommand()).isEqualTo("claude-test");
        assertThat(props.getAnalysis().isReformatMalformed()).isTrue();

        // 未配置的项保持默认值
        assertThat(props.getMaxPollBytes()).isEqualTo(4L * 1024 * 1024);
        assertThat(props.getShutdownGrace()).isEqualTo(Duration.ofSeconds(5));
        assertThat(props.getAnalysis().getProfile().getProvider()).isEqualTo("openai");
    }

    @Test
    void shouldWireBackendAndFeedbackFromConfig() {
        assertThat(analysisClient).isInstanceOf(ClaudeCliAnalysisClient.class);
        assertThat(suggestionChannel).isInstanceOf(FileSuggestionChannel.class);
        assertThat(suggestionChannel.enabled()).isTrue();
    }
}
