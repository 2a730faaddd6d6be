package com.shepherd.api.dto;

import com.shepherd.error.ConfigException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class RuleSetTest {

    @Test
    void idsAreCaseInsensitiveForDuplicatesAndLookup() {
        Map<String, String> rules = new LinkedHashMap<>();
        rules.put("Test-Coverage", "No tests");
        rules.put("test-coverage", "Again");

        assertThatThrownBy(() -> RuleSet.of(null, rules))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("defined twice");

        RuleSet rs = RuleSet.of(null, Map.of("Test-Coverage", "No tests"));
        assertThat(rs.resolve(" test-COVERAGE ")).contains("Test-Coverage");
        assertThat(rs.resolve("STOP-REQUEST")).contains(RuleSet.STOP_REQUEST_ID);
        assertThat(rs.resolve("unknown")).isEmpty();
    }

    @Test
    void blankIdIsRejected() {
        assertThatThrownBy(() -> RuleSet.of(null, Map.of(" ", "x"))).isInstanceOf(ConfigException.class);
    }

    @Test
    void verdictForStopRequestIsFlagged() {
        assertThat(Verdict.of(RuleSet.STOP_REQUEST_ID, "r", null).stopRequest()).isTrue();
        assertThat(Verdict.of("test-coverage", "r", " ").hasSuggestion()).isFalse();
        assertEquals(RuleSet.DEFAULT_PERSONA, RuleSet.of("  ", Map.of()).persona());
    }
}
