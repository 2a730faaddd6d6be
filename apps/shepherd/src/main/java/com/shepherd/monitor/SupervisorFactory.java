package com.shepherd.monitor;

import com.shepherd.ai.AnalysisClient;
import com.shepherd.api.dto.MonitorEvent;
import com.shepherd.api.dto.ProjectDefinition;
import com.shepherd.api.dto.RuleSet;
import com.shepherd.config.RuleSetLoader;
import com.shepherd.config.ShepherdProperties;
import com.shepherd.error.ConfigException;
import com.shepherd.service.LogSource;
import com.shepherd.service.SuggestionChannel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Files;
import java.time.Clock;
import java.util.function.Consumer;

/** Validates a project definition and wires a supervisor for it. */
@Slf4j
@Component
@RequiredArgsConstructor
public class SupervisorFactory {

    private final ShepherdProperties props;
    private final RuleSetLoader ruleSetLoader;
    private final LogSource logSource;
    private final AnalysisClient analysisClient;
    private final SuggestionChannel suggestionChannel;

    /**
     * @throws ConfigException when the project directory is missing or its rules do not load
     */
    public ProjectSupervisor create(ProjectDefinition def, Consumer<MonitorEvent> events) {
        if (!Files.isDirectory(def.path())) {
            throw new ConfigException("Project directory does not exist: " + def.path());
        }
        RuleSet rules = ruleSetLoader.loadFor(def.settingsFile());
        log.debug("[SupervisorFactory] {}: {} rule(s), feedback={}", def.projectId(), rules.rules().size(),
                suggestionChannel.enabled());
        return new ProjectSupervisor(def.projectId(), rules, logSource, analysisClient, suggestionChannel,
                events, SupervisorSettings.from(props), Schedulers.boundedElastic(), Clock.systemUTC());
    }
}
