package com.shepherd;

import com.shepherd.ai.AnalysisClient;
import com.shepherd.api.dto.ProjectDefinition;
import com.shepherd.config.ProjectListLoader;
import com.shepherd.config.ShepherdProperties;
import com.shepherd.error.AnalysisServiceException;
import com.shepherd.error.ConfigException;
import com.shepherd.monitor.Orchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry: positional arguments and {@code shepherd.projects} name the projects,
 * otherwise {@code projects.json} does. Refuses to start when the analysis backend is unusable;
 * otherwise blocks until every supervisor has stopped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "shepherd.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ShepherdRunner implements ApplicationRunner {

    private final ShepherdProperties props;
    private final ProjectListLoader projectListLoader;
    private final Orchestrator orchestrator;
    private final AnalysisClient analysisClient;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        checkBackend();
        List<ProjectDefinition> projects = resolveProjects(args.getNonOptionArgs());
        log.info("[Runner] supervising {} project(s), contextSize={}, heartbeat every {}, feedback={}",
                projects.size(), props.getContextSize(), props.getHeartbeatInterval(), props.getFeedback().isEnabled());
        orchestrator.start(projects);
        orchestrator.awaitTermination();
        log.info("[Runner] all supervisors stopped");
    }

    private void checkBackend() {
        try {
            String ready = analysisClient.checkReady().block();
            log.info("[Runner] analysis backend {} is ready: {}", props.getAnalysis().getBackend(), ready);
        } catch (AnalysisServiceException e) {
            log.error("[Runner] analysis backend {} is not usable: {}", props.getAnalysis().getBackend(), e.getMessage());
            throw new ConfigException("Analysis backend unavailable: " + e.getMessage(), e);
        }
    }

    List<ProjectDefinition> resolveProjects(List<String> positional) {
        List<String> paths = new ArrayList<>(props.getProjects());
        paths.addAll(positional);
        List<ProjectDefinition> out = paths.stream()
                .filter(StringUtils::hasText)
                .map(p -> ProjectDefinition.of(p.trim()))
                .toList();
        return out.isEmpty() ? projectListLoader.loadDefault() : out;
    }
}
