package com.shepherd.monitor;

import com.shepherd.api.dto.MonitorEvent;
import com.shepherd.api.dto.MonitorEvent.FailureKind;
import com.shepherd.api.dto.ProjectDefinition;
import com.shepherd.api.dto.ProjectStatus;
import com.shepherd.config.ShepherdProperties;
import com.shepherd.error.ConfigException;
import com.shepherd.infra.EventHub;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one {@link ProjectSupervisor} per project, each on its own thread, and merges their
 * events into the {@link EventHub}. A supervisor that fails or stops leaves the active set
 * without touching the others; the orchestrator terminates once none is left.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class Orchestrator {

    private final SupervisorFactory factory;
    private final EventHub hub;
    private final ShepherdProperties props;

    private final Map<String, ProjectSupervisor> active = new ConcurrentHashMap<>();
    private final Map<String, ProjectSupervisor> started = new ConcurrentHashMap<>();
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final AtomicBoolean launched = new AtomicBoolean();
    private final AtomicBoolean shuttingDown = new AtomicBoolean();

    private volatile boolean launchComplete;
    private volatile ExecutorService executor;

    /** Starts a supervisor for every distinct project. May be called once. */
    public synchronized void start(List<ProjectDefinition> projects) {
        if (!launched.compareAndSet(false, true)) {
            throw new IllegalStateException("Orchestrator already started");
        }
        executor = Executors.newCachedThreadPool(new SupervisorThreads());
        log.info("[Orchestrator] starting {} project(s)", projects.size());

        for (ProjectDefinition def : projects) {
            String id = def.projectId();
            if (started.containsKey(id)) {
                log.warn("[Orchestrator] {} listed twice, starting it once", id);
                continue;
            }
            ProjectSupervisor supervisor;
            try {
                supervisor = factory.create(def, hub::publish);
            } catch (ConfigException e) {
                log.error("[Orchestrator] {}: not started: {}", id, e.getMessage());
                hub.publish(MonitorEvent.failure(id, FailureKind.CONFIG, e));
                hub.publish(MonitorEvent.stopped(id, "configuration error"));
                continue;
            }
            started.put(id, supervisor);
            active.put(id, supervisor);
            CompletableFuture.runAsync(supervisor, executor)
                    .whenComplete((v, err) -> onSupervisorEnded(supervisor, err));
        }

        launchComplete = true;
        if (active.isEmpty()) {
            log.warn("[Orchestrator] no project is being supervised");
            terminated.countDown();
        }
    }

    private void onSupervisorEnded(ProjectSupervisor supervisor, Throwable err) {
        String id = supervisor.projectId();
        active.remove(id);
        if (err != null) {
            // run() 已经兜住 RuntimeException，这里只剩 Error
            log.error("[Orchestrator] {}: supervisor died", id, err);
            hub.publish(MonitorEvent.failure(id, FailureKind.SUPERVISOR_CRASH, err));
            if (supervisor.state() != SupervisorState.STOPPED) {
                hub.publish(MonitorEvent.stopped(id, "crashed"));
            }
        }
        log.info("[Orchestrator] {} left the active set (state={}), {} still running",
                id, supervisor.state(), active.size());
        if (launchComplete && active.isEmpty()) {
            terminated.countDown();
        }
    }

    public Flux<MonitorEvent> events() {
        return hub.events();
    }

    public Set<String> activeProjects() {
        return Set.copyOf(active.keySet());
    }

    /** Status of every project that was started, including the ones that already stopped. */
    public List<ProjectStatus> status() {
        return started.values().stream()
                .map(ProjectSupervisor::status)
                .sorted(Comparator.comparing(ProjectStatus::projectId))
                .toList();
    }

    public void awaitTermination() throws InterruptedException {
        terminated.await();
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stops every supervisor. Each gets the shutdown grace to finish its in-flight analysis;
     * threads still running after that are interrupted.
     */
    @PreDestroy
    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        ExecutorService ex = executor;
        if (ex != null) {
            log.info("[Orchestrator] stopping {} supervisor(s)", active.size());
            active.values().forEach(ProjectSupervisor::requestStop);
            ex.shutdown();
            Duration wait = props.getShutdownGrace().plus(props.getPollInterval()).plusSeconds(1);
            try {
                if (!ex.awaitTermination(wait.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("[Orchestrator] supervisors still running after {}, interrupting", wait);
                    ex.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                ex.shutdownNow();
            }
            long messages = started.values().stream().mapToLong(ProjectSupervisor::messagesProcessed).sum();
            long alerts = started.values().stream().mapToLong(ProjectSupervisor::alertsRaised).sum();
            log.info("[Orchestrator] summary: {} project(s), {} messages processed, {} alerts raised",
                    started.size(), messages, alerts);
        }
        terminated.countDown();
    }

    private static final class SupervisorThreads implements ThreadFactory {
        private final AtomicInteger seq = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "shepherd-supervisor-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
