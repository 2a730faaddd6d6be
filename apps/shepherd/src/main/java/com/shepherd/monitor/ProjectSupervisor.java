package com.shepherd.monitor;

import com.shepherd.ai.AnalysisClient;
import com.shepherd.api.dto.AnalysisRequest;
import com.shepherd.api.dto.ContextSnapshot;
import com.shepherd.api.dto.Message;
import com.shepherd.api.dto.MonitorEvent;
import com.shepherd.api.dto.MonitorEvent.FailureKind;
import com.shepherd.api.dto.ProjectStatus;
import com.shepherd.api.dto.RegisterOutcome;
import com.shepherd.api.dto.RuleSet;
import com.shepherd.api.dto.Verdict;
import com.shepherd.api.dto.Violation;
import com.shepherd.error.AnalysisServiceException;
import com.shepherd.error.LogAccessException;
import com.shepherd.error.SuggestionWriteException;
import com.shepherd.service.LogHandle;
import com.shepherd.service.LogSource;
import com.shepherd.service.PollResult;
import com.shepherd.service.SuggestionChannel;
import lombok.extern.slf4j.Slf4j;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Supervises one project: tails its log into a {@link ContextWindow}, sends the newest message
 * for analysis and turns fresh verdicts into alerts.
 *
 * <p>State machine: {@code WAITING_LOGS → IDLE ⇄ ANALYZING}, {@code ERROR_BACKOFF} after a failed
 * round, terminal {@code STOPPED}. At most one analysis call is in flight. Window, ledger and
 * counters are written only by the thread running {@link #tick()}; a finished call is picked up
 * and applied on that same thread, so verdicts are applied in increasing message order.</p>
 */
@Slf4j
public class ProjectSupervisor implements Runnable {

    private final String projectId;
    private final RuleSet ruleSet;
    private final LogSource logSource;
    private final AnalysisClient analysisClient;
    private final SuggestionChannel suggestions;
    private final Consumer<MonitorEvent> events;
    private final SupervisorSettings settings;
    private final Scheduler analysisScheduler;
    private final Clock clock;

    private final ContextWindow window;
    private final ViolationLedger ledger = new ViolationLedger();
    private final Backoff backoff;

    private volatile SupervisorState state = SupervisorState.WAITING_LOGS;
    private volatile boolean stopRequested;
    private volatile long messagesProcessed;
    private volatile long alertsRaised;
    private volatile int activeViolations;

    private LogHandle handle;
    private long highestIndex;
    private long lastDispatchedIndex;
    private boolean rebaseAfterGap;
    private boolean logErrorReported;
    private InFlight inFlight;
    private Instant backoffUntil = Instant.EPOCH;

    /** The one outstanding analysis call and the message index it was dispatched for. */
    private record InFlight(CompletableFuture<List<Verdict>> future, long index, long previousDispatched) {}

    public ProjectSupervisor(String projectId,
                             RuleSet ruleSet,
                             LogSource logSource,
                             AnalysisClient analysisClient,
                             SuggestionChannel suggestions,
                             Consumer<MonitorEvent> events,
                             SupervisorSettings settings,
                             Scheduler analysisScheduler,
                             Clock clock) {
        this.projectId = projectId;
        this.ruleSet = ruleSet;
        this.logSource = logSource;
        this.analysisClient = analysisClient;
        this.suggestions = suggestions;
        this.events = events;
        this.settings = settings;
        this.analysisScheduler = analysisScheduler;
        this.clock = clock;
        this.window = new ContextWindow(settings.contextSize());
        this.backoff = new Backoff(settings.backoffInitial(), settings.backoffMax(), settings.backoffMultiplier());
    }

    // ---------- lifecycle ----------

    /**
     * Attaches to the project's log. A log location that cannot be read at all stops the
     * supervisor; a log that does not exist yet only keeps it in {@code WAITING_LOGS}.
     *
     * @return false when the supervisor stopped
     */
    public boolean open() {
        if (state == SupervisorState.STOPPED) {
            return false;
        }
        try {
            handle = logSource.open(projectId);
        } catch (LogAccessException e) {
            log.error("[Supervisor] {}: cannot access conversation log: {}", projectId, e.getMessage());
            emit(MonitorEvent.failure(projectId, FailureKind.LOG_ACCESS, e));
            markStopped("log not accessible");
            return false;
        }
        state = handle.attached() ? SupervisorState.IDLE : SupervisorState.WAITING_LOGS;
        log.info("[Supervisor] {}: monitoring started (rules={}, contextSize={}, state={})",
                projectId, ruleSet.rules().size(), settings.contextSize(), state);
        return true;
    }

    /** Polls until {@link #requestStop()}; then lets an in-flight call finish within the grace period. */
    @Override
    public void run() {
        String reason = "shutdown";
        try {
            if (handle == null && !open()) {
                return;
            }
            while (!stopRequested && state != SupervisorState.STOPPED) {
                tick();
                TimeUnit.MILLISECONDS.sleep(settings.pollInterval().toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            reason = "interrupted";
        } catch (RuntimeException e) {
            log.error("[Supervisor] {}: crashed", projectId, e);
            emit(MonitorEvent.failure(projectId, FailureKind.SUPERVISOR_CRASH, e));
            cancelInFlight();
            reason = "crashed: " + e.getClass().getSimpleName();
        } finally {
            if (state != SupervisorState.STOPPED) {
                finish(reason);
            }
        }
    }

    public void requestStop() {
        stopRequested = true;
    }

    /**
     * One step of the loop: ingest, pick up a finished call, dispatch the newest message when the
     * slot is free. Never blocks beyond one bounded read.
     */
    public void tick() {
        if (state == SupervisorState.STOPPED) {
            return;
        }
        if (handle == null && !open()) {
            return;
        }
        ingest();
        collect();
        if (state == SupervisorState.ERROR_BACKOFF && !clock.instant().isBefore(backoffUntil)) {
            state = handle.attached() ? SupervisorState.IDLE : SupervisorState.WAITING_LOGS;
            log.debug("[Supervisor] {}: backoff over", projectId);
        }
        if (state == SupervisorState.IDLE && highestIndex > lastDispatchedIndex) {
            dispatch();
        }
    }

    /**
     * Stops the supervisor: waits up to the grace period for an in-flight call and applies its
     * result, otherwise cancels it and drops whatever it returns later.
     */
    public void finish(String reason) {
        if (state == SupervisorState.STOPPED) {
            return;
        }
        InFlight pending = inFlight;
        if (pending != null) {
            try {
                pending.future().get(settings.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.info("[Supervisor] {}: analysis of #{} did not finish within {}, discarding",
                        projectId, pending.index(), settings.shutdownGrace());
                cancelInFlight();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelInFlight();
            } catch (ExecutionException | CancellationException e) {
                log.debug("[Supervisor] {}: in-flight analysis ended with {}", projectId, e.toString());
            }
            collect();
        }
        markStopped(reason);
    }

    // ---------- tick steps ----------

    private void ingest() {
        PollResult result;
        try {
            result = logSource.poll(handle);
        } catch (LogAccessException e) {
            if (!logErrorReported) {
                log.warn("[Supervisor] {}: cannot read conversation log, retrying: {}", projectId, e.getMessage());
                emit(MonitorEvent.failure(projectId, FailureKind.LOG_ACCESS, e));
                logErrorReported = true;
            }
            return;
        }
        if (logErrorReported) {
            log.info("[Supervisor] {}: conversation log readable again", projectId);
            logErrorReported = false;
        }

        if (!result.attached()) {
            if (state == SupervisorState.IDLE) {
                state = SupervisorState.WAITING_LOGS;
            }
            return;
        }
        if (state == SupervisorState.WAITING_LOGS) {
            log.info("[Supervisor] {}: conversation log found", projectId);
            state = SupervisorState.IDLE;
        }
        if (result.hasRotation()) {
            log.info("[Supervisor] {}: log rotated: {}", projectId, result.rotation());
            emit(MonitorEvent.rotation(projectId, result.rotation()));
        }

        for (Message m : result.messages()) {
            if (!follows(m)) {
                String detail = "index gap: expected #" + (highestIndex + 1) + " but got #" + m.index();
                log.warn("[Supervisor] {}: {}, resetting to the end of the log", projectId, detail);
                emit(MonitorEvent.rotation(projectId, detail));
                logSource.resetToTail(handle);
                rebaseAfterGap = true;
                break;
            }
            rebaseAfterGap = false;
            window.append(m);
            highestIndex = m.index();
            messagesProcessed++;
            log.debug("[Supervisor] {}: #{} {} ({} chars)", projectId, m.index(), m.role().wireName(), m.content().length());
            int n = settings.heartbeatInterval();
            if (n > 0 && messagesProcessed % n == 0) {
                log.info("[Supervisor] {}: heartbeat processed={} alerts={}", projectId, messagesProcessed, alertsRaised);
                emit(MonitorEvent.heartbeat(projectId, messagesProcessed, alertsRaised));
            }
        }
    }

    private boolean follows(Message m) {
        if (highestIndex == 0) {
            return true;
        }
        if (rebaseAfterGap) {
            return m.index() > highestIndex;
        }
        return m.index() == highestIndex + 1;
    }

    private void dispatch() {
        ContextSnapshot snapshot = window.snapshot();
        List<Violation> reported = ledger.active();
        AnalysisRequest request = new AnalysisRequest(projectId, ruleSet, snapshot, reported);
        long index = snapshot.latestIndex();

        CompletableFuture<List<Verdict>> future;
        try {
            future = analysisClient.analyze(request)
                    .defaultIfEmpty(List.of())
                    .timeout(settings.analysisTimeout())
                    .subscribeOn(analysisScheduler)
                    .toFuture();
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        inFlight = new InFlight(future, index, lastDispatchedIndex);
        lastDispatchedIndex = index;
        state = SupervisorState.ANALYZING;
        log.debug("[Supervisor] {}: analyzing #{} (context={}, alreadyReported={})",
                projectId, index, snapshot.size(), reported.size());
        collect();
    }

    private void collect() {
        InFlight done = inFlight;
        if (done == null || !done.future().isDone()) {
            return;
        }
        inFlight = null;
        List<Verdict> verdicts;
        try {
            verdicts = done.future().join();
        } catch (CompletionException | CancellationException e) {
            applyFailure(done, e instanceof CompletionException && e.getCause() != null ? e.getCause() : e);
            return;
        }
        applySuccess(verdicts == null ? List.of() : verdicts, done.index());
    }

    private void applySuccess(List<Verdict> verdicts, long index) {
        Set<String> purged = ledger.expire(highestIndex, settings.contextSize());
        if (!purged.isEmpty()) {
            log.debug("[Supervisor] {}: violations left the window: {}", projectId, purged);
        }

        int fresh = 0;
        for (Verdict v : verdicts) {
            RegisterOutcome outcome = ledger.register(v.ruleId(), index, v.suggestion());
            if (outcome == RegisterOutcome.DUPLICATE) {
                ledger.touch(v.ruleId(), index);
                log.debug("[Supervisor] {}: {} already reported, not alerting again", projectId, v.ruleId());
                continue;
            }
            fresh++;
            alertsRaised++;
            log.warn("[Supervisor] {}: ALERT {} at #{}: {}", projectId, v.ruleId(), index, v.reasoning());
            emit(MonitorEvent.alert(projectId, v, index));
            if (v.hasSuggestion()) {
                publishSuggestion(v);
            }
        }
        activeViolations = ledger.size();
        backoff.reset();
        state = SupervisorState.IDLE;

        if (settings.verbose()) {
            log.info("[Supervisor] {}: round #{} done, verdicts={} new={}{}", projectId, index,
                    verdicts.size(), fresh, verdicts.isEmpty() ? " (no violations)" : "");
        } else {
            log.debug("[Supervisor] {}: round #{} done, verdicts={} new={}", projectId, index, verdicts.size(), fresh);
        }
    }

    private void applyFailure(InFlight failed, Throwable cause) {
        String message = cause instanceof TimeoutException
                ? "analysis timed out after " + settings.analysisTimeout()
                : cause.getMessage();
        Throwable reported = cause instanceof AnalysisServiceException
                ? cause
                : new AnalysisServiceException(message, cause);
        // 这一轮作废：账本不动，下次重新分派
        lastDispatchedIndex = failed.previousDispatched();
        Duration delay = backoff.nextDelay();
        backoffUntil = clock.instant().plus(delay);
        state = SupervisorState.ERROR_BACKOFF;
        log.warn("[Supervisor] {}: analysis of #{} failed ({}), retrying in {}ms",
                projectId, failed.index(), reported.getMessage(), delay.toMillis());
        emit(MonitorEvent.failure(projectId, FailureKind.ANALYSIS, reported));
    }

    private void publishSuggestion(Verdict v) {
        if (!suggestions.enabled()) {
            return;
        }
        try {
            suggestions.publish(projectId, v.suggestion());
            log.debug("[Supervisor] {}: suggestion for {} handed to the assistant", projectId, v.ruleId());
        } catch (SuggestionWriteException e) {
            log.warn("[Supervisor] {}: {}", projectId, e.getMessage());
            emit(MonitorEvent.failure(projectId, FailureKind.SUGGESTION_WRITE, e));
        }
    }

    private void cancelInFlight() {
        InFlight pending = inFlight;
        inFlight = null;
        if (pending != null) {
            pending.future().cancel(true);
        }
    }

    private void markStopped(String reason) {
        state = SupervisorState.STOPPED;
        log.info("[Supervisor] {}: stopped ({}), processed={} alerts={}", projectId, reason, messagesProcessed, alertsRaised);
        emit(MonitorEvent.stopped(projectId, reason));
    }

    private void emit(MonitorEvent event) {
        try {
            events.accept(event);
        } catch (RuntimeException e) {
            log.warn("[Supervisor] {}: event sink rejected {}: {}", projectId, event.type(), e.toString());
        }
    }

    // ---------- views ----------

    public String projectId() { return projectId; }

    public SupervisorState state() { return state; }

    public long messagesProcessed() { return messagesProcessed; }

    public long alertsRaised() { return alertsRaised; }

    public ProjectStatus status() {
        return new ProjectStatus(projectId, state, messagesProcessed, alertsRaised, activeViolations);
    }

    /** Window contents; call from the supervising thread or after it ended. */
    public ContextSnapshot context() {
        return window.snapshot();
    }

    /** Active violations; call from the supervising thread or after it ended. */
    public List<Violation> activeViolations() {
        return ledger.active();
    }
}
