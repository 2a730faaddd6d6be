package com.shepherd.monitor;

import com.shepherd.ai.AnalysisClient;
import com.shepherd.api.dto.AnalysisRequest;
import com.shepherd.api.dto.Message;
import com.shepherd.api.dto.MonitorEvent;
import com.shepherd.api.dto.MonitorEvent.FailureKind;
import com.shepherd.api.dto.RuleSet;
import com.shepherd.api.dto.Verdict;
import com.shepherd.api.dto.Violation;
import com.shepherd.error.AnalysisServiceException;
import com.shepherd.error.SuggestionWriteException;
import com.shepherd.service.SuggestionChannel;
import com.shepherd.service.impl.DisabledSuggestionChannel;
import com.shepherd.service.impl.FileSuggestionChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ProjectSupervisorTest {

    private static final Logger log = LoggerFactory.getLogger(ProjectSupervisorTest.class);

    private static final String PROJECT = "/work/demo";
    private static final RuleSet RULES = RuleSet.of("Act as a strict reviewer",
            Map.of("test-coverage", "Code is written without tests"));

    @TempDir
    Path stateDir;

    private ScriptedLogSource source;
    private MutableClock clock;
    private List<MonitorEvent> events;
    private List<AnalysisRequest> requests;

    @BeforeEach
    void setUp() {
        source = new ScriptedLogSource();
        clock = new MutableClock();
        events = new CopyOnWriteArrayList<>();
        requests = new ArrayList<>();
    }

    private static SupervisorSettings settings(int k, int n) {
        return new SupervisorSettings(k, n, Duration.ofMillis(5), Duration.ofSeconds(5), Duration.ofMillis(200),
                Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0, false);
    }

    private ProjectSupervisor supervisor(SupervisorSettings s, SuggestionChannel channel,
                                         Function<AnalysisRequest, Mono<List<Verdict>>> responder) {
        AnalysisClient client = req -> {
            requests.add(req);
            return responder.apply(req);
        };
        return new ProjectSupervisor(PROJECT, RULES, source, client, channel, events::add, s,
                Schedulers.immediate(), clock);
    }

    private List<MonitorEvent> eventsOf(MonitorEvent.Type type) {
        return events.stream().filter(e -> e.type() == type).toList();
    }

    private static Mono<List<Verdict>> coverageAt(AnalysisRequest req, long index) {
        if (req.snapshot().latestIndex() == index) {
            return Mono.just(List.of(Verdict.of("test-coverage", "wrote code without tests", "add unit tests")));
        }
        return Mono.just(List.of());
    }

    @Test
    void alertsOnceAndHandsSuggestionToTheAssistant() throws Exception {
        FileSuggestionChannel channel = FileSuggestionChannel.underStateDir(stateDir);
        ProjectSupervisor sup = supervisor(settings(10, 10), channel,
                req -> req.snapshot().latestIndex() >= 12
                        ? Mono.just(List.of(Verdict.of("test-coverage", "wrote code without tests", "add unit tests")))
                        : Mono.just(List.of()));
        source.range(1, 12);

        sup.tick();

        assertThat(eventsOf(MonitorEvent.Type.ALERT)).hasSize(1);
        MonitorEvent.Alert alert = eventsOf(MonitorEvent.Type.ALERT).get(0).dataAs(MonitorEvent.Alert.class);
        assertEquals("test-coverage", alert.ruleId());
        assertEquals(12, alert.messageIndex());
        assertThat(alert.stopRequest()).isFalse();
        Path file = channel.fileFor(PROJECT);
        assertThat(Files.readString(file, StandardCharsets.UTF_8)).contains("add unit tests");

        // hook picked it up; the repeated verdict must neither alert nor rewrite
        assertThat(channel.consume(PROJECT)).contains("add unit tests");
        source.messages(13);
        sup.tick();

        assertThat(requests).hasSize(2);
        assertThat(eventsOf(MonitorEvent.Type.ALERT)).hasSize(1);
        assertThat(Files.exists(file)).isFalse();
        assertThat(sup.activeViolations()).singleElement()
                .satisfies(v -> {
                    assertEquals(12, v.firstSeenIndex());
                    assertEquals(13, v.lastSeenIndex());
                });
        assertEquals(1, sup.status().alertsRaised());
    }

    @Test
    void dispatchesOnlyTheNewestMessageWithTheWholeWindow() {
        ProjectSupervisor sup = supervisor(settings(3, 0), new DisabledSuggestionChannel(),
                req -> Mono.just(List.of()));
        source.range(1, 5);

        sup.tick();

        assertThat(requests).hasSize(1);
        AnalysisRequest req = requests.get(0);
        assertEquals(5, req.latest().index());
        assertThat(req.snapshot().messages()).extracting(Message::index).containsExactly(3L, 4L, 5L);
        assertEquals(5, sup.messagesProcessed());
        assertEquals(SupervisorState.IDLE, sup.state());
    }

    @Test
    void failedRoundLeavesLedgerAloneAndRetriesAfterBackoff() {
        int[] calls = {0};
        ProjectSupervisor sup = supervisor(settings(10, 0), new DisabledSuggestionChannel(), req -> {
            if (calls[0]++ == 0) {
                return Mono.error(new AnalysisServiceException("quota exceeded"));
            }
            return coverageAt(req, 3);
        });
        source.range(1, 3);

        sup.tick();

        assertEquals(SupervisorState.ERROR_BACKOFF, sup.state());
        assertThat(eventsOf(MonitorEvent.Type.ALERT)).isEmpty();
        assertThat(sup.activeViolations()).isEmpty();
        MonitorEvent.Failure failure = eventsOf(MonitorEvent.Type.FAILURE).get(0).dataAs(MonitorEvent.Failure.class);
        assertEquals(FailureKind.ANALYSIS, failure.kind());
        assertThat(failure.message()).contains("quota exceeded");

        sup.tick();
        assertThat(requests).as("still backing off").hasSize(1);

        clock.advance(Duration.ofSeconds(1));
        sup.tick();

        assertThat(requests).hasSize(2);
        assertEquals(3, requests.get(1).latest().index());
        assertThat(eventsOf(MonitorEvent.Type.ALERT)).hasSize(1);
        assertEquals(SupervisorState.IDLE, sup.state());
    }

    @Test
    void backoffGrowsWithConsecutiveFailures() {
        ProjectSupervisor sup = supervisor(settings(10, 0), new DisabledSuggestionChannel(),
                req -> Mono.error(new AnalysisServiceException("down")));
        source.messages(1);

        sup.tick();
        clock.advance(Duration.ofSeconds(1));
        sup.tick();
        assertThat(requests).hasSize(2);

        // second failure waits 2s
        clock.advance(Duration.ofSeconds(1));
        sup.tick();
        assertThat(requests).hasSize(2);
        clock.advance(Duration.ofSeconds(1));
        sup.tick();
        assertThat(requests).hasSize(3);
        assertThat(eventsOf(MonitorEvent.Type.FAILURE)).hasSize(3);
    }

    @Test
    void messagesArrivingDuringAnalysisAreDispatchedOnceTheSlotFrees() {
        CompletableFuture<List<Verdict>> first = new CompletableFuture<>();
        ProjectSupervisor sup = supervisor(settings(10, 0), new DisabledSuggestionChannel(),
                req -> requests.size() == 1 ? Mono.fromFuture(first) : Mono.just(List.of()));
        source.range(1, 2);
        sup.tick();
        assertEquals(SupervisorState.ANALYZING, sup.state());

        source.range(3, 4);
        sup.tick();
        assertThat(requests).hasSize(1);
        assertThat(sup.context().messages()).hasSize(4);

        first.complete(List.of());
        sup.tick();

        assertThat(requests).hasSize(2);
        assertEquals(4, requests.get(1).latest().index());
    }

    @Test
    void heartbeatCarriesCumulativeCounters() {
        ProjectSupervisor sup = supervisor(settings(10, 3), new DisabledSuggestionChannel(),
                req -> coverageAt(req, 2));
        source.range(1, 2);
        sup.tick();
        source.range(3, 7);
        sup.tick();

        List<MonitorEvent.Heartbeat> beats = eventsOf(MonitorEvent.Type.HEARTBEAT).stream()
                .map(e -> e.dataAs(MonitorEvent.Heartbeat.class)).toList();
        assertThat(beats).extracting(MonitorEvent.Heartbeat::messagesProcessed).containsExactly(3L, 6L);
        assertThat(beats).extracting(MonitorEvent.Heartbeat::alertsRaised).containsExactly(1L, 1L);
    }

    @Test
    void violationMayAlertAgainOnceItLeftTheWindow() {
        ProjectSupervisor sup = supervisor(settings(3, 0), new DisabledSuggestionChannel(),
                req -> Mono.just(List.of(Verdict.of("test-coverage", "still no tests", null))));
        source.messages(1);
        sup.tick();
        source.messages(2);
        sup.tick();
        assertThat(eventsOf(MonitorEvent.Type.ALERT)).hasSize(1);

        source.range(3, 5);
        sup.tick();

        assertThat(eventsOf(MonitorEvent.Type.ALERT)).hasSize(2);
        Violation v = sup.activeViolations().get(0);
        assertEquals(5, v.firstSeenIndex());
    }

    @Test
    void indexGapResetsToTailAndEmitsRotation() {
        ProjectSupervisor sup = supervisor(settings(10, 0), new DisabledSuggestionChannel(),
                req -> Mono.just(List.of()));
        source.messages(1, 2, 5, 6);
        sup.tick();

        assertEquals(1, source.resets);
        assertThat(sup.context().messages()).extracting(Message::index).containsExactly(1L, 2L);
        assertThat(eventsOf(MonitorEvent.Type.ROTATION)).singleElement()
                .satisfies(e -> assertThat(e.dataAs(MonitorEvent.Rotation.class).detail()).contains("index gap"));

        source.messages(9, 10);
        sup.tick();
        assertThat(sup.context().messages()).extracting(Message::index).containsExactly(1L, 2L, 9L, 10L);
        assertEquals(10, requests.get(requests.size() - 1).latest().index());
    }

    @Test
    void rotationFromTheLogIsForwarded() {
        ProjectSupervisor sup = supervisor(settings(10, 0), new DisabledSuggestionChannel(),
                req -> Mono.just(List.of()));
        source.rotation("switched from a.jsonl to b.jsonl");
        sup.tick();

        assertThat(eventsOf(MonitorEvent.Type.ROTATION)).hasSize(1);
        assertThat(requests).isEmpty();
    }

    @Test
    void unreadableLogIsReportedOnceUntilItRecovers() {
        ProjectSupervisor sup = supervisor(settings(10, 0), new DisabledSuggestionChannel(),
                req -> Mono.just(List.of()));
        source.failure(ScriptedLogSource.unreadable())
                .failure(ScriptedLogSource.unreadable())
                .messages(1)
                .failure(ScriptedLogSource.unreadable());

        sup.tick();
        sup.tick();
        assertThat(eventsOf(MonitorEvent.Type.FAILURE)).hasSize(1);

        sup.tick();
        sup.tick();
        assertThat(eventsOf(MonitorEvent.Type.FAILURE)).hasSize(2)
                .allSatisfy(e -> assertEquals(FailureKind.LOG_ACCESS, e.dataAs(MonitorEvent.Failure.class).kind()));
        assertThat(sup.state()).isNotEqualTo(SupervisorState.STOPPED);
    }

    @Test
    void waitsForTheLogToAppear() {
        source.attached = false;
        ProjectSupervisor sup = supervisor(settings(10, 0), new DisabledSuggestionChannel(),
                req -> Mono.just(List.of()));
        sup.tick();
        assertEquals(SupervisorState.WAITING_LOGS, sup.state());

        source.attached = true;
        source.messages(1);
        sup.tick();
        assertEquals(SupervisorState.IDLE, sup.state());
        assertThat(requests).hasSize(1);
    }

    @Test
    void unreachableLogAtStartupStopsTheProject() {
        source.openFailure = ScriptedLogSource.unreadable();
        ProjectSupervisor sup = supervisor(settings(10, 0), new DisabledSuggestionChannel(),
                req -> Mono.just(List.of()));

        sup.run();

        assertEquals(SupervisorState.STOPPED, sup.state());
        assertThat(events).extracting(MonitorEvent::type)
                .containsExactly(MonitorEvent.Type.FAILURE, MonitorEvent.Type.STOPPED);
    }

    @Test
    void failedSuggestionWriteStillAlerts() {
        SuggestionChannel broken = mock(SuggestionChannel.class);
        when(broken.enabled()).thenReturn(true);
        doThrow(new SuggestionWriteException("disk full", new java.io.IOException("ENOSPC")))
                .when(broken).publish(anyString(), anyString());
        ProjectSupervisor sup = supervisor(settings(10, 0), broken, req -> coverageAt(req, 1));
        source.messages(1);

        sup.tick();

        assertThat(eventsOf(MonitorEvent.Type.ALERT)).hasSize(1);
        assertThat(eventsOf(MonitorEvent.Type.FAILURE)).singleElement()
                .satisfies(e -> assertEquals(FailureKind.SUGGESTION_WRITE, e.dataAs(MonitorEvent.Failure.class).kind()));
    }

    @Test
    void stopRequestVerdictIsFlagged() {
        ProjectSupervisor sup = supervisor(settings(10, 0), new DisabledSuggestionChannel(),
                req -> Mono.just(List.of(Verdict.of(RuleSet.STOP_REQUEST_ID, "user said stop", null))));
        source.messages(1);
        sup.tick();

        MonitorEvent.Alert alert = eventsOf(MonitorEvent.Type.ALERT).get(0).dataAs(MonitorEvent.Alert.class);
        assertThat(alert.stopRequest()).isTrue();
    }

    @Test
    void shutdownAppliesACallThatFinishesWithinGrace() {
        CompletableFuture<List<Verdict>> pending = new CompletableFuture<>();
        ProjectSupervisor sup = supervisor(settings(10, 0), new DisabledSuggestionChannel(),
                req -> Mono.fromFuture(pending));
        source.messages(1);
        sup.tick();

        CompletableFuture.delayedExecutor(20, java.util.concurrent.TimeUnit.MILLISECONDS)
                .execute(() -> pending.complete(List.of(Verdict.of("test-coverage", "late", null))));
        sup.finish("shutdown");

        assertEquals(SupervisorState.STOPPED, sup.state());
        assertThat(eventsOf(MonitorEvent.Type.ALERT)).hasSize(1);
        assertThat(events.get(events.size() - 1).type()).isEqualTo(MonitorEvent.Type.STOPPED);
    }

    @Test
    void shutdownDiscardsACallThatOutlivesGrace() {
        ProjectSupervisor sup = supervisor(settings(10, 0), new DisabledSuggestionChannel(),
                req -> Mono.never());
        source.messages(1);
        sup.tick();

        sup.finish("shutdown");

        assertEquals(SupervisorState.STOPPED, sup.state());
        assertThat(eventsOf(MonitorEvent.Type.ALERT)).isEmpty();
        assertThat(sup.activeViolations()).isEmpty();
    }

    @Test
    void unexpectedErrorStopsOnlyThisSupervisor() {
        source.failure(new IllegalStateException("boom"));
        ProjectSupervisor sup = supervisor(settings(10, 0), new DisabledSuggestionChannel(),
                req -> Mono.just(List.of()));

        sup.run();

        assertEquals(SupervisorState.STOPPED, sup.state());
        assertThat(eventsOf(MonitorEvent.Type.FAILURE)).singleElement()
                .satisfies(e -> assertEquals(FailureKind.SUPERVISOR_CRASH, e.dataAs(MonitorEvent.Failure.class).kind()));
        assertThat(eventsOf(MonitorEvent.Type.STOPPED)).hasSize(1);
    }

    @Test
    void projectsNeverShareWindowOrLedger() {
        ScriptedLogSource otherSource = new ScriptedLogSource();
        List<MonitorEvent> otherEvents = new ArrayList<>();
        RuleSet otherRules = RuleSet.of(null, Map.of("no-secrets", "Secrets are committed"));
        ProjectSupervisor a = supervisor(settings(10, 0), new DisabledSuggestionChannel(), req -> coverageAt(req, 2));
        ProjectSupervisor b = new ProjectSupervisor("/work/other", otherRules, otherSource,
                req -> Mono.just(List.of(Verdict.of("no-secrets", "api key in diff", null))),
                new DisabledSuggestionChannel(), otherEvents::add, settings(10, 0), Schedulers.immediate(), clock);

        source.range(1, 2);
        otherSource.range(1, 4);
        a.tick();
        b.tick();

        assertThat(a.activeViolations()).extracting(Violation::ruleId).containsExactly("test-coverage");
        assertThat(b.activeViolations()).extracting(Violation::ruleId).containsExactly("no-secrets");
        assertThat(a.context().size()).isEqualTo(2);
        assertThat(b.context().size()).isEqualTo(4);
        assertThat(events).allSatisfy(e -> assertEquals(PROJECT, e.projectId()));
        assertThat(otherEvents).allSatisfy(e -> assertEquals("/work/other", e.projectId()));
        log.info("events a={} b={}", events.size(), otherEvents.size());
    }
}
