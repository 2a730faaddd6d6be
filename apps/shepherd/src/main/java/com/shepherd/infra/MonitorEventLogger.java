package com.shepherd.infra;

import com.shepherd.api.dto.MonitorEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

/** Renders the merged event stream into the application log, the console view of shepherd. */
@Slf4j
@Component
@RequiredArgsConstructor
public class MonitorEventLogger {

    private final EventHub hub;
    private Disposable subscription;

    @PostConstruct
    public void init() {
        subscription = hub.events().subscribe(this::render,
                e -> log.warn("[Events] stream failed: {}", e.toString()));
    }

    @PreDestroy
    public void shutdown() {
        if (subscription != null) {
            subscription.dispose();
            subscription = null;
        }
    }

    void render(MonitorEvent e) {
        switch (e.type()) {
            case ALERT -> {
                MonitorEvent.Alert a = e.dataAs(MonitorEvent.Alert.class);
                String kind = a.stopRequest() ? "STOP REQUESTED" : "ALERT";
                if (a.suggestion() != null) {
                    log.warn("{} {}: {} (#{})\n  REASON: {}\n  SUGGESTION: {}", kind, e.projectId(), a.ruleId(),
                            a.messageIndex(), a.reasoning(), a.suggestion());
                } else {
                    log.warn("{} {}: {} (#{})\n  REASON: {}", kind, e.projectId(), a.ruleId(),
                            a.messageIndex(), a.reasoning());
                }
            }
            case HEARTBEAT -> {
                MonitorEvent.Heartbeat h = e.dataAs(MonitorEvent.Heartbeat.class);
                log.info("HEARTBEAT {}: {} messages processed, {} alerts raised", e.projectId(),
                        h.messagesProcessed(), h.alertsRaised());
            }
            case FAILURE -> {
                MonitorEvent.Failure f = e.dataAs(MonitorEvent.Failure.class);
                log.warn("FAILURE {} [{}]: {}", e.projectId(), f.kind(), f.message());
            }
            case ROTATION -> log.info("ROTATION {}: {}", e.projectId(), e.dataAs(MonitorEvent.Rotation.class).detail());
            case STOPPED -> log.info("STOPPED {}: {}", e.projectId(), e.dataAs(MonitorEvent.Stopped.class).reason());
        }
    }
}
