package com.shepherd.infra;

import com.shepherd.api.dto.MonitorEvent;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;

class EventHubTest {

    @Test
    void everySubscriberSeesTheTaggedEventsInOrder() {
        EventHub hub = new EventHub();
        MonitorEvent a = MonitorEvent.heartbeat("/a", 10, 0);
        MonitorEvent b = MonitorEvent.rotation("/b", "index gap");

        StepVerifier.create(hub.events().take(2))
                .then(() -> {
                    hub.publish(a);
                    hub.publish(b);
                })
                .expectNext(a, b)
                .expectComplete()
                .verify(Duration.ofSeconds(2));
    }

    @Test
    void completeEndsTheStream() {
        EventHub hub = new EventHub();
        StepVerifier.create(hub.events())
                .then(hub::complete)
                .expectComplete()
                .verify(Duration.ofSeconds(2));
    }

    @Test
    void loggerRendersEveryEventType() {
        EventHub hub = new EventHub();
        MonitorEventLogger logger = new MonitorEventLogger(hub);
        logger.init();
        hub.publish(MonitorEvent.heartbeat("/a", 10, 1));
        hub.publish(MonitorEvent.failure("/a", MonitorEvent.FailureKind.ANALYSIS, "timeout"));
        hub.publish(MonitorEvent.stopped("/a", "shutdown"));
        logger.shutdown();
    }
}
