package com.shepherd.infra;

import com.shepherd.api.dto.MonitorEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import jakarta.annotation.PreDestroy;

/**
 * 所有项目共用的一条多播事件流：
 *  - publish(...): 任何 supervisor 线程都可以发，内部串行化
 *  - events():     订阅合并后的流，每条事件都带 projectId
 */
@Slf4j
@Component
public class EventHub {

    // 多播，所有订阅者都能收到；有限缓冲避免背压丢失
    private final Sinks.Many<MonitorEvent> sink = Sinks.many().multicast().onBackpressureBuffer(1024, false);

    public synchronized void publish(MonitorEvent event) {
        Sinks.EmitResult r = sink.tryEmitNext(event);
        if (r.isFailure()) {
            log.debug("[EventHub] dropped {} for {}: {}", event.type(), event.projectId(), r);
        }
    }

    public Flux<MonitorEvent> events() {
        return sink.asFlux();
    }

    @PreDestroy
    public synchronized void complete() {
        sink.tryEmitComplete();
        log.debug("[EventHub] completed");
    }
}
