package world.willfrog.sentinel.triage.stream;

import world.willfrog.sentinel.triage.model.TriageEvent;

/**
 * 分诊进度事件的接收方。同一 run 的事件按产生顺序投递。
 */
@FunctionalInterface
public interface TriageEventSink {

    TriageEventSink NOOP = event -> {
    };

    void publish(TriageEvent event);
}
