package world.willfrog.sentinel.triage.stream;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import world.willfrog.sentinel.triage.model.TriageEvent;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 基于 {@link SseEmitter} 的事件通道，每个事件写成一条 {@code data: <json>}。
 * <p>
 * 客户端断开后发送失败只记一次日志，之后的事件直接丢弃，run 本身继续执行。
 */
@Slf4j
public class SseTriageEventSink implements TriageEventSink {

    private final SseEmitter emitter;
    private final AtomicBoolean open = new AtomicBoolean(true);

    public SseTriageEventSink(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void publish(TriageEvent event) {
        if (!open.get()) {
            return;
        }
        try {
            emitter.send(SseEmitter.event().data(event.payload(), MediaType.APPLICATION_JSON));
        } catch (IOException | IllegalStateException e) {
            if (open.compareAndSet(true, false)) {
                log.warn("SSE client gone, dropping further events: type={}, runId={}, error={}",
                        event.type(), event.payload().get("runId"), e.getMessage());
            }
        }
    }

    public void complete() {
        if (open.compareAndSet(true, false)) {
            emitter.complete();
        }
    }

    public void disconnect() {
        open.set(false);
    }

    public boolean isOpen() {
        return open.get();
    }
}
