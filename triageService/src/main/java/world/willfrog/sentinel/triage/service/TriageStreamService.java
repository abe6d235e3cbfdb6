package world.willfrog.sentinel.triage.service;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import world.willfrog.sentinel.triage.model.TriageEvent;
import world.willfrog.sentinel.triage.model.TriageStartResponse;
import world.willfrog.sentinel.triage.stream.SseTriageEventSink;
import world.willfrog.sentinel.triage.stream.TriageEventSink;
import world.willfrog.sentinel.triage.workflow.TriageOrchestrator;
import world.willfrog.sentinel.triage.workflow.TriageRunHandle;

import java.util.concurrent.ExecutorService;

/**
 * 分诊的异步入口：后台执行或以 SSE 推送进度。run 本身都在 triageRunExecutor 上执行。
 */
@Slf4j
@Service
public class TriageStreamService {

    private final TriageOrchestrator orchestrator;
    private final ExecutorService runExecutor;

    @Value("${triage.stream.emitter-timeout-ms:60000}")
    private long emitterTimeoutMs;

    public TriageStreamService(TriageOrchestrator orchestrator,
                               @Qualifier("triageRunExecutor") ExecutorService runExecutor) {
        this.orchestrator = orchestrator;
        this.runExecutor = runExecutor;
    }

    /**
     * 同步创建 run（告警不存在时直接抛出），随后在后台执行。
     */
    public TriageStartResponse start(String alertId) {
        TriageRunHandle handle = orchestrator.beginRun(alertId);
        runExecutor.execute(() -> runInBackground(handle));
        log.info("Triage started: runId={}, alertId={}", handle.runId(), alertId);
        return TriageStartResponse.started(handle.runId(), alertId);
    }

    /**
     * 新建一个 run 并通过 SSE 推送全部事件，结束时以 completed 或 error 收尾。
     */
    public SseEmitter stream(String alertId) {
        SseEmitter emitter = new SseEmitter(emitterTimeoutMs);
        SseTriageEventSink sink = new SseTriageEventSink(emitter);
        emitter.onCompletion(sink::disconnect);
        emitter.onTimeout(sink::disconnect);
        emitter.onError(e -> sink.disconnect());

        if (StringUtils.isBlank(alertId)) {
            sink.publish(TriageEvent.error(null, "Missing alertId"));
            sink.complete();
            return emitter;
        }
        runExecutor.execute(() -> streamRun(alertId, sink));
        return emitter;
    }

    void streamRun(String alertId, SseTriageEventSink sink) {
        String runId = null;
        try {
            TriageRunHandle handle = orchestrator.beginRun(alertId);
            runId = handle.runId();
            orchestrator.executeRun(handle, sink);
        } catch (RuntimeException e) {
            log.error("Streamed triage failed: runId={}, alertId={}, error={}", runId, alertId, e.getMessage());
            sink.publish(TriageEvent.error(runId, describe(e)));
        } catch (Error e) {
            log.error("Streamed triage aborted: runId={}, alertId={}", runId, alertId, e);
            sink.publish(TriageEvent.error(runId, describe(e)));
            throw e;
        } finally {
            sink.complete();
        }
    }

    private static String describe(Throwable e) {
        return StringUtils.defaultIfBlank(e.getMessage(), e.getClass().getSimpleName());
    }

    private void runInBackground(TriageRunHandle handle) {
        try {
            orchestrator.executeRun(handle, TriageEventSink.NOOP);
        } catch (RuntimeException e) {
            log.error("Background triage failed: runId={}, alertId={}", handle.runId(), handle.alert().getId(), e);
        }
    }
}
