package world.willfrog.sentinel.triage.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import world.willfrog.sentinel.common.dto.ResponseCode;
import world.willfrog.sentinel.triage.entity.AgentTrace;
import world.willfrog.sentinel.triage.entity.TriageRun;
import world.willfrog.sentinel.triage.exception.BizException;
import world.willfrog.sentinel.triage.mapper.AgentTraceMapper;
import world.willfrog.sentinel.triage.mapper.TriageRunMapper;
import world.willfrog.sentinel.triage.model.AgentStep;
import world.willfrog.sentinel.triage.model.RecommendedAction;
import world.willfrog.sentinel.triage.model.RiskLevel;
import world.willfrog.sentinel.triage.model.TriageRunDetail;
import world.willfrog.sentinel.triage.model.TriageRunStatus;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 分诊 run 与步骤 trace 的持久化。
 * <p>
 * 职责：
 * 1. 创建 run（RUNNING）并分配唯一 runId；
 * 2. 按 1 起始的 seq 写入步骤 trace；
 * 3. 写入最终决策或失败状态；
 * 4. 组装查询接口的 run 详情。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TriageRunService {

    private final TriageRunMapper runMapper;
    private final AgentTraceMapper traceMapper;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public TriageRun createRun(String alertId) {
        TriageRun run = new TriageRun();
        run.setId(UUID.randomUUID().toString().replace("-", ""));
        run.setAlertId(alertId);
        run.setStatus(TriageRunStatus.RUNNING);
        run.setStartedAt(OffsetDateTime.now(clock));
        run.setFallbackUsed(false);
        runMapper.insert(run);
        log.info("Triage run created: runId={}, alertId={}", run.getId(), alertId);
        return run;
    }

    /**
     * 写入一条步骤 trace。
     *
     * @param runId run ID
     * @param seq   1 起始序号，等于该步骤在 trace 中的位置
     * @param step  已执行的步骤
     */
    public void appendTrace(String runId, int seq, AgentStep step) {
        AgentTrace trace = new AgentTrace();
        trace.setRunId(runId);
        trace.setSeq(seq);
        trace.setStep(step.step());
        trace.setOk(step.ok());
        trace.setDurationMs(step.durationMs());
        trace.setDetailJson(writeJson(step.detail()));
        traceMapper.insert(trace);
    }

    public void finalizeRun(String runId,
                            RiskLevel risk,
                            List<String> reasons,
                            RecommendedAction recommendedAction,
                            boolean fallbackUsed,
                            long latencyMs) {
        TriageRun run = new TriageRun();
        run.setId(runId);
        run.setStatus(TriageRunStatus.COMPLETED);
        run.setEndedAt(OffsetDateTime.now(clock));
        run.setRisk(risk == null ? null : risk.wireName());
        run.setRecommendedAction(recommendedAction == null ? null : recommendedAction.wireName());
        run.setReasonsJson(writeJson(reasons == null ? List.of() : reasons));
        run.setFallbackUsed(fallbackUsed);
        run.setLatencyMs(latencyMs);
        runMapper.finalizeRun(run);
    }

    /**
     * 标记 run 失败。尽力而为：写库失败只记日志，不覆盖原始异常。
     */
    public void markFailed(String runId, String lastError, long latencyMs) {
        try {
            runMapper.markFailed(runId, lastError, latencyMs);
        } catch (Exception e) {
            log.error("Mark triage run failed error: runId={}", runId, e);
        }
    }

    public TriageRunDetail getRunDetail(String runId) {
        TriageRun run = runMapper.findById(runId);
        if (run == null) {
            throw new BizException(ResponseCode.DATA_NOT_FOUND, "Triage run not found");
        }
        List<TriageRunDetail.TraceEntry> entries = new ArrayList<>();
        List<AgentTrace> traces = traceMapper.listByRunId(runId);
        if (traces != null) {
            for (AgentTrace trace : traces) {
                entries.add(new TriageRunDetail.TraceEntry(
                        trace.getSeq() == null ? 0 : trace.getSeq(),
                        trace.getStep(),
                        Boolean.TRUE.equals(trace.getOk()),
                        trace.getDurationMs() == null ? 0L : trace.getDurationMs(),
                        readTree(trace.getDetailJson())));
            }
        }
        return TriageRunDetail.builder()
                .runId(run.getId())
                .alertId(run.getAlertId())
                .status(run.getStatus())
                .startedAt(run.getStartedAt())
                .endedAt(run.getEndedAt())
                .risk(run.getRisk())
                .recommendedAction(run.getRecommendedAction())
                .reasons(readReasons(run.getReasonsJson()))
                .fallbackUsed(Boolean.TRUE.equals(run.getFallbackUsed()))
                .latencyMs(run.getLatencyMs())
                .lastError(run.getLastError())
                .trace(entries)
                .build();
    }

    private List<String> readReasons(String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<List<String>>() {
            });
        } catch (Exception e) {
            log.warn("Unreadable reasons json: {}", json);
            return new ArrayList<>();
        }
    }

    private JsonNode readTree(String json) {
        if (json == null || json.isBlank()) {
            return objectMapper.nullNode();
        }
        try {
            return objectMapper.readTree(json);
        } catch (Exception e) {
            log.warn("Unreadable trace detail json, returning raw text");
            return objectMapper.getNodeFactory().textNode(json);
        }
    }

    private String writeJson(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (Exception e) {
            log.warn("Serialize trace payload failed: type={}", obj == null ? "null" : obj.getClass().getSimpleName());
            return "{}";
        }
    }
}
