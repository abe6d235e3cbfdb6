package world.willfrog.sentinel.triage.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 推送给调用方的进度事件。payload 即序列化后的 JSON 对象，始终包含 type。
 */
public record TriageEvent(String type, Map<String, Object> payload) {

    public static final String PLAN_BUILT = "plan_built";
    public static final String TOOL_UPDATE = "tool_update";
    public static final String FALLBACK_TRIGGERED = "fallback_triggered";
    public static final String DECISION_FINALIZED = "decision_finalized";
    public static final String COMPLETED = "completed";
    public static final String ERROR = "error";

    public static final String STATUS_RUNNING = "running";
    public static final String STATUS_COMPLETED = "completed";

    public static TriageEvent planBuilt(String runId, List<String> plan) {
        Map<String, Object> payload = base(PLAN_BUILT, runId);
        payload.put("plan", List.copyOf(plan));
        return new TriageEvent(PLAN_BUILT, payload);
    }

    public static TriageEvent stepRunning(String runId, String step) {
        Map<String, Object> payload = base(TOOL_UPDATE, runId);
        payload.put("step", step);
        payload.put("status", STATUS_RUNNING);
        return new TriageEvent(TOOL_UPDATE, payload);
    }

    public static TriageEvent stepCompleted(String runId, String step, long durationMs) {
        Map<String, Object> payload = base(TOOL_UPDATE, runId);
        payload.put("step", step);
        payload.put("status", STATUS_COMPLETED);
        payload.put("duration", durationMs);
        return new TriageEvent(TOOL_UPDATE, payload);
    }

    public static TriageEvent fallbackTriggered(String runId, String step, String reason) {
        Map<String, Object> payload = base(FALLBACK_TRIGGERED, runId);
        payload.put("step", step);
        payload.put("reason", reason == null ? "" : reason);
        return new TriageEvent(FALLBACK_TRIGGERED, payload);
    }

    public static TriageEvent decisionFinalized(String runId,
                                                RiskLevel risk,
                                                List<String> reasons,
                                                RecommendedAction recommendedAction,
                                                long latencyMs) {
        Map<String, Object> payload = base(DECISION_FINALIZED, runId);
        payload.put("risk", risk);
        payload.put("reasons", List.copyOf(reasons));
        payload.put("recommendedAction", recommendedAction);
        payload.put("latencyMs", latencyMs);
        return new TriageEvent(DECISION_FINALIZED, payload);
    }

    public static TriageEvent completed(String runId) {
        return new TriageEvent(COMPLETED, base(COMPLETED, runId));
    }

    public static TriageEvent error(String runId, String message) {
        Map<String, Object> payload = base(ERROR, runId);
        payload.put("message", message == null ? "" : message);
        return new TriageEvent(ERROR, payload);
    }

    private static Map<String, Object> base(String type, String runId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", type);
        if (runId != null && !runId.isBlank()) {
            payload.put("runId", runId);
        }
        return payload;
    }
}
