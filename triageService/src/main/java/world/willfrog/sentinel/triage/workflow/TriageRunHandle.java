package world.willfrog.sentinel.triage.workflow;

import world.willfrog.sentinel.common.pojo.triage.Alert;

/**
 * 已创建但尚未执行的 run：告警聚合已加载，run 记录已落库。
 */
public record TriageRunHandle(String runId, Alert alert) {
}
