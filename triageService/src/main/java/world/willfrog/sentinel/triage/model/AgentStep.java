package world.willfrog.sentinel.triage.model;

/**
 * 已执行计划步骤的不可变记录。
 *
 * @param step         步骤名
 * @param ok           是否成功
 * @param durationMs   耗时
 * @param detail       成功时为工具输出，失败时为 {error}
 * @param fallbackUsed 该步骤是否触发了降级
 */
public record AgentStep(String step,
                        boolean ok,
                        long durationMs,
                        Object detail,
                        boolean fallbackUsed) {
}
