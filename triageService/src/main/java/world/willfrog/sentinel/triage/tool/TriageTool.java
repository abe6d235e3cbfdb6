package world.willfrog.sentinel.triage.tool;

import world.willfrog.sentinel.triage.context.AgentContext;

import java.util.Optional;

/**
 * 分诊计划中的一个步骤。
 *
 * @param <T> 工具输出类型
 */
public interface TriageTool<T> {

    /**
     * 步骤名，同时作为注册表键与熔断器键。
     */
    String name();

    /**
     * 执行工具逻辑。运行在工具线程池中，可能因超时被中断。
     *
     * @param context 当前 run 的上下文（只读）
     * @return 工具输出
     * @throws Exception 任意失败，由包装层决定是否重试
     */
    T run(AgentContext context) throws Exception;

    /**
     * 把成功的输出（或降级值）写回上下文。只在 run 线程中由编排器调用。
     */
    void contribute(AgentContext context, T data);

    /**
     * 失败时的替代输出，默认没有。
     */
    default Optional<T> fallback() {
        return Optional.empty();
    }
}
