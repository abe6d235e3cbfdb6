package world.willfrog.sentinel.triage.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 单次工具调用（含重试与熔断）的最终结果：要么带数据，要么带错误。
 *
 * @param <T> 工具输出类型
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ToolResult<T> {

    private final boolean ok;
    private final T data;
    private final String error;
    private final long durationMs;

    public static <T> ToolResult<T> success(T data, long durationMs) {
        return new ToolResult<>(true, data, null, Math.max(0L, durationMs));
    }

    public static <T> ToolResult<T> failure(String error, long durationMs) {
        return new ToolResult<>(false, null, error == null ? "unknown error" : error, Math.max(0L, durationMs));
    }
}
