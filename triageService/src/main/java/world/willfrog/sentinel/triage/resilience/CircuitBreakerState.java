package world.willfrog.sentinel.triage.resilience;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单个工具的熔断状态。实例由 {@link ToolCircuitBreaker} 持有并加锁修改，对外只暴露副本。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CircuitBreakerState {
    private int failures;
    private long lastFailureTime;
    private boolean open;

    void reset() {
        failures = 0;
        lastFailureTime = 0L;
        open = false;
    }

    CircuitBreakerState copy() {
        return new CircuitBreakerState(failures, lastFailureTime, open);
    }
}
