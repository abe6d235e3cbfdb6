package world.willfrog.sentinel.triage.resilience;

import lombok.Getter;

/**
 * 熔断打开时直接拒绝调用，不会执行被保护的函数。
 */
@Getter
public class CircuitOpenException extends RuntimeException {

    private final String toolName;

    public CircuitOpenException(String toolName) {
        super("Circuit breaker open for " + toolName);
        this.toolName = toolName;
    }
}
