package world.willfrog.sentinel.triage.resilience;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.sentinel.triage.config.TriageProperties;

import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 按工具名隔离的熔断器。
 * <p>
 * 状态只有关闭与打开两种：
 * <ul>
 *   <li>连续失败达到阈值后打开，冷却期内的调用直接抛出 {@link CircuitOpenException}</li>
 *   <li>冷却期过后的第一次调用先把状态清零，再正常执行（没有半开探测）</li>
 *   <li>任意一次成功都会清零失败计数</li>
 * </ul>
 * 状态在进程内共享，所有并发 run 共用同一份。
 */
@Slf4j
@Component
public class ToolCircuitBreaker {

    private final Map<String, CircuitBreakerState> states = new ConcurrentHashMap<>();
    private final int failureThreshold;
    private final long openDurationMs;
    private final Clock clock;

    public ToolCircuitBreaker(TriageProperties properties, Clock clock) {
        TriageProperties.Circuit circuit = properties.getTool().getCircuit();
        this.failureThreshold = Math.max(1, circuit.getFailureThreshold());
        this.openDurationMs = Math.max(0L, circuit.getOpenDurationMs());
        this.clock = clock;
    }

    public <T> T execute(String toolName, Callable<T> fn) throws Exception {
        CircuitBreakerState state = stateOf(toolName);
        synchronized (state) {
            if (state.isOpen()) {
                long sinceLastFailure = clock.millis() - state.getLastFailureTime();
                if (sinceLastFailure < openDurationMs) {
                    log.warn("Circuit breaker is open: tool={}, remainingMs={}", toolName, openDurationMs - sinceLastFailure);
                    throw new CircuitOpenException(toolName);
                }
                state.reset();
                log.info("Circuit breaker reset after cooldown: tool={}", toolName);
            }
        }

        T result;
        try {
            result = fn.call();
        } catch (Throwable e) {
            onFailure(toolName, state);
            throw e;
        }
        onSuccess(state);
        return result;
    }

    public boolean isOpen(String toolName) {
        CircuitBreakerState state = states.get(toolName);
        if (state == null) {
            return false;
        }
        synchronized (state) {
            return state.isOpen();
        }
    }

    /**
     * 当前所有工具的熔断状态副本，按工具名排序。
     */
    public Map<String, CircuitBreakerState> snapshot() {
        Map<String, CircuitBreakerState> copy = new TreeMap<>();
        states.forEach((name, state) -> {
            synchronized (state) {
                copy.put(name, state.copy());
            }
        });
        return copy;
    }

    private CircuitBreakerState stateOf(String toolName) {
        return states.computeIfAbsent(toolName, k -> new CircuitBreakerState());
    }

    private void onSuccess(CircuitBreakerState state) {
        synchronized (state) {
            state.setFailures(0);
            state.setOpen(false);
        }
    }

    private void onFailure(String toolName, CircuitBreakerState state) {
        synchronized (state) {
            state.setFailures(state.getFailures() + 1);
            state.setLastFailureTime(clock.millis());
            if (state.getFailures() >= failureThreshold && !state.isOpen()) {
                state.setOpen(true);
                log.error("Circuit breaker opened: tool={}, failures={}", toolName, state.getFailures());
            }
        }
    }
}
