package world.willfrog.sentinel.triage.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 分诊相关的 Micrometer 指标。tag 取值只有工具名与 ok，基数有限。
 */
@Component
public class TriageMetrics {

    public static final String TOOL_CALL_TOTAL = "tool_call_total";
    public static final String AGENT_LATENCY = "agent_latency_ms";
    public static final String AGENT_FALLBACK_TOTAL = "agent_fallback_total";
    public static final String RATE_LIMIT_BLOCK_TOTAL = "rate_limit_block_total";

    private final MeterRegistry registry;
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();

    public TriageMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordToolCall(String tool, boolean ok, long durationMs) {
        String okTag = String.valueOf(ok);
        counters.computeIfAbsent(TOOL_CALL_TOTAL + "|" + tool + "|" + okTag,
                k -> Counter.builder(TOOL_CALL_TOTAL)
                        .description("Tool invocations by outcome")
                        .tag("tool", tool)
                        .tag("ok", okTag)
                        .register(registry))
                .increment();
        timers.computeIfAbsent(tool,
                k -> Timer.builder(AGENT_LATENCY)
                        .description("Tool latency including retries")
                        .tag("agent", tool)
                        .register(registry))
                .record(Duration.ofMillis(Math.max(0L, durationMs)));
    }

    public void recordFallback(String step) {
        counters.computeIfAbsent(AGENT_FALLBACK_TOTAL + "|" + step,
                k -> Counter.builder(AGENT_FALLBACK_TOTAL)
                        .description("Plan steps that fell back")
                        .tag("tool", step)
                        .register(registry))
                .increment();
    }

    public void recordRateLimitBlock() {
        counters.computeIfAbsent(RATE_LIMIT_BLOCK_TOTAL,
                k -> Counter.builder(RATE_LIMIT_BLOCK_TOTAL)
                        .description("Requests rejected by the rate limiter")
                        .register(registry))
                .increment();
    }
}
