package world.willfrog.sentinel.triage.resilience;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import world.willfrog.sentinel.triage.config.TriageProperties;
import world.willfrog.sentinel.triage.context.AgentContext;
import world.willfrog.sentinel.triage.model.ToolResult;
import world.willfrog.sentinel.triage.service.TriageMetrics;
import world.willfrog.sentinel.triage.tool.TriageTool;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 工具调用的统一包装：熔断 → 重试（带抖动） → 单次超时。
 * <p>
 * 熔断包住整个重试循环，一次 {@link #execute} 最多只记一次熔断失败。
 * {@link #execute} 不抛异常，超时、熔断、重试耗尽与工具异常（包括 {@link Error}）都转成失败的 {@link ToolResult}。
 * 调用线程被中断时取消正在执行的工具，且不再重试。
 */
@Slf4j
@Component
public class ResilientToolExecutor {

    public static final String TIMEOUT_MESSAGE = "Tool timeout exceeded";

    private final ToolCircuitBreaker circuitBreaker;
    private final ExecutorService toolExecutor;
    private final TriageMetrics metrics;
    private final Clock clock;
    private final TriageProperties.Tool config;
    private final TimeLimiter timeLimiter;
    private final RetryConfig retryConfig;
    private final Map<String, Retry> retries = new ConcurrentHashMap<>();

    public ResilientToolExecutor(ToolCircuitBreaker circuitBreaker,
                                 @Qualifier("triageToolExecutor") ExecutorService toolExecutor,
                                 TriageMetrics metrics,
                                 TriageProperties properties,
                                 Clock clock) {
        this.circuitBreaker = circuitBreaker;
        this.toolExecutor = toolExecutor;
        this.metrics = metrics;
        this.clock = clock;
        this.config = properties.getTool();
        this.timeLimiter = TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(Math.max(1L, config.getTimeoutMs())))
                .cancelRunningFuture(true)
                .build());
        this.retryConfig = RetryConfig.custom()
                .maxAttempts(Math.max(0, config.getMaxRetries()) + 1)
                .intervalBiFunction((attempt, either) -> retryDelayMs(attempt))
                .ignoreExceptions(InterruptedException.class)
                .build();
    }

    public <T> ToolResult<T> execute(TriageTool<T> tool, AgentContext context) {
        String toolName = tool.name();
        String runId = context == null ? null : context.getRunId();
        long start = clock.millis();
        try {
            T data = circuitBreaker.execute(toolName, () -> runWithRetry(tool, context));
            long duration = clock.millis() - start;
            metrics.recordToolCall(toolName, true, duration);
            return ToolResult.success(data, duration);
        } catch (CircuitOpenException e) {
            long duration = clock.millis() - start;
            log.warn("Tool short-circuited: runId={}, tool={}", runId, toolName);
            metrics.recordToolCall(toolName, false, duration);
            return ToolResult.failure(e.getMessage(), duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            long duration = clock.millis() - start;
            log.error("Tool interrupted: runId={}, tool={}, durationMs={}", runId, toolName, duration);
            metrics.recordToolCall(toolName, false, duration);
            return ToolResult.failure("Tool interrupted", duration);
        } catch (Exception e) {
            long duration = clock.millis() - start;
            log.error("Tool failed: runId={}, tool={}, durationMs={}, error={}", runId, toolName, duration, describe(e));
            metrics.recordToolCall(toolName, false, duration);
            return ToolResult.failure(describe(e), duration);
        }
    }

    private <T> T runWithRetry(TriageTool<T> tool, AgentContext context) throws Exception {
        String toolName = tool.name();
        String runId = context == null ? null : context.getRunId();
        int maxAttempts = retryConfig.getMaxAttempts();
        AtomicInteger attempt = new AtomicInteger();

        Callable<T> singleAttempt = () -> {
            int current = attempt.incrementAndGet();
            if (current > 1) {
                log.info("Tool retry attempt: runId={}, tool={}, retry={}/{}", runId, toolName, current - 1, maxAttempts - 1);
            }
            try {
                T result = runWithTimeout(tool, context);
                if (current > 1) {
                    log.info("Tool succeeded on attempt: runId={}, tool={}, attempt={}", runId, toolName, current);
                }
                return result;
            } catch (Exception e) {
                log.warn("Tool attempt failed: runId={}, tool={}, attempt={}/{}, error={}",
                        runId, toolName, current, maxAttempts, describe(e));
                if (current >= maxAttempts) {
                    log.error("Tool attempts exhausted: runId={}, tool={}, attempts={}", runId, toolName, maxAttempts);
                }
                throw e;
            }
        };
        return Retry.decorateCallable(retryOf(toolName), singleAttempt).call();
    }

    private <T> T runWithTimeout(TriageTool<T> tool, AgentContext context) throws Exception {
        Future<T> future = toolExecutor.submit(() -> tool.run(context));
        try {
            return timeLimiter.executeFutureSupplier(() -> future);
        } catch (TimeoutException e) {
            throw new TimeoutException(TIMEOUT_MESSAGE);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (Error e) {
            // 交给重试与熔断按普通失败处理
            throw new ExecutionException(describe(e), e);
        }
    }

    private Retry retryOf(String toolName) {
        return retries.computeIfAbsent(toolName, name -> {
            Retry retry = Retry.of(name, retryConfig);
            retry.getEventPublisher().onRetry(event -> log.info("Tool waiting before retry: tool={}, waitMs={}",
                    event.getName(), event.getWaitInterval().toMillis()));
            return retry;
        });
    }

    long retryDelayMs(int retryNumber) {
        List<Long> delays = config.getRetryDelaysMs();
        long base = 0L;
        if (delays != null && !delays.isEmpty()) {
            int index = Math.min(Math.max(retryNumber, 1), delays.size()) - 1;
            Long value = delays.get(index);
            base = value == null ? 0L : Math.max(0L, value);
        }
        long jitter = config.getJitterMs() > 0 ? ThreadLocalRandom.current().nextLong(config.getJitterMs() + 1) : 0L;
        return base + jitter;
    }

    private static String describe(Throwable e) {
        return StringUtils.defaultIfBlank(e.getMessage(), e.getClass().getSimpleName());
    }
}
