package world.willfrog.sentinel.triage.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class TriageExecutorConfig {

    /**
     * 每个分诊 run 占用一个线程，步骤在该线程内顺序执行。
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService triageRunExecutor(TriageProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getExecutor().getRunThreads()));
    }

    /**
     * 工具单次尝试在这里执行，超时后被 cancel(true) 中断。
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService triageToolExecutor(TriageProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getExecutor().getToolThreads()));
    }

    @Bean
    public Clock triageClock() {
        return Clock.systemUTC();
    }
}
