package world.willfrog.sentinel.triage.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "triage")
@Data
public class TriageProperties {

    private Flow flow = new Flow();
    private Tool tool = new Tool();
    private RateLimit rateLimit = new RateLimit();
    private Executor executor = new Executor();

    @Data
    public static class Flow {
        /** 单次分诊的总耗时预算 */
        private long budgetMs = 5000;
        private List<String> plan = new ArrayList<>(List.of(
                "dataAccess", "riskSignals", "kbLookup", "decide", "proposeAction"));
    }

    @Data
    public static class Tool {
        private long timeoutMs = 1000;
        private int maxRetries = 2;
        /** 第 n 次重试前等待 retryDelaysMs[n-1]，超出部分沿用最后一个值 */
        private List<Long> retryDelaysMs = new ArrayList<>(List.of(150L, 400L));
        private long jitterMs = 50;
        private Circuit circuit = new Circuit();
    }

    @Data
    public static class Circuit {
        private int failureThreshold = 3;
        private long openDurationMs = 30000;
    }

    @Data
    public static class RateLimit {
        private boolean enabled = true;
        private int maxTokens = 5;
        private double refillRate = 5.0;
        private long ttlSeconds = 60;
        private String keyPrefix = "rate_limit:";
    }

    @Data
    public static class Executor {
        private int runThreads = 4;
        private int toolThreads = 8;
    }
}
