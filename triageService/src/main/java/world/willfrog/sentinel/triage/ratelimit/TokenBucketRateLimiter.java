package world.willfrog.sentinel.triage.ratelimit;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import world.willfrog.sentinel.triage.config.TriageProperties;

import java.time.Clock;
import java.time.Duration;

/**
 * 基于 Redis 的分布式令牌桶。
 * <p>
 * 每个客户端一个桶，容量 maxTokens，按 refillRate（个/秒）连续补充。
 * 放行时扣一个令牌并写回（TTL 60 秒）；拒绝时不写回，只给出建议的重试秒数。
 * Redis 不可用或数据无法解析时一律放行。
 * <p>
 * 读取与写回不是原子操作，并发请求可能多放行少量请求。
 */
@Slf4j
@Component
public class TokenBucketRateLimiter {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final TriageProperties.RateLimit config;
    private final Clock clock;

    public TokenBucketRateLimiter(StringRedisTemplate redisTemplate,
                                  ObjectMapper objectMapper,
                                  TriageProperties properties,
                                  Clock clock) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.config = properties.getRateLimit();
        this.clock = clock;
    }

    public RateLimitDecision checkLimit(String clientId) {
        String key = config.getKeyPrefix() + clientId;
        int maxTokens = Math.max(1, config.getMaxTokens());
        double refillRate = config.getRefillRate() > 0 ? config.getRefillRate() : 1.0;
        try {
            long now = clock.millis();
            String raw = redisTemplate.opsForValue().get(key);
            RateLimitBucket bucket = raw == null
                    ? new RateLimitBucket(maxTokens, now)
                    : objectMapper.readValue(raw, RateLimitBucket.class);

            double elapsedSeconds = Math.max(0L, now - bucket.getLastRefill()) / 1000.0;
            double tokens = Math.min(maxTokens, bucket.getTokens() + elapsedSeconds * refillRate);

            if (tokens >= 1) {
                RateLimitBucket updated = new RateLimitBucket(tokens - 1, now);
                redisTemplate.opsForValue().set(key, objectMapper.writeValueAsString(updated),
                        Duration.ofSeconds(config.getTtlSeconds()));
                return RateLimitDecision.allow();
            }

            long retryAfterMs = (long) Math.ceil((1 - tokens) / refillRate * 1000);
            long retryAfterSeconds = (long) Math.ceil(retryAfterMs / 1000.0);
            log.debug("Rate limit reached: clientId={}, tokens={}, retryAfter={}s", clientId, tokens, retryAfterSeconds);
            return RateLimitDecision.reject(retryAfterSeconds);
        } catch (Exception e) {
            log.warn("Rate limiter store unavailable, allowing request: clientId={}, error={}", clientId, e.getMessage());
            return RateLimitDecision.allow();
        }
    }
}
