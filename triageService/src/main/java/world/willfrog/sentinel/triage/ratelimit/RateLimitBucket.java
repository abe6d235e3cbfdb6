package world.willfrog.sentinel.triage.ratelimit;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Redis 中保存的令牌桶状态，JSON 形如 {@code {"tokens":4.0,"lastRefill":1700000000000}}。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitBucket {
    private double tokens;
    /** 上次补充令牌的时间（epoch ms） */
    private long lastRefill;
}
