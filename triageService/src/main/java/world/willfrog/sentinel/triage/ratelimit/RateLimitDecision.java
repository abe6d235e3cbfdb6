package world.willfrog.sentinel.triage.ratelimit;

public record RateLimitDecision(boolean allowed, long retryAfterSeconds) {

    private static final RateLimitDecision ALLOW = new RateLimitDecision(true, 0L);

    public static RateLimitDecision allow() {
        return ALLOW;
    }

    public static RateLimitDecision reject(long retryAfterSeconds) {
        return new RateLimitDecision(false, Math.max(1L, retryAfterSeconds));
    }
}
