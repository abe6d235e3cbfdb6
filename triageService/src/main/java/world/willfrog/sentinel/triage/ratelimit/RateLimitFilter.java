package world.willfrog.sentinel.triage.ratelimit;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import world.willfrog.sentinel.triage.config.TriageProperties;
import world.willfrog.sentinel.triage.service.TriageMetrics;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 对 /api/** 做令牌桶限流，超限返回 429 与 Retry-After。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RateLimitFilter extends OncePerRequestFilter {

    public static final String API_KEY_HEADER = "X-API-Key";
    private static final String API_PREFIX = "/api/";

    private final TokenBucketRateLimiter rateLimiter;
    private final TriageProperties properties;
    private final TriageMetrics metrics;
    private final ObjectMapper objectMapper;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (!properties.getRateLimit().isEnabled()) {
            return true;
        }
        String path = request.getRequestURI();
        return path == null || !path.startsWith(API_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        String clientId = resolveClientId(request);
        RateLimitDecision decision = rateLimiter.checkLimit(clientId);
        if (decision.allowed()) {
            chain.doFilter(request, response);
            return;
        }

        metrics.recordRateLimitBlock();
        log.warn("Rate limit exceeded: clientId={}, path={}, retryAfter={}s",
                clientId, request.getRequestURI(), decision.retryAfterSeconds());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Too many requests");
        body.put("retryAfter", decision.retryAfterSeconds());
        body.put("message", "Rate limit exceeded. Retry after " + decision.retryAfterSeconds() + " seconds.");

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }

    /**
     * 客户端标识：优先 API Key，其次来源 IP。
     */
    static String resolveClientId(HttpServletRequest request) {
        String apiKey = request.getHeader(API_KEY_HEADER);
        if (StringUtils.isNotBlank(apiKey)) {
            return "key:" + apiKey.trim();
        }
        return "ip:" + request.getRemoteAddr();
    }
}
