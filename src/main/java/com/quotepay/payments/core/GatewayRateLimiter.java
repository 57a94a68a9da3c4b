package com.quotepay.payments.core;

import com.quotepay.payments.api.RateLimitExceededException;
import com.quotepay.payments.core.crypto.KeyedHash;
import com.quotepay.payments.domain.GatewayCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Fixed-window limit on payment creation per gateway and caller, counted in
 * Redis so every instance shares the window. Caller identities are hashed
 * before they become keys. If Redis is unreachable the request is allowed.
 */
@Slf4j
@Component
public class GatewayRateLimiter {

    private static final String KEY_PREFIX = "payment:ratelimit:";

    // INCR and the first EXPIRE in one atomic call
    static final DefaultRedisScript<Long> INCREMENT_SCRIPT = new DefaultRedisScript<>(
            "local count = redis.call('INCR', KEYS[1])\n"
                    + "if count == 1 then\n"
                    + "  redis.call('EXPIRE', KEYS[1], ARGV[1])\n"
                    + "end\n"
                    + "return count",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final int maxRequests;
    private final Duration window;

    public GatewayRateLimiter(StringRedisTemplate redisTemplate,
                              @Value("${payment.rate-limit.max-requests:10}") int maxRequests,
                              @Value("${payment.rate-limit.window-seconds:60}") long windowSeconds) {
        this.redisTemplate = redisTemplate;
        this.maxRequests = maxRequests;
        this.window = Duration.ofSeconds(windowSeconds);
    }

    /**
     * @throws RateLimitExceededException when the caller is over the limit
     */
    public void checkAllowed(GatewayCode gatewayCode, String callerKey) {
        if (maxRequests <= 0 || callerKey == null || callerKey.isBlank()) {
            return;
        }
        String key = KEY_PREFIX + gatewayCode.getCode() + ":" + KeyedHash.sha256Hex(callerKey).substring(0, 32);
        Long count;
        try {
            count = redisTemplate.execute(INCREMENT_SCRIPT, List.of(key), String.valueOf(window.getSeconds()));
        } catch (RuntimeException e) {
            log.warn("Rate limiter unavailable, allowing request: gateway={}", gatewayCode, e);
            return;
        }
        if (count != null && count > maxRequests) {
            log.warn("Rate limit exceeded: gateway={}, count={}, limit={}, windowSeconds={}",
                    gatewayCode, count, maxRequests, window.getSeconds());
            throw new RateLimitExceededException("Rate limit exceeded for gateway " + gatewayCode.getCode());
        }
    }
}
