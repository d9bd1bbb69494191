package com.GlobeLine.price_broadcaster.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import com.GlobeLine.price_broadcaster.ratelimit.DegradedMode;

/**
 * Binds the distributed token bucket settings (rate-limiter.*).
 * The shared store itself is configured through spring.data.redis.*.
 *
 * @param key              Redis key of the shared bucket
 * @param capacity         maximum number of tokens (burst size)
 * @param refillRate       tokens added per second, continuously
 * @param acquireTimeout   how long a quote fetch may wait for a token
 * @param storeTimeout     how long one script call may take before the store counts as unreachable
 * @param storeRetryDelay  pause between attempts while the store is unreachable in DENY mode
 * @param degradedMode     behaviour while the store is unreachable
 * @param fallbackInterval minimum spacing between calls under LOCAL_FALLBACK
 */
@ConfigurationProperties(prefix = "rate-limiter")
public record RateLimiterProperties(
		@DefaultValue("rate_limit:finnhub_api") String key,
		@DefaultValue("100") int capacity,
		@DefaultValue("0.5") double refillRate,
		@DefaultValue("10s") Duration acquireTimeout,
		@DefaultValue("500ms") Duration storeTimeout,
		@DefaultValue("100ms") Duration storeRetryDelay,
		@DefaultValue("DENY") DegradedMode degradedMode,
		@DefaultValue("2s") Duration fallbackInterval) {
}
