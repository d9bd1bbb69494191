package com.GlobeLine.price_broadcaster.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;

import com.GlobeLine.price_broadcaster.ratelimit.TokenBucketRateLimiter;

import reactor.core.publisher.Mono;

/**
 * Reports whether the shared token bucket store answers, with the current bucket level.
 */
@Component
public class RateLimiterHealthIndicator implements ReactiveHealthIndicator {

	private static final Logger logger = LoggerFactory.getLogger(RateLimiterHealthIndicator.class);

	private final TokenBucketRateLimiter rateLimiter;

	public RateLimiterHealthIndicator(TokenBucketRateLimiter rateLimiter) {
		this.rateLimiter = rateLimiter;
	}

	@Override
	public Mono<Health> health() {
		return rateLimiter.getStats()
				.map(stats -> Health.up()
						.withDetail("key", rateLimiter.getKey())
						.withDetail("currentTokens", stats.currentTokens())
						.withDetail("capacity", stats.capacity())
						.withDetail("utilizationPercent", stats.utilizationPercent())
						.withDetail("degradedMode", rateLimiter.getDegradedMode())
						.build())
				.onErrorResume(ex -> {
					logger.warn("Rate limiter store health check failed: {}", ex.getMessage());
					return Mono.just(Health.down()
							.withDetail("key", rateLimiter.getKey())
							.withDetail("error", "Token bucket store unreachable")
							.withDetail("degradedMode", rateLimiter.getDegradedMode())
							.build());
				});
	}
}
