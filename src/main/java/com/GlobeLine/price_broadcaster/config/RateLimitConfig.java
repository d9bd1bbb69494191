package com.GlobeLine.price_broadcaster.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import com.GlobeLine.price_broadcaster.ratelimit.RedisTokenBucketStore;
import com.GlobeLine.price_broadcaster.ratelimit.TokenBucketRateLimiter;
import com.GlobeLine.price_broadcaster.ratelimit.TokenBucketStore;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;

@Configuration
@EnableConfigurationProperties(RateLimiterProperties.class)
public class RateLimitConfig {

	private static final String TOKEN_BUCKET_SCRIPT = "scripts/token_bucket.lua";

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

	@Bean
	public RedisScript<String> tokenBucketScript() {
		return RedisScript.of(new ClassPathResource(TOKEN_BUCKET_SCRIPT), String.class);
	}

	@Bean
	public TokenBucketStore tokenBucketStore(ReactiveStringRedisTemplate redisTemplate,
			RedisScript<String> tokenBucketScript) {
		return new RedisTokenBucketStore(redisTemplate, tokenBucketScript);
	}

	/**
	 * Process-local limiter used only while the shared store is unreachable and the
	 * degraded mode is LOCAL_FALLBACK: one upstream call per fallback interval.
	 */
	@Bean
	public RateLimiter fallbackQuoteRateLimiter(RateLimiterProperties properties) {
		RateLimiterConfig config = RateLimiterConfig.custom()
				.limitForPeriod(1)
				.limitRefreshPeriod(properties.fallbackInterval())
				.timeoutDuration(properties.acquireTimeout())
				.build();

		return RateLimiter.of("quoteFallback", config);
	}

	@Bean
	public TokenBucketRateLimiter quoteRateLimiter(TokenBucketStore tokenBucketStore,
			RateLimiterProperties properties, RateLimiter fallbackQuoteRateLimiter, Clock clock) {
		return new TokenBucketRateLimiter(
				tokenBucketStore,
				properties.key(),
				properties.capacity(),
				properties.refillRate(),
				properties.storeTimeout(),
				properties.storeRetryDelay(),
				properties.degradedMode(),
				fallbackQuoteRateLimiter,
				clock);
	}
}
