package com.GlobeLine.price_broadcaster.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import io.github.resilience4j.ratelimiter.RateLimiter;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

/**
 * Runs the token bucket Lua script against a real Redis.
 * Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
class RedisTokenBucketStoreIntegrationTest {

	private static final String KEY = "rate_limit:it";

	@Container
	static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
			.withExposedPorts(6379);

	private static LettuceConnectionFactory connectionFactory;
	private static ReactiveStringRedisTemplate redisTemplate;
	private static RedisTokenBucketStore store;

	@BeforeAll
	static void connect() {
		connectionFactory = new LettuceConnectionFactory(redis.getHost(), redis.getFirstMappedPort());
		connectionFactory.afterPropertiesSet();
		redisTemplate = new ReactiveStringRedisTemplate(connectionFactory);
		RedisScript<String> script = RedisScript.of(new ClassPathResource("scripts/token_bucket.lua"), String.class);
		store = new RedisTokenBucketStore(redisTemplate, script);
	}

	@AfterAll
	static void disconnect() {
		connectionFactory.destroy();
	}

	@BeforeEach
	void clearBucket() {
		redisTemplate.delete(KEY).block();
	}

	@Test
	void consume_FreshBucket_StartsFull() {
		long now = System.currentTimeMillis();

		StepVerifier.create(store.consume(KEY, 10, 1.0, 3, now))
				.assertNext(state -> {
					assertThat(state.granted()).isTrue();
					assertThat(state.tokens()).isCloseTo(7.0, within(0.001));
				})
				.verifyComplete();
	}

	@Test
	void consume_NotEnoughTokens_DeniesWithoutGoingNegative() {
		long now = System.currentTimeMillis();
		store.consume(KEY, 5, 0.5, 4, now).block();

		StepVerifier.create(store.consume(KEY, 5, 0.5, 3, now))
				.assertNext(state -> {
					assertThat(state.granted()).isFalse();
					assertThat(state.tokens()).isCloseTo(1.0, within(0.001));
				})
				.verifyComplete();
	}

	@Test
	void consume_RefillsContinuouslyAndCapsAtCapacity() {
		long now = System.currentTimeMillis();
		store.consume(KEY, 10, 2.0, 10, now).block();

		// 1.5s at 2 tokens/s
		StepVerifier.create(store.peek(KEY, 10, 2.0, now + 1500))
				.assertNext(state -> assertThat(state.tokens()).isCloseTo(3.0, within(0.001)))
				.verifyComplete();

		// an hour later the bucket is simply full
		StepVerifier.create(store.peek(KEY, 10, 2.0, now + 3_600_000))
				.assertNext(state -> assertThat(state.tokens()).isCloseTo(10.0, within(0.001)))
				.verifyComplete();
	}

	@Test
	void peek_DoesNotWrite() {
		long now = System.currentTimeMillis();

		store.peek(KEY, 10, 1.0, now).block();

		StepVerifier.create(redisTemplate.hasKey(KEY))
				.expectNext(false)
				.verifyComplete();
	}

	@Test
	void consume_SetsExpiryOfOneFullRefill() {
		long now = System.currentTimeMillis();

		store.consume(KEY, 10, 0.5, 1, now).block();

		StepVerifier.create(redisTemplate.getExpire(KEY))
				.assertNext(ttl -> assertThat(ttl.getSeconds()).isBetween(1L, 21L))
				.verifyComplete();
	}

	@Test
	void twoLimitersSharingTheKey_GrantAtMostCapacityBetweenThem() {
		// Two processes' worth of limiters over the same Redis key
		TokenBucketRateLimiter first = new TokenBucketRateLimiter(store, KEY, 10, 0.001, Duration.ofMillis(500),
				Duration.ofMillis(50), DegradedMode.DENY, RateLimiter.ofDefaults("first"), Clock.systemUTC());
		TokenBucketRateLimiter second = new TokenBucketRateLimiter(store, KEY, 10, 0.001, Duration.ofMillis(500),
				Duration.ofMillis(50), DegradedMode.DENY, RateLimiter.ofDefaults("second"), Clock.systemUTC());

		List<AcquireResult> results = Flux.range(0, 40)
				.parallel(8)
				.runOn(Schedulers.parallel())
				.flatMap(i -> (i % 2 == 0 ? first : second).acquire(1, Duration.ofMillis(200)))
				.sequential()
				.collectList()
				.block(Duration.ofSeconds(10));

		assertThat(results).filteredOn(AcquireResult::isGranted).hasSize(10);
		StepVerifier.create(first.getStats())
				.assertNext(stats -> assertThat(stats.currentTokens()).isGreaterThanOrEqualTo(0.0))
				.verifyComplete();
	}
}
