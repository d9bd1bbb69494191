package com.GlobeLine.price_broadcaster.ratelimit;

import java.util.List;

import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import reactor.core.publisher.Mono;

/**
 * Token bucket kept in a Redis hash and mutated only by a server-side Lua script,
 * so refill, compare and deduct happen in one step for every process sharing the key.
 */
public class RedisTokenBucketStore implements TokenBucketStore {

	private final ReactiveStringRedisTemplate redisTemplate;
	private final RedisScript<String> script;

	public RedisTokenBucketStore(ReactiveStringRedisTemplate redisTemplate, RedisScript<String> script) {
		this.redisTemplate = redisTemplate;
		this.script = script;
	}

	@Override
	public Mono<BucketState> consume(String key, int capacity, double refillRate, int cost, long nowMillis) {
		return execute(key, capacity, refillRate, cost, nowMillis, false);
	}

	@Override
	public Mono<BucketState> peek(String key, int capacity, double refillRate, long nowMillis) {
		return execute(key, capacity, refillRate, 0, nowMillis, true);
	}

	private Mono<BucketState> execute(String key, int capacity, double refillRate, int cost, long nowMillis,
			boolean dryRun) {
		List<String> args = List.of(
				Integer.toString(capacity),
				Double.toString(refillRate),
				Integer.toString(cost),
				Long.toString(nowMillis),
				dryRun ? "1" : "0",
				Long.toString(keyTtlSeconds(capacity, refillRate)));

		return redisTemplate.execute(script, List.of(key), args)
				.next()
				.map(RedisTokenBucketStore::toState);
	}

	/**
	 * Parses the script reply, {@code "<granted 0|1> <tokens>"}.
	 */
	static BucketState toState(String reply) {
		String[] parts = reply.trim().split(" ");
		if (parts.length != 2) {
			throw new IllegalStateException("Unexpected token bucket script reply: " + reply);
		}
		return new BucketState("1".equals(parts[0]), Double.parseDouble(parts[1]));
	}

	/**
	 * After a full refill an absent key means the same as a full bucket, so the key may expire then.
	 */
	static long keyTtlSeconds(int capacity, double refillRate) {
		return (long) Math.ceil(capacity / refillRate) + 1;
	}
}
