package com.GlobeLine.price_broadcaster.ratelimit;

import reactor.core.publisher.Mono;

/**
 * Shared storage for a token bucket. Each call must execute as one indivisible
 * operation on the store: refill by elapsed time, then consume if enough tokens remain.
 */
public interface TokenBucketStore {

	/**
	 * Refills the bucket and deducts {@code cost} tokens if available.
	 *
	 * @param key        bucket identifier
	 * @param capacity   maximum tokens
	 * @param refillRate tokens per second
	 * @param cost       tokens to deduct
	 * @param nowMillis  caller's current time in epoch milliseconds
	 */
	Mono<BucketState> consume(String key, int capacity, double refillRate, int cost, long nowMillis);

	/**
	 * Computes the refilled token count without consuming or writing anything.
	 */
	Mono<BucketState> peek(String key, int capacity, double refillRate, long nowMillis);
}
