package com.GlobeLine.price_broadcaster.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import reactor.core.publisher.Mono;

/**
 * Distributed token bucket limiting calls to the upstream quote provider across every
 * process that shares the same {@link TokenBucketStore}.
 *
 * A denied attempt waits roughly {@code (cost - tokens) / refillRate} and retries until the
 * caller's timeout. When the store cannot be reached the configured {@link DegradedMode}
 * decides: DENY keeps refusing until the timeout, LOCAL_FALLBACK throttles through a
 * process-local limiter. A store failure never counts as a grant.
 */
public class TokenBucketRateLimiter {

	private static final Logger logger = LoggerFactory.getLogger(TokenBucketRateLimiter.class);

	private final TokenBucketStore store;
	private final String key;
	private final int capacity;
	private final double refillRate;
	private final Duration storeTimeout;
	private final Duration storeRetryDelay;
	private final DegradedMode degradedMode;
	private final RateLimiter fallbackLimiter;
	private final Clock clock;
	private RateLimitEventObserver eventObserver;

	public TokenBucketRateLimiter(
			TokenBucketStore store,
			String key,
			int capacity,
			double refillRate,
			Duration storeTimeout,
			Duration storeRetryDelay,
			DegradedMode degradedMode,
			RateLimiter fallbackLimiter,
			Clock clock) {
		if (capacity <= 0) {
			throw new IllegalArgumentException("capacity must be > 0");
		}
		if (refillRate <= 0.0) {
			throw new IllegalArgumentException("refillRate must be > 0");
		}
		this.store = store;
		this.key = key;
		this.capacity = capacity;
		this.refillRate = refillRate;
		this.storeTimeout = storeTimeout;
		this.storeRetryDelay = storeRetryDelay;
		this.degradedMode = degradedMode;
		this.fallbackLimiter = fallbackLimiter;
		this.clock = clock;
	}

	public void setObserver(RateLimitEventObserver observer) {
		this.eventObserver = observer;
	}

	/**
	 * Takes {@code cost} tokens from the shared bucket, waiting for refill up to {@code timeout}.
	 *
	 * @param cost    tokens to take, between 1 and the bucket capacity
	 * @param timeout longest the caller is willing to wait
	 * @return Mono emitting GRANTED, or TIMED_OUT once the timeout is exhausted
	 * @throws IllegalArgumentException if cost is not positive or exceeds the capacity
	 */
	public Mono<AcquireResult> acquire(int cost, Duration timeout) {
		if (cost <= 0) {
			throw new IllegalArgumentException("cost must be > 0");
		}
		if (cost > capacity) {
			throw new IllegalArgumentException(
					"Cannot acquire " + cost + " tokens (bucket capacity is " + capacity + ")");
		}
		return Mono.defer(() -> attempt(cost, clock.millis() + timeout.toMillis()))
				.doOnNext(this::notifyOutcome);
	}

	public Mono<AcquireResult> acquire(Duration timeout) {
		return acquire(1, timeout);
	}

	/**
	 * Current bucket state, refilled up to now, without consuming anything.
	 */
	public Mono<RateLimiterStats> getStats() {
		return Mono.defer(() -> store.peek(key, capacity, refillRate, clock.millis()))
				.timeout(storeTimeout)
				.map(state -> RateLimiterStats.of(state.tokens(), capacity, refillRate));
	}

	public String getKey() {
		return key;
	}

	public DegradedMode getDegradedMode() {
		return degradedMode;
	}

	private Mono<AcquireResult> attempt(int cost, long deadline) {
		Duration callTimeout = min(storeTimeout, Duration.ofMillis(Math.max(1, deadline - clock.millis())));
		return Mono.defer(() -> store.consume(key, capacity, refillRate, cost, clock.millis()))
				.timeout(callTimeout)
				.flatMap(state -> state.granted()
						? Mono.just(AcquireResult.GRANTED)
						: waitForRefill(cost, state.tokens(), deadline))
				.onErrorResume(ex -> onStoreFailure(ex, cost, deadline));
	}

	private Mono<AcquireResult> waitForRefill(int cost, double tokens, long deadline) {
		long waitMillis = Math.max(1L, (long) Math.ceil((cost - tokens) / refillRate * 1000.0));
		long remaining = deadline - clock.millis();
		if (waitMillis > remaining) {
			logger.debug("Bucket {} needs {}ms to refill {} token(s), only {}ms left", key, waitMillis, cost,
					remaining);
			return Mono.just(AcquireResult.TIMED_OUT);
		}
		return Mono.delay(Duration.ofMillis(waitMillis))
				.then(Mono.defer(() -> attempt(cost, deadline)));
	}

	private Mono<AcquireResult> onStoreFailure(Throwable error, int cost, long deadline) {
		String reason = error instanceof TimeoutException ? "no reply within " + storeTimeout.toMillis() + "ms"
				: error.getMessage();
		logger.warn("Rate limiter store unavailable for bucket {} ({}), degraded mode {}", key, reason,
				degradedMode);
		if (eventObserver != null) {
			eventObserver.onStoreUnavailable();
		}

		long remaining = deadline - clock.millis();
		if (degradedMode == DegradedMode.LOCAL_FALLBACK) {
			return acquireLocally(remaining);
		}
		if (remaining <= 0) {
			return Mono.just(AcquireResult.TIMED_OUT);
		}
		return Mono.delay(min(storeRetryDelay, Duration.ofMillis(remaining)))
				.then(Mono.defer(() -> clock.millis() >= deadline
						? Mono.just(AcquireResult.TIMED_OUT)
						: attempt(cost, deadline)));
	}

	private Mono<AcquireResult> acquireLocally(long remainingMillis) {
		if (remainingMillis <= 0) {
			return Mono.just(AcquireResult.TIMED_OUT);
		}
		return Mono.just(AcquireResult.GRANTED)
				.transformDeferred(RateLimiterOperator.of(fallbackLimiter))
				.timeout(Duration.ofMillis(remainingMillis), Mono.just(AcquireResult.TIMED_OUT))
				.onErrorReturn(RequestNotPermitted.class, AcquireResult.TIMED_OUT);
	}

	private void notifyOutcome(AcquireResult result) {
		if (eventObserver == null) {
			return;
		}
		if (result.isGranted()) {
			eventObserver.onGranted();
		} else {
			eventObserver.onTimedOut();
		}
	}

	private static Duration min(Duration a, Duration b) {
		return a.compareTo(b) <= 0 ? a : b;
	}
}
