package com.GlobeLine.price_broadcaster.ratelimit;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Read-only snapshot of the shared bucket, refilled up to the moment of the read.
 */
public record RateLimiterStats(
		@JsonProperty("current_tokens") double currentTokens,
		@JsonProperty("capacity") int capacity,
		@JsonProperty("refill_rate") double refillRate,
		@JsonProperty("utilization_percent") double utilizationPercent) {

	static RateLimiterStats of(double tokens, int capacity, double refillRate) {
		double utilization = (capacity - tokens) / capacity * 100.0;
		return new RateLimiterStats(round(tokens), capacity, refillRate, round(utilization));
	}

	private static double round(double value) {
		return Math.round(value * 100.0) / 100.0;
	}
}
