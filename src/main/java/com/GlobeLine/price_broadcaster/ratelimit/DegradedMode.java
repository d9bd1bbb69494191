package com.GlobeLine.price_broadcaster.ratelimit;

/**
 * What the limiter does while its shared store is unreachable.
 */
public enum DegradedMode {

	/** Grant nothing until the store answers again; callers time out. */
	DENY,

	/** Throttle with a process-local fixed-rate limiter instead. */
	LOCAL_FALLBACK
}
