package com.GlobeLine.price_broadcaster.ratelimit;

/**
 * Observer for rate limiter outcomes, so the limiter stays free of metrics concerns.
 */
public interface RateLimitEventObserver {

	void onGranted();
	void onTimedOut();
	void onStoreUnavailable();
}
