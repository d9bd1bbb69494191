package com.GlobeLine.price_broadcaster.service;

/**
 * Observer for quote fetch events.
 * Lets the provider report cache and upstream behaviour without knowing about metrics.
 */
public interface QuoteEventObserver {

	void onCacheHit();
	void onCacheMiss();
	void onInFlightSharing();
	void onQuoteUnavailable();
}
