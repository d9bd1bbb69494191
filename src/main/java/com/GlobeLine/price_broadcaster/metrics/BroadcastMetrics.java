package com.GlobeLine.price_broadcaster.metrics;

import jakarta.annotation.PostConstruct;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import com.GlobeLine.price_broadcaster.broadcast.BroadcastEventObserver;
import com.GlobeLine.price_broadcaster.broadcast.ConnectionRegistry;
import com.GlobeLine.price_broadcaster.ratelimit.RateLimitEventObserver;
import com.GlobeLine.price_broadcaster.ratelimit.TokenBucketRateLimiter;
import com.GlobeLine.price_broadcaster.service.FinnhubPriceProvider;
import com.GlobeLine.price_broadcaster.service.QuoteEventObserver;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Centralized metrics for the broadcaster, the shared rate limiter and quote fetching.
 * Subscribes to the components' events so they stay free of metrics code.
 */
@Component
public class BroadcastMetrics implements BroadcastEventObserver, RateLimitEventObserver, QuoteEventObserver {

	private final ConnectionRegistry registry;
	private final TokenBucketRateLimiter rateLimiter;
	private final ObjectProvider<FinnhubPriceProvider> priceProvider;

	private final Counter workersStartedCounter;
	private final Counter workersStoppedCounter;
	private final Counter broadcastCounter;
	private final DistributionSummary recipientsSummary;
	private final Counter sendFailureCounter;
	private final Counter tokensGrantedCounter;
	private final Counter tokensTimedOutCounter;
	private final Counter storeUnavailableCounter;
	private final Counter cacheHitCounter;
	private final Counter cacheMissCounter;
	private final Counter inFlightSharingCounter;
	private final Counter quoteUnavailableCounter;

	public BroadcastMetrics(MeterRegistry meterRegistry, ConnectionRegistry registry,
			TokenBucketRateLimiter rateLimiter, ObjectProvider<FinnhubPriceProvider> priceProvider) {
		this.registry = registry;
		this.rateLimiter = rateLimiter;
		this.priceProvider = priceProvider;

		Gauge.builder("price.broadcaster.topics.active", registry, ConnectionRegistry::activeTopicCount)
				.description("Topics with at least one subscriber (one worker each)")
				.register(meterRegistry);

		Gauge.builder("price.broadcaster.connections", registry, ConnectionRegistry::connectionCount)
				.description("Open price stream connections")
				.register(meterRegistry);

		this.workersStartedCounter = Counter.builder("price.broadcaster.workers.started")
				.description("Number of topic workers started")
				.register(meterRegistry);

		this.workersStoppedCounter = Counter.builder("price.broadcaster.workers.stopped")
				.description("Number of topic workers stopped after their last subscriber left")
				.register(meterRegistry);

		this.broadcastCounter = Counter.builder("price.broadcaster.broadcasts")
				.description("Number of price updates broadcast to a topic")
				.register(meterRegistry);

		this.recipientsSummary = DistributionSummary.builder("price.broadcaster.broadcast.recipients")
				.description("Connections reached per broadcast")
				.register(meterRegistry);

		this.sendFailureCounter = Counter.builder("price.broadcaster.errors.send_failure")
				.description("Connections dropped because a send failed")
				.tag("error_type", "send_failure")
				.register(meterRegistry);

		this.tokensGrantedCounter = Counter.builder("price.broadcaster.ratelimit.acquire")
				.description("Rate limiter acquisitions by outcome")
				.tag("outcome", "granted")
				.register(meterRegistry);

		this.tokensTimedOutCounter = Counter.builder("price.broadcaster.ratelimit.acquire")
				.description("Rate limiter acquisitions by outcome")
				.tag("outcome", "timed_out")
				.register(meterRegistry);

		this.storeUnavailableCounter = Counter.builder("price.broadcaster.errors.store_unavailable")
				.description("Rate limiter store calls that failed or timed out")
				.tag("error_type", "store_unavailable")
				.register(meterRegistry);

		this.cacheHitCounter = Counter.builder("price.broadcaster.quote.cache.hits")
				.description("Number of quote cache hits")
				.register(meterRegistry);

		this.cacheMissCounter = Counter.builder("price.broadcaster.quote.cache.misses")
				.description("Number of quote cache misses")
				.register(meterRegistry);

		this.inFlightSharingCounter = Counter.builder("price.broadcaster.quote.inflight.sharing")
				.description("Number of times an in-flight quote request was shared")
				.register(meterRegistry);

		this.quoteUnavailableCounter = Counter.builder("price.broadcaster.quote.unavailable")
				.description("Symbols that could not be priced in a cycle")
				.register(meterRegistry);
	}

	@PostConstruct
	public void wireObservers() {
		registry.setObserver(this);
		rateLimiter.setObserver(this);
		priceProvider.ifAvailable(provider -> provider.setObserver(this));
	}

	@Override
	public void onWorkerStarted(long topicId) {
		workersStartedCounter.increment();
	}

	@Override
	public void onWorkerStopped(long topicId) {
		workersStoppedCounter.increment();
	}

	@Override
	public void onBroadcast(long topicId, int recipients) {
		broadcastCounter.increment();
		recipientsSummary.record(recipients);
	}

	@Override
	public void onSendFailure(long topicId) {
		sendFailureCounter.increment();
	}

	@Override
	public void onGranted() {
		tokensGrantedCounter.increment();
	}

	@Override
	public void onTimedOut() {
		tokensTimedOutCounter.increment();
	}

	@Override
	public void onStoreUnavailable() {
		storeUnavailableCounter.increment();
	}

	@Override
	public void onCacheHit() {
		cacheHitCounter.increment();
	}

	@Override
	public void onCacheMiss() {
		cacheMissCounter.increment();
	}

	@Override
	public void onInFlightSharing() {
		inFlightSharingCounter.increment();
	}

	@Override
	public void onQuoteUnavailable() {
		quoteUnavailableCounter.increment();
	}
}
