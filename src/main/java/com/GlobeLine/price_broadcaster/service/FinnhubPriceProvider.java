package com.GlobeLine.price_broadcaster.service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.github.benmanes.caffeine.cache.Cache;

import com.GlobeLine.price_broadcaster.config.FinnhubApiProperties;
import com.GlobeLine.price_broadcaster.config.RateLimiterProperties;
import com.GlobeLine.price_broadcaster.connectors.FinnhubClient;
import com.GlobeLine.price_broadcaster.connectors.FinnhubClient.SymbolNotFoundException;
import com.GlobeLine.price_broadcaster.dto.PriceQuote;
import com.GlobeLine.price_broadcaster.mapper.QuoteMapper;
import com.GlobeLine.price_broadcaster.ratelimit.TokenBucketRateLimiter;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * {@link PriceProvider} backed by the Finnhub quote endpoint.
 *
 * Per symbol: cache first, then an in-flight request for the same symbol, and only then
 * one upstream call made under a token from the shared rate limiter. A symbol that cannot
 * be priced (no token in time, upstream error, unknown symbol) is reported unavailable
 * and never fails the whole fetch.
 */
@Component
public class FinnhubPriceProvider implements PriceProvider {

	private static final Logger logger = LoggerFactory.getLogger(FinnhubPriceProvider.class);

	private final FinnhubClient finnhubClient;
	private final QuoteMapper mapper;
	private final Cache<String, PriceQuote> quoteCache;
	private final TokenBucketRateLimiter rateLimiter;
	private final FinnhubApiProperties apiProperties;
	private final RateLimiterProperties rateLimiterProperties;
	private final Clock clock;
	private QuoteEventObserver eventObserver;
	private final ConcurrentHashMap<String, Mono<PriceQuote>> inFlightRequests = new ConcurrentHashMap<>();

	public FinnhubPriceProvider(
			FinnhubClient finnhubClient,
			QuoteMapper mapper,
			Cache<String, PriceQuote> quoteCache,
			TokenBucketRateLimiter rateLimiter,
			FinnhubApiProperties apiProperties,
			RateLimiterProperties rateLimiterProperties,
			Clock clock) {
		this.finnhubClient = finnhubClient;
		this.mapper = mapper;
		this.quoteCache = quoteCache;
		this.rateLimiter = rateLimiter;
		this.apiProperties = apiProperties;
		this.rateLimiterProperties = rateLimiterProperties;
		this.clock = clock;
	}

	public void setObserver(QuoteEventObserver observer) {
		this.eventObserver = observer;
	}

	@Override
	public Mono<Map<String, PriceQuote>> fetch(List<String> symbols) {
		if (symbols.isEmpty()) {
			return Mono.just(Map.of());
		}
		return Flux.fromIterable(symbols)
				.distinct()
				.flatMap(this::getQuote, Math.max(1, apiProperties.maxConcurrency()))
				.collectMap(PriceQuote::symbol)
				.doOnNext(quotes -> {
					long available = quotes.values().stream().filter(PriceQuote::available).count();
					if (available == 0) {
						logger.warn("No prices available for any of {} symbols", quotes.size());
					} else {
						logger.debug("Fetched {}/{} prices", available, quotes.size());
					}
				});
	}

	/**
	 * Gets the quote for one symbol, sharing cached and in-flight results.
	 *
	 * @param symbol Stock symbol (e.g., "AAPL")
	 * @return Mono with the quote, or an unavailable marker; never an error
	 */
	public Mono<PriceQuote> getQuote(String symbol) {
		PriceQuote cached = quoteCache.getIfPresent(symbol);
		if (cached != null) {
			logger.debug("Cache hit for symbol: {}", symbol);
			if (eventObserver != null) {
				eventObserver.onCacheHit();
			}
			return Mono.just(cached);
		}

		if (eventObserver != null) {
			eventObserver.onCacheMiss();
		}

		Mono<PriceQuote> inFlight = inFlightRequests.get(symbol);
		if (inFlight != null) {
			logger.debug("In-flight quote request found for symbol: {}, sharing it", symbol);
			if (eventObserver != null) {
				eventObserver.onInFlightSharing();
			}
			return inFlight;
		}

		Mono<PriceQuote> fetchOperation = rateLimiter.acquire(1, rateLimiterProperties.acquireTimeout())
				.flatMap(result -> {
					if (!result.isGranted()) {
						logger.warn("No rate limiter token for {} within {}, skipping this cycle", symbol,
								rateLimiterProperties.acquireTimeout());
						return Mono.just(PriceQuote.unavailable(symbol, clock.instant()));
					}
					return finnhubClient.getQuote(symbol)
							.map(quote -> mapper.toPriceQuote(symbol, quote, clock.instant()))
							.doOnNext(quote -> {
								if (quote.available()) {
									quoteCache.put(symbol, quote);
								}
							});
				})
				.switchIfEmpty(Mono.fromSupplier(() -> PriceQuote.unavailable(symbol, clock.instant())))
				.onErrorResume(SymbolNotFoundException.class, ex -> {
					logger.warn("Symbol not found upstream: {}", symbol);
					return Mono.just(PriceQuote.unavailable(symbol, clock.instant()));
				})
				.onErrorResume(ex -> {
					logger.warn("Failed to fetch quote for {}: {}", symbol, ex.getMessage());
					return Mono.just(PriceQuote.unavailable(symbol, clock.instant()));
				})
				.doOnNext(quote -> {
					if (!quote.available() && eventObserver != null) {
						eventObserver.onQuoteUnavailable();
					}
				})
				.cache()
				.doFinally(signalType -> inFlightRequests.remove(symbol));

		Mono<PriceQuote> existing = inFlightRequests.putIfAbsent(symbol, fetchOperation);
		if (existing != null) {
			logger.debug("Another caller created the in-flight request for symbol: {}, using it", symbol);
			return existing;
		}

		return fetchOperation;
	}
}
