package com.GlobeLine.price_broadcaster.service;

import java.time.Clock;
import java.util.Map;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.GlobeLine.price_broadcaster.dto.PriceQuote;
import com.GlobeLine.price_broadcaster.dto.PriceUpdateMessage;
import com.GlobeLine.price_broadcaster.mapper.PriceUpdateMapper;
import com.GlobeLine.price_broadcaster.topic.AuthenticatedUser;
import com.GlobeLine.price_broadcaster.topic.TopicDataAccess;
import com.GlobeLine.price_broadcaster.topic.TopicDataSession;
import com.GlobeLine.price_broadcaster.topic.WatchlistTopic;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Builds price_update messages: resolves a topic through a short-lived data session,
 * fetches its prices and merges both.
 */
@Service
public class PriceUpdateService {

	private static final Logger logger = LoggerFactory.getLogger(PriceUpdateService.class);

	private final TopicDataAccess dataAccess;
	private final PriceProvider priceProvider;
	private final PriceUpdateMapper mapper;
	private final Clock clock;

	public PriceUpdateService(
			TopicDataAccess dataAccess,
			PriceProvider priceProvider,
			PriceUpdateMapper mapper,
			Clock clock) {
		this.dataAccess = dataAccess;
		this.priceProvider = priceProvider;
		this.mapper = mapper;
		this.clock = clock;
	}

	/**
	 * Resolves the topic in a fresh session and builds its current update.
	 * Completes empty when the topic no longer exists; errors when it cannot be resolved.
	 *
	 * @param topicId watchlist id
	 * @return Mono with the update, empty if the topic is gone
	 */
	public Mono<PriceUpdateMessage> buildUpdate(long topicId) {
		return findTopic(topicId)
				.switchIfEmpty(Mono.fromRunnable(() -> logger.debug("Watchlist {} no longer exists", topicId)))
				.flatMap(this::buildUpdate);
	}

	/**
	 * Builds the update for an already resolved topic. A failed price fetch degrades to
	 * every symbol unavailable rather than an error.
	 */
	public Mono<PriceUpdateMessage> buildUpdate(WatchlistTopic topic) {
		return priceProvider.fetch(topic.symbols())
				.onErrorResume(ex -> {
					logger.warn("Price fetch failed for watchlist {}, sending empty prices: {}", topic.id(),
							ex.getMessage());
					return Mono.just(Map.<String, PriceQuote>of());
				})
				.defaultIfEmpty(Map.of())
				.map(quotes -> mapper.toMessage(topic, quotes, clock.instant()));
	}

	/**
	 * Resolves the topic for a user, checking access, in a fresh session.
	 * Errors with TopicAccessDeniedException when missing or not accessible.
	 */
	public Mono<WatchlistTopic> resolveTopic(long topicId, AuthenticatedUser user) {
		return withSession(session -> session.resolveTopic(topicId, user));
	}

	private Mono<WatchlistTopic> findTopic(long topicId) {
		return withSession(session -> session.findTopic(topicId).orElse(null));
	}

	private Mono<WatchlistTopic> withSession(Function<TopicDataSession, WatchlistTopic> work) {
		return Mono.using(
						dataAccess::openSession,
						session -> Mono.fromCallable(() -> work.apply(session)),
						TopicDataSession::close)
				.subscribeOn(Schedulers.boundedElastic());
	}
}
