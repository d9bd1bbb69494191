package com.GlobeLine.price_broadcaster.topic;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Topic directory held in memory. The hosting application registers watchlists here
 * until a persistent {@link TopicDataAccess} takes its place.
 */
@Component
public class InMemoryTopicDataAccess implements TopicDataAccess {

	private static final Logger logger = LoggerFactory.getLogger(InMemoryTopicDataAccess.class);

	private final Map<Long, WatchlistTopic> topics = new ConcurrentHashMap<>();
	private final AtomicInteger openSessions = new AtomicInteger();

	public void putTopic(WatchlistTopic topic) {
		topics.put(topic.id(), topic);
		logger.info("Registered watchlist {} ({} symbols, owner {})", topic.id(), topic.items().size(),
				topic.ownerId());
	}

	public void removeTopic(long topicId) {
		if (topics.remove(topicId) != null) {
			logger.info("Removed watchlist {}", topicId);
		}
	}

	public Collection<WatchlistTopic> topics() {
		return List.copyOf(topics.values());
	}

	/**
	 * Sessions handed out and not yet closed.
	 */
	public int openSessionCount() {
		return openSessions.get();
	}

	@Override
	public TopicDataSession openSession() {
		openSessions.incrementAndGet();
		return new TopicDataSession() {

			private boolean closed;

			@Override
			public Optional<WatchlistTopic> findTopic(long topicId) {
				if (closed) {
					throw new IllegalStateException("Session already closed");
				}
				return Optional.ofNullable(topics.get(topicId));
			}

			@Override
			public void close() {
				if (!closed) {
					closed = true;
					openSessions.decrementAndGet();
				}
			}
		};
	}
}
