package com.GlobeLine.price_broadcaster.broadcast;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import jakarta.annotation.PreDestroy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.GlobeLine.price_broadcaster.config.BroadcasterProperties;
import com.GlobeLine.price_broadcaster.dto.PriceUpdateMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Owns the topic to connections map and the topic to worker map, and is the only place
 * workers are started or stopped.
 *
 * Every mutation of either map happens under one lock, so a topic has a worker exactly
 * while it has subscribers. Payloads are sent outside the lock; a connection whose send
 * fails is unsubscribed and closed.
 *
 * The last unsubscribe waits for the worker to finish, lock held, so a new worker for the
 * same topic can only start afterwards. Worker threads therefore never block on the lock:
 * they poll for it and give up once their worker is being stopped.
 */
@Component
public class ConnectionRegistry {

	private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

	private static final long WORKER_LOCK_POLL_MILLIS = 10;

	private final ReentrantLock guard = new ReentrantLock();
	private final Map<Long, Set<PriceStreamConnection>> connections = new HashMap<>();
	private final Map<Long, TopicWorker> workers = new HashMap<>();

	private final TopicWorkerFactory workerFactory;
	private final ObjectMapper objectMapper;
	private final Duration workerStopTimeout;
	private BroadcastEventObserver eventObserver;

	public ConnectionRegistry(TopicWorkerFactory workerFactory, ObjectMapper objectMapper,
			BroadcasterProperties properties) {
		this.workerFactory = workerFactory;
		this.objectMapper = objectMapper;
		this.workerStopTimeout = properties.workerStopTimeout();
	}

	public void setObserver(BroadcastEventObserver observer) {
		this.eventObserver = observer;
	}

	/**
	 * Adds the connection to the topic, starting the topic's worker if it has none.
	 * Subscribing the same connection twice has no further effect.
	 */
	public void subscribe(long topicId, PriceStreamConnection connection) {
		boolean added;
		boolean workerStarted = false;
		int subscribers;

		guard.lock();
		try {
			Set<PriceStreamConnection> topicConnections = connections.computeIfAbsent(topicId,
					id -> new LinkedHashSet<>());
			added = topicConnections.add(connection);
			subscribers = topicConnections.size();
			if (!workers.containsKey(topicId)) {
				TopicWorker worker = workerFactory.create(topicId, this);
				workers.put(topicId, worker);
				worker.start();
				workerStarted = true;
			}
		} finally {
			guard.unlock();
		}

		if (added) {
			logger.info("Connection {} (user {}) subscribed to topic {}, {} subscriber(s)", connection.id(),
					connection.userId(), topicId, subscribers);
		}
		if (workerStarted && eventObserver != null) {
			eventObserver.onWorkerStarted(topicId);
		}
	}

	/**
	 * Removes the connection. When it was the topic's last subscriber the worker is
	 * cancelled and awaited before the topic is forgotten. Unknown topics or connections
	 * are ignored.
	 */
	public void unsubscribe(long topicId, PriceStreamConnection connection) {
		Removal removal;
		guard.lock();
		try {
			removal = remove(topicId, connection);
		} finally {
			guard.unlock();
		}
		afterRemoval(topicId, connection, removal);
	}

	/**
	 * Sends the message to every current subscriber of the topic.
	 *
	 * @return number of connections the message was delivered to
	 */
	public int broadcast(long topicId, PriceUpdateMessage message) {
		String payload = serialize(message);
		List<PriceStreamConnection> recipients;
		guard.lock();
		try {
			recipients = snapshot(topicId);
		} finally {
			guard.unlock();
		}
		return deliver(topicId, payload, recipients, null);
	}

	/**
	 * Publish path for workers. A worker that no longer owns its topic delivers nothing.
	 */
	int broadcastFrom(TopicWorker worker, PriceUpdateMessage message) {
		long topicId = worker.getTopicId();
		String payload = serialize(message);
		List<PriceStreamConnection> recipients;
		if (!lockFor(worker)) {
			logger.debug("Dropping update from stopping worker for topic {}", topicId);
			return 0;
		}
		try {
			if (workers.get(topicId) != worker) {
				logger.debug("Dropping update from stale worker for topic {}", topicId);
				return 0;
			}
			recipients = snapshot(topicId);
		} finally {
			guard.unlock();
		}
		return deliver(topicId, payload, recipients, worker);
	}

	public int activeTopicCount() {
		guard.lock();
		try {
			return connections.size();
		} finally {
			guard.unlock();
		}
	}

	public int connectionCount() {
		guard.lock();
		try {
			return connections.values().stream().mapToInt(Set::size).sum();
		} finally {
			guard.unlock();
		}
	}

	public int subscriberCount(long topicId) {
		guard.lock();
		try {
			Set<PriceStreamConnection> topicConnections = connections.get(topicId);
			return topicConnections != null ? topicConnections.size() : 0;
		} finally {
			guard.unlock();
		}
	}

	public boolean hasWorker(long topicId) {
		guard.lock();
		try {
			return workers.containsKey(topicId);
		} finally {
			guard.unlock();
		}
	}

	public Optional<WorkerState> workerState(long topicId) {
		guard.lock();
		try {
			return Optional.ofNullable(workers.get(topicId)).map(TopicWorker::getState);
		} finally {
			guard.unlock();
		}
	}

	public List<TopicSummary> topicSummaries() {
		guard.lock();
		try {
			List<TopicSummary> summaries = new ArrayList<>(connections.size());
			connections.forEach((topicId, topicConnections) -> {
				TopicWorker worker = workers.get(topicId);
				summaries.add(new TopicSummary(
						topicId,
						topicConnections.size(),
						worker != null ? worker.getState() : null,
						worker != null ? worker.getLastRunAt() : null));
			});
			return summaries;
		} finally {
			guard.unlock();
		}
	}

	@PreDestroy
	public void shutdown() {
		List<PriceStreamConnection> open = new ArrayList<>();
		guard.lock();
		try {
			workers.values().forEach(worker -> worker.stop(workerStopTimeout));
			workers.clear();
			connections.values().forEach(open::addAll);
			connections.clear();
		} finally {
			guard.unlock();
		}
		open.forEach(PriceStreamConnection::close);
		logger.info("Registry shut down, closed {} connection(s)", open.size());
	}

	private List<PriceStreamConnection> snapshot(long topicId) {
		Set<PriceStreamConnection> topicConnections = connections.get(topicId);
		return topicConnections != null ? List.copyOf(topicConnections) : List.of();
	}

	private Removal remove(long topicId, PriceStreamConnection connection) {
		Set<PriceStreamConnection> topicConnections = connections.get(topicId);
		if (topicConnections == null || !topicConnections.remove(connection)) {
			return null;
		}
		boolean workerStopped = false;
		if (topicConnections.isEmpty()) {
			connections.remove(topicId);
			TopicWorker worker = workers.get(topicId);
			if (worker != null) {
				worker.stop(workerStopTimeout);
				workers.remove(topicId);
				workerStopped = true;
			}
		}
		return new Removal(topicConnections.size(), workerStopped);
	}

	private void afterRemoval(long topicId, PriceStreamConnection connection, Removal removal) {
		if (removal == null) {
			return;
		}
		logger.info("Connection {} left topic {}, {} subscriber(s) remaining", connection.id(), topicId,
				removal.remaining());
		if (removal.workerStopped() && eventObserver != null) {
			eventObserver.onWorkerStopped(topicId);
		}
	}

	/**
	 * Takes the lock on behalf of a worker, unless the worker stops running first.
	 */
	private boolean lockFor(TopicWorker worker) {
		try {
			while (!guard.tryLock(WORKER_LOCK_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
				if (worker.getState() != WorkerState.RUNNING) {
					return false;
				}
			}
			return true;
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			return false;
		}
	}

	/**
	 * Unsubscribe issued from a worker's publish. If the worker is already being stopped,
	 * whoever stops it emptied the topic, so there is nothing left to remove.
	 */
	private void unsubscribeFrom(TopicWorker worker, long topicId, PriceStreamConnection connection) {
		if (!lockFor(worker)) {
			return;
		}
		Removal removal;
		try {
			removal = remove(topicId, connection);
		} finally {
			guard.unlock();
		}
		afterRemoval(topicId, connection, removal);
	}

	private int deliver(long topicId, String payload, List<PriceStreamConnection> recipients,
			TopicWorker publisher) {
		if (recipients.isEmpty()) {
			return 0;
		}
		List<PriceStreamConnection> failed = new ArrayList<>();
		for (PriceStreamConnection connection : recipients) {
			if (!trySend(connection, payload)) {
				failed.add(connection);
			}
		}

		for (PriceStreamConnection connection : failed) {
			logger.warn("Dropping connection {} from topic {} after failed send", connection.id(), topicId);
			if (eventObserver != null) {
				eventObserver.onSendFailure(topicId);
			}
			if (publisher != null) {
				unsubscribeFrom(publisher, topicId, connection);
			} else {
				unsubscribe(topicId, connection);
			}
			connection.close();
		}

		int delivered = recipients.size() - failed.size();
		logger.debug("Broadcast to topic {}: {} delivered, {} dropped", topicId, delivered, failed.size());
		if (eventObserver != null) {
			eventObserver.onBroadcast(topicId, delivered);
		}
		return delivered;
	}

	private boolean trySend(PriceStreamConnection connection, String payload) {
		try {
			return connection.isOpen() && connection.send(payload);
		} catch (RuntimeException ex) {
			logger.warn("Send to connection {} failed: {}", connection.id(), ex.getMessage());
			return false;
		}
	}

	private String serialize(PriceUpdateMessage message) {
		try {
			return objectMapper.writeValueAsString(message);
		} catch (JsonProcessingException ex) {
			throw new IllegalStateException("Could not serialise update for topic " + message.topicId(), ex);
		}
	}

	private record Removal(int remaining, boolean workerStopped) {
	}
}
