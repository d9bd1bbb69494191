package com.GlobeLine.price_broadcaster.broadcast;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.GlobeLine.price_broadcaster.dto.PriceUpdateMessage;
import com.GlobeLine.price_broadcaster.service.PriceUpdateService;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;

/**
 * Background polling loop for one topic. Sleeps the scheduled interval, builds an update
 * and publishes it through the owning {@link ConnectionRegistry}, until stopped.
 *
 * Only the registry starts and stops workers. A cycle that fails is logged and the
 * loop carries on; a stopped worker never publishes again.
 */
public class TopicWorker {

	private static final Logger logger = LoggerFactory.getLogger(TopicWorker.class);

	private final long topicId;
	private final PriceUpdateService updateService;
	private final PollingSchedule schedule;
	private final ConnectionRegistry registry;
	private final Clock clock;

	private final AtomicReference<WorkerState> state = new AtomicReference<>(WorkerState.STARTING);
	private final CountDownLatch terminated = new CountDownLatch(1);
	// guards cycleInFlight and publishingThread
	private final Object cycleMonitor = new Object();
	private boolean cycleInFlight;
	private Thread publishingThread;
	private volatile Disposable loop;
	private volatile Instant lastRunAt;

	TopicWorker(long topicId, PriceUpdateService updateService, PollingSchedule schedule,
			ConnectionRegistry registry, Clock clock) {
		this.topicId = topicId;
		this.updateService = updateService;
		this.schedule = schedule;
		this.registry = registry;
		this.clock = clock;
	}

	public long getTopicId() {
		return topicId;
	}

	public WorkerState getState() {
		return state.get();
	}

	public Instant getLastRunAt() {
		return lastRunAt;
	}

	void start() {
		if (loop != null) {
			throw new IllegalStateException("Worker for topic " + topicId + " already started");
		}
		loop = Mono.defer(() -> Mono.delay(schedule.intervalAt(clock.instant())))
				.then(Mono.defer(this::runCycle))
				.repeat()
				.doOnSubscribe(subscription -> {
					state.compareAndSet(WorkerState.STARTING, WorkerState.RUNNING);
					logger.info("Worker started for topic {}", topicId);
				})
				.doFinally(signalType -> {
					state.set(WorkerState.STOPPED);
					terminated.countDown();
					logger.info("Worker stopped for topic {} ({})", topicId, signalType);
				})
				.subscribe(null, error -> logger.error("Worker loop for topic {} ended unexpectedly", topicId, error));
	}

	/**
	 * Cancels the loop and waits until it has terminated and no cycle is still running,
	 * including a publish already handed to the registry.
	 *
	 * @return true if the worker terminated within the timeout
	 */
	boolean stop(Duration timeout) {
		WorkerState previous = state.getAndUpdate(current -> current == WorkerState.STOPPED
				? WorkerState.STOPPED
				: WorkerState.CANCELLING);
		if (previous == WorkerState.STOPPED) {
			return true;
		}

		Disposable current = loop;
		if (current == null) {
			// never started
			state.set(WorkerState.STOPPED);
			terminated.countDown();
			return true;
		}
		current.dispose();

		// Stopped from inside our own publish (a failed send removed the last subscriber).
		if (isPublishingThread()) {
			return true;
		}
		long deadline = System.nanoTime() + timeout.toNanos();
		try {
			if (!terminated.await(timeout.toNanos(), TimeUnit.NANOSECONDS) || !awaitCycleEnd(deadline)) {
				logger.error("Worker for topic {} did not stop within {}", topicId, timeout);
				return false;
			}
			return true;
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			logger.warn("Interrupted while stopping worker for topic {}", topicId);
			return false;
		}
	}

	boolean isCycleInFlight() {
		synchronized (cycleMonitor) {
			return cycleInFlight || publishingThread != null;
		}
	}

	private boolean isPublishingThread() {
		synchronized (cycleMonitor) {
			return publishingThread == Thread.currentThread();
		}
	}

	private boolean awaitCycleEnd(long deadlineNanos) throws InterruptedException {
		synchronized (cycleMonitor) {
			while (cycleInFlight || publishingThread != null) {
				long remaining = deadlineNanos - System.nanoTime();
				if (remaining <= 0) {
					return false;
				}
				TimeUnit.NANOSECONDS.timedWait(cycleMonitor, remaining);
			}
			return true;
		}
	}

	private void endCycle() {
		synchronized (cycleMonitor) {
			cycleInFlight = false;
			cycleMonitor.notifyAll();
		}
	}

	private Mono<Void> runCycle() {
		synchronized (cycleMonitor) {
			if (state.get() != WorkerState.RUNNING) {
				return Mono.empty();
			}
			cycleInFlight = true;
		}
		return updateService.buildUpdate(topicId)
				.doOnNext(this::publish)
				.onErrorResume(ex -> {
					logger.warn("Update cycle failed for topic {}, will retry next interval: {}", topicId,
							ex.getMessage());
					return Mono.empty();
				})
				.doFinally(signalType -> endCycle())
				.then();
	}

	// A cancel ends the cycle's Mono at once, so a publish in progress is tracked on its own.
	private void publish(PriceUpdateMessage message) {
		synchronized (cycleMonitor) {
			if (state.get() != WorkerState.RUNNING) {
				return;
			}
			publishingThread = Thread.currentThread();
		}
		lastRunAt = clock.instant();
		try {
			registry.broadcastFrom(this, message);
		} finally {
			synchronized (cycleMonitor) {
				publishingThread = null;
				cycleMonitor.notifyAll();
			}
		}
	}
}
