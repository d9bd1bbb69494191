package com.GlobeLine.price_broadcaster.broadcast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.GlobeLine.price_broadcaster.service.PriceUpdateService;
import com.fasterxml.jackson.databind.ObjectMapper;

import reactor.core.publisher.Mono;

/**
 * Unit tests for ConnectionRegistry: worker lifecycle per topic and fan-out.
 * Workers are real and poll a mocked PriceUpdateService every 50ms.
 */
class ConnectionRegistryTest {

	private static final long TOPIC = 1L;

	private PriceUpdateService updateService;
	private RecordingWorkerFactory workerFactory;
	private BroadcastEventObserver eventObserver;
	private ConnectionRegistry registry;

	@BeforeEach
	void setUp() {
		updateService = mock(PriceUpdateService.class);
		when(updateService.buildUpdate(anyLong()))
				.thenAnswer(invocation -> Mono.just(BroadcastTestSupport.update(invocation.getArgument(0))));

		PollingSchedule schedule = new PollingSchedule(BroadcastTestSupport.properties(Duration.ofMillis(50)));
		workerFactory = new RecordingWorkerFactory(updateService, schedule);
		eventObserver = mock(BroadcastEventObserver.class);
		registry = new ConnectionRegistry(workerFactory, new ObjectMapper(),
				BroadcastTestSupport.properties(Duration.ofMillis(50)));
		registry.setObserver(eventObserver);
	}

	@AfterEach
	void tearDown() {
		registry.shutdown();
	}

	@Test
	void subscribe_ConcurrentFirstSubscribers_StartExactlyOneWorker() throws Exception {
		// Arrange
		int subscribers = 20;
		ExecutorService pool = Executors.newFixedThreadPool(subscribers);
		CountDownLatch ready = new CountDownLatch(1);
		List<FakeConnection> connections = new ArrayList<>();
		for (int i = 0; i < subscribers; i++) {
			connections.add(new FakeConnection("c" + i));
		}

		// Act
		for (FakeConnection connection : connections) {
			pool.submit(() -> {
				ready.await();
				registry.subscribe(TOPIC, connection);
				return null;
			});
		}
		ready.countDown();
		pool.shutdown();
		assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

		// Assert
		assertThat(workerFactory.created()).hasSize(1);
		assertThat(registry.subscriberCount(TOPIC)).isEqualTo(subscribers);
		assertThat(registry.hasWorker(TOPIC)).isTrue();
		verify(eventObserver, times(1)).onWorkerStarted(TOPIC);
	}

	@Test
	void subscribe_SameConnectionTwice_IsCountedOnce() {
		FakeConnection connection = new FakeConnection("c1");

		registry.subscribe(TOPIC, connection);
		registry.subscribe(TOPIC, connection);

		assertThat(registry.subscriberCount(TOPIC)).isEqualTo(1);
		assertThat(workerFactory.created()).hasSize(1);
	}

	@Test
	void unsubscribe_LastSubscriber_StopsWorkerBeforeReturning() {
		// Arrange
		FakeConnection first = new FakeConnection("c1");
		FakeConnection second = new FakeConnection("c2");
		registry.subscribe(TOPIC, first);
		registry.subscribe(TOPIC, second);
		TopicWorker worker = workerFactory.created().get(0);

		// Act & Assert: one left, worker stays
		registry.unsubscribe(TOPIC, first);
		assertThat(registry.hasWorker(TOPIC)).isTrue();
		assertThat(worker.getState()).isEqualTo(WorkerState.RUNNING);

		// Act & Assert: none left, worker already stopped when unsubscribe returns
		registry.unsubscribe(TOPIC, second);
		assertThat(registry.hasWorker(TOPIC)).isFalse();
		assertThat(registry.activeTopicCount()).isZero();
		assertThat(worker.getState()).isEqualTo(WorkerState.STOPPED);
		verify(eventObserver).onWorkerStopped(TOPIC);
	}

	@Test
	void unsubscribe_DuringSlowSend_WaitsForOldWorkerBeforeFreshOneStarts() {
		// Arrange: the worker is blocked inside a send when its last subscriber leaves
		FakeConnection slow = new FakeConnection("slow");
		slow.delaySends(Duration.ofMillis(500));
		registry.subscribe(TOPIC, slow);
		await().atMost(2, TimeUnit.SECONDS).until(slow::isSending);
		TopicWorker oldWorker = workerFactory.created().get(0);

		// Act
		registry.unsubscribe(TOPIC, slow);

		// Assert: the old worker finished its send before unsubscribe returned
		assertThat(slow.isSending()).isFalse();
		assertThat(slow.messages()).hasSize(1);
		assertThat(oldWorker.getState()).isEqualTo(WorkerState.STOPPED);
		assertThat(oldWorker.isCycleInFlight()).isFalse();

		FakeConnection fresh = new FakeConnection("fresh");
		registry.subscribe(TOPIC, fresh);
		assertThat(workerFactory.created()).hasSize(2);
		await().atMost(2, TimeUnit.SECONDS).until(() -> !fresh.messages().isEmpty());
		assertThat(slow.messages()).hasSize(1);
	}

	@Test
	void unsubscribe_UnknownTopicOrConnection_IsNoOp() {
		FakeConnection subscribed = new FakeConnection("c1");
		registry.subscribe(TOPIC, subscribed);

		registry.unsubscribe(99L, subscribed);
		registry.unsubscribe(TOPIC, new FakeConnection("stranger"));
		registry.unsubscribe(TOPIC, subscribed);
		registry.unsubscribe(TOPIC, subscribed);

		assertThat(registry.hasWorker(TOPIC)).isFalse();
		verify(eventObserver, times(1)).onWorkerStopped(TOPIC);
	}

	@Test
	void subscribe_AfterTeardown_StartsFreshWorker() {
		// Arrange
		FakeConnection connection = new FakeConnection("c1");
		registry.subscribe(TOPIC, connection);
		registry.unsubscribe(TOPIC, connection);

		// Act
		registry.subscribe(TOPIC, new FakeConnection("c2"));

		// Assert
		assertThat(workerFactory.created()).hasSize(2);
		assertThat(workerFactory.created().get(0).getState()).isEqualTo(WorkerState.STOPPED);
		assertThat(workerFactory.created().get(1).getState()).isEqualTo(WorkerState.RUNNING);
	}

	@Test
	void worker_PublishesToEverySubscriberEachCycle() {
		FakeConnection first = new FakeConnection("c1");
		FakeConnection second = new FakeConnection("c2");
		registry.subscribe(TOPIC, first);
		registry.subscribe(TOPIC, second);

		await().atMost(2, TimeUnit.SECONDS).untilAsserted(() -> {
			assertThat(first.messages()).hasSizeGreaterThanOrEqualTo(2);
			assertThat(second.messages()).hasSizeGreaterThanOrEqualTo(2);
		});
		assertThat(first.messages().get(0)).contains("\"type\":\"price_update\"").contains("\"topic_id\":1");
	}

	@Test
	void broadcast_FailingConnection_IsDroppedOthersStillReceive() {
		// Arrange
		FakeConnection healthy = new FakeConnection("ok1");
		FakeConnection broken = new FakeConnection("broken");
		FakeConnection alsoHealthy = new FakeConnection("ok2");
		registry.subscribe(TOPIC, healthy);
		registry.subscribe(TOPIC, broken);
		registry.subscribe(TOPIC, alsoHealthy);
		broken.failSends();

		// Act
		int delivered = registry.broadcast(TOPIC, BroadcastTestSupport.update(TOPIC));

		// Assert
		assertThat(delivered).isEqualTo(2);
		assertThat(healthy.messages()).isNotEmpty();
		assertThat(alsoHealthy.messages()).isNotEmpty();
		assertThat(registry.subscriberCount(TOPIC)).isEqualTo(2);
		assertThat(broken.closeCount()).isEqualTo(1);
		verify(eventObserver).onSendFailure(TOPIC);
	}

	@Test
	void broadcast_LastConnectionFails_TearsDownWorker() {
		FakeConnection broken = new FakeConnection("broken");
		registry.subscribe(TOPIC, broken);
		broken.failSends();

		registry.broadcast(TOPIC, BroadcastTestSupport.update(TOPIC));

		assertThat(registry.hasWorker(TOPIC)).isFalse();
		assertThat(workerFactory.created().get(0).getState()).isEqualTo(WorkerState.STOPPED);
	}

	@Test
	void worker_SendFailureOfLastConnection_StopsItself() {
		FakeConnection broken = new FakeConnection("broken");
		broken.failSends();
		registry.subscribe(TOPIC, broken);

		await().atMost(2, TimeUnit.SECONDS).until(() -> !registry.hasWorker(TOPIC));
		assertThat(workerFactory.created().get(0).getState()).isEqualTo(WorkerState.STOPPED);
		assertThat(broken.closeCount()).isEqualTo(1);
	}

	@Test
	void broadcastFrom_StaleWorker_DeliversNothing() {
		// Arrange: first worker torn down, second one owns the topic now
		FakeConnection first = new FakeConnection("c1");
		registry.subscribe(TOPIC, first);
		TopicWorker stale = workerFactory.created().get(0);
		registry.unsubscribe(TOPIC, first);
		FakeConnection second = new FakeConnection("c2");
		registry.subscribe(TOPIC, second);

		// Act
		int delivered = registry.broadcastFrom(stale, BroadcastTestSupport.update(TOPIC));

		// Assert
		assertThat(delivered).isZero();
		assertThat(stale.getState()).isEqualTo(WorkerState.STOPPED);
	}

	@Test
	void unsubscribe_NoBroadcastReachesConnectionAfterTeardown() {
		FakeConnection connection = new FakeConnection("c1");
		registry.subscribe(TOPIC, connection);
		await().atMost(2, TimeUnit.SECONDS).until(() -> !connection.messages().isEmpty());

		registry.unsubscribe(TOPIC, connection);
		int received = connection.messages().size();

		await().during(Duration.ofMillis(300)).atMost(Duration.ofSeconds(1))
				.until(() -> connection.messages().size() == received);
	}

	@Test
	void topicSummaries_ReportSubscribersAndWorkerState() {
		registry.subscribe(TOPIC, new FakeConnection("c1"));
		registry.subscribe(TOPIC, new FakeConnection("c2"));
		registry.subscribe(2L, new FakeConnection("c3"));

		List<TopicSummary> summaries = registry.topicSummaries();

		assertThat(summaries).hasSize(2);
		assertThat(summaries).filteredOn(summary -> summary.topicId() == TOPIC)
				.singleElement()
				.satisfies(summary -> {
					assertThat(summary.subscribers()).isEqualTo(2);
					assertThat(summary.workerState()).isEqualTo(WorkerState.RUNNING);
				});
		assertThat(registry.connectionCount()).isEqualTo(3);
	}
}
