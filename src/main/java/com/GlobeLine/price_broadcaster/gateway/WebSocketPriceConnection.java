package com.GlobeLine.price_broadcaster.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;

import com.GlobeLine.price_broadcaster.broadcast.PriceStreamConnection;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

/**
 * {@link PriceStreamConnection} over a WebFlux WebSocket session.
 *
 * Payloads are queued in a bounded buffer drained by the session's send pipeline, so
 * {@link #send} never blocks. A client too slow to keep the buffer from filling up
 * gets {@code false} back and is dropped by the registry.
 */
class WebSocketPriceConnection implements PriceStreamConnection {

	private static final Logger logger = LoggerFactory.getLogger(WebSocketPriceConnection.class);

	private final WebSocketSession session;
	private final long userId;
	private final Sinks.Many<String> outbound;
	private volatile boolean open = true;

	WebSocketPriceConnection(WebSocketSession session, long userId, int bufferSize) {
		this.session = session;
		this.userId = userId;
		this.outbound = Sinks.many().unicast().onBackpressureBuffer(Queues.<String>get(bufferSize).get());
	}

	@Override
	public String id() {
		return session.getId();
	}

	@Override
	public long userId() {
		return userId;
	}

	// Emissions from worker, gateway and ping replies must not overlap on the sink.
	@Override
	public synchronized boolean send(String payload) {
		if (!open) {
			return false;
		}
		Sinks.EmitResult result = outbound.tryEmitNext(payload);
		if (result.isFailure()) {
			logger.debug("Could not queue payload for connection {}: {}", id(), result);
			return false;
		}
		return true;
	}

	@Override
	public boolean isOpen() {
		return open && session.isOpen();
	}

	@Override
	public void close() {
		close(CloseStatus.NORMAL);
	}

	synchronized void close(CloseStatus status) {
		if (!open) {
			return;
		}
		open = false;
		outbound.tryEmitComplete();
		if (session.isOpen()) {
			session.close(status)
					.subscribe(null, ex -> logger.debug("Closing session {} failed: {}", id(), ex.getMessage()));
		}
	}

	Flux<WebSocketMessage> outboundMessages() {
		return outbound.asFlux().map(session::textMessage);
	}
}
