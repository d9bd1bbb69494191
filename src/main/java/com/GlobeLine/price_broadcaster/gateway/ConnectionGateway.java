package com.GlobeLine.price_broadcaster.gateway;

import java.net.URI;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriTemplate;

import com.GlobeLine.price_broadcaster.broadcast.ConnectionRegistry;
import com.GlobeLine.price_broadcaster.config.BroadcasterProperties;
import com.GlobeLine.price_broadcaster.dto.PongMessage;
import com.GlobeLine.price_broadcaster.exception.CredentialRejectedException;
import com.GlobeLine.price_broadcaster.exception.ServiceUnavailableException;
import com.GlobeLine.price_broadcaster.exception.TopicAccessDeniedException;
import com.GlobeLine.price_broadcaster.service.PriceUpdateService;
import com.GlobeLine.price_broadcaster.topic.AuthenticatedUser;
import com.GlobeLine.price_broadcaster.topic.CredentialVerifier;
import com.GlobeLine.price_broadcaster.topic.WatchlistTopic;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * WebSocket endpoint streaming price updates for one watchlist:
 * {@code /api/v1/ws/watchlist/{topicId}/prices?token=...}.
 *
 * A connection is authenticated and authorised before it reaches the registry.
 * Once subscribed it immediately gets one update of its own, then whatever the
 * topic's worker broadcasts. However the connection ends, it is unsubscribed once.
 */
@Component
public class ConnectionGateway implements WebSocketHandler {

	private static final Logger logger = LoggerFactory.getLogger(ConnectionGateway.class);

	public static final String PATH = "/api/v1/ws/watchlist/{topicId}/prices";

	static final CloseStatus MISSING_TOKEN = CloseStatus.POLICY_VIOLATION.withReason("Missing authentication token");
	static final CloseStatus ACCESS_DENIED = CloseStatus.POLICY_VIOLATION
			.withReason("Watchlist not found or access denied");
	static final CloseStatus SESSION_SERVICE_UNAVAILABLE = CloseStatus.SERVER_ERROR
			.withReason("Session service unavailable");
	static final CloseStatus INTERNAL_ERROR = CloseStatus.SERVER_ERROR.withReason("Internal server error");

	private static final UriTemplate PATH_TEMPLATE = new UriTemplate(PATH);

	private final CredentialVerifier credentialVerifier;
	private final PriceUpdateService updateService;
	private final ConnectionRegistry registry;
	private final ObjectMapper objectMapper;
	private final Clock clock;
	private final int sendBufferSize;

	public ConnectionGateway(
			CredentialVerifier credentialVerifier,
			PriceUpdateService updateService,
			ConnectionRegistry registry,
			ObjectMapper objectMapper,
			Clock clock,
			BroadcasterProperties properties) {
		this.credentialVerifier = credentialVerifier;
		this.updateService = updateService;
		this.registry = registry;
		this.objectMapper = objectMapper;
		this.clock = clock;
		this.sendBufferSize = properties.sendBufferSize();
	}

	@Override
	public Mono<Void> handle(WebSocketSession session) {
		URI uri = session.getHandshakeInfo().getUri();
		String token = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst("token");
		if (token == null || token.isBlank()) {
			logger.info("Rejecting connection {}: no token", session.getId());
			return session.close(MISSING_TOKEN);
		}
		String topicIdText = PATH_TEMPLATE.match(uri.getPath()).get("topicId");

		return credentialVerifier.verify(token)
				.onErrorMap(ex -> !(ex instanceof CredentialRejectedException),
						ex -> new ServiceUnavailableException("Session service unavailable", ex))
				.switchIfEmpty(Mono.error(() -> new CredentialRejectedException("Invalid or expired session")))
				.flatMap(user -> resolveTopic(topicIdText, user)
						.flatMap(topic -> stream(session, user, topic)))
				.onErrorResume(CredentialRejectedException.class, ex -> {
					logger.info("Rejecting connection {}: {}", session.getId(), ex.getMessage());
					return session.close(CloseStatus.POLICY_VIOLATION.withReason(ex.getMessage()));
				})
				.onErrorResume(TopicAccessDeniedException.class, ex -> {
					logger.info("Rejecting connection {}: {}", session.getId(), ex.getMessage());
					return session.close(ACCESS_DENIED);
				})
				.onErrorResume(ServiceUnavailableException.class, ex -> {
					logger.error("Cannot verify session for connection {}", session.getId(), ex.getCause());
					return session.close(SESSION_SERVICE_UNAVAILABLE);
				})
				.onErrorResume(ex -> {
					logger.error("Price stream {} failed", session.getId(), ex);
					return session.close(INTERNAL_ERROR);
				});
	}

	private Mono<WatchlistTopic> resolveTopic(String topicIdText, AuthenticatedUser user) {
		long topicId;
		try {
			topicId = Long.parseLong(topicIdText);
		} catch (NumberFormatException ex) {
			return Mono.error(new TopicAccessDeniedException(-1, user.userId()));
		}
		return updateService.resolveTopic(topicId, user)
				.switchIfEmpty(Mono.error(() -> new TopicAccessDeniedException(topicId, user.userId())));
	}

	private Mono<Void> stream(WebSocketSession session, AuthenticatedUser user, WatchlistTopic topic) {
		WebSocketPriceConnection connection = new WebSocketPriceConnection(session, user.userId(), sendBufferSize);
		AtomicBoolean subscribed = new AtomicBoolean(true);
		// The last unsubscribe waits for the topic's worker, so keep it off the event loop.
		Runnable leave = () -> {
			if (subscribed.compareAndSet(true, false)) {
				Schedulers.boundedElastic().schedule(() -> registry.unsubscribe(topic.id(), connection));
			}
		};

		registry.subscribe(topic.id(), connection);

		Mono<Void> initialUpdate = updateService.buildUpdate(topic)
				.doOnNext(message -> connection.send(toJson(message)))
				.onErrorResume(ex -> {
					logger.warn("Initial update for topic {} failed: {}", topic.id(), ex.getMessage());
					return Mono.empty();
				})
				.then();

		Mono<Void> inbound = session.receive()
				.filter(message -> message.getType() == WebSocketMessage.Type.TEXT)
				.map(WebSocketMessage::getPayloadAsText)
				.filter(this::isPing)
				.doOnNext(ping -> connection.send(toJson(PongMessage.at(clock.instant().toString()))))
				.doFinally(signalType -> {
					leave.run();
					connection.close();
				})
				.then();

		Mono<Void> outbound = session.send(connection.outboundMessages());

		return Mono.when(initialUpdate, inbound, outbound)
				.doFinally(signalType -> {
					leave.run();
					connection.close();
					logger.debug("Price stream {} for topic {} ended ({})", session.getId(), topic.id(), signalType);
				});
	}

	boolean isPing(String text) {
		String trimmed = text.trim();
		if ("ping".equalsIgnoreCase(trimmed)) {
			return true;
		}
		if (!trimmed.startsWith("{")) {
			return false;
		}
		try {
			JsonNode type = objectMapper.readTree(trimmed).get("type");
			return type != null && "ping".equals(type.asText());
		} catch (JsonProcessingException ex) {
			logger.debug("Ignoring unreadable client message: {}", ex.getOriginalMessage());
			return false;
		}
	}

	private String toJson(Object message) {
		try {
			return objectMapper.writeValueAsString(message);
		} catch (JsonProcessingException ex) {
			throw new IllegalStateException("Could not serialise " + message.getClass().getSimpleName(), ex);
		}
	}
}
