package com.GlobeLine.price_broadcaster.topic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Component;

import com.GlobeLine.price_broadcaster.exception.CredentialRejectedException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import reactor.core.publisher.Mono;

/**
 * Looks session tokens up in Redis, where the login flow stores
 * {@code session:{token}} as JSON carrying at least {@code user_id}.
 */
@Component
public class RedisSessionCredentialVerifier implements CredentialVerifier {

	private static final Logger logger = LoggerFactory.getLogger(RedisSessionCredentialVerifier.class);

	static final String SESSION_KEY_PREFIX = "session:";

	private final ReactiveStringRedisTemplate redisTemplate;
	private final ObjectMapper objectMapper;

	public RedisSessionCredentialVerifier(ReactiveStringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
		this.redisTemplate = redisTemplate;
		this.objectMapper = objectMapper;
	}

	@Override
	public Mono<AuthenticatedUser> verify(String token) {
		if (token == null || token.isBlank()) {
			return Mono.error(new CredentialRejectedException("Missing authentication token"));
		}
		return redisTemplate.opsForValue()
				.get(SESSION_KEY_PREFIX + token)
				.switchIfEmpty(Mono.error(() -> new CredentialRejectedException("Invalid or expired session")))
				.map(this::toUser);
	}

	private AuthenticatedUser toUser(String sessionJson) {
		JsonNode userId;
		try {
			userId = objectMapper.readTree(sessionJson).get("user_id");
		} catch (JsonProcessingException ex) {
			logger.warn("Unreadable session payload: {}", ex.getOriginalMessage());
			throw new CredentialRejectedException("Invalid or expired session");
		}
		if (userId == null || !userId.canConvertToLong() || userId.asLong() == 0) {
			throw new CredentialRejectedException("Invalid session data");
		}
		return new AuthenticatedUser(userId.asLong());
	}
}
