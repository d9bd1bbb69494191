package com.GlobeLine.price_broadcaster.api;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.GlobeLine.price_broadcaster.broadcast.ConnectionRegistry;
import com.GlobeLine.price_broadcaster.broadcast.TopicSummary;
import com.GlobeLine.price_broadcaster.exception.ServiceUnavailableException;
import com.GlobeLine.price_broadcaster.ratelimit.RateLimiterStats;
import com.GlobeLine.price_broadcaster.ratelimit.TokenBucketRateLimiter;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/broadcaster")
@Tag(name = "Broadcaster", description = "Price broadcaster diagnostics")
public class BroadcasterController {

	private static final Logger logger = LoggerFactory.getLogger(BroadcasterController.class);

	private final TokenBucketRateLimiter rateLimiter;
	private final ConnectionRegistry registry;

	public BroadcasterController(TokenBucketRateLimiter rateLimiter, ConnectionRegistry registry) {
		this.rateLimiter = rateLimiter;
		this.registry = registry;
	}

	@Operation(
			summary = "Get upstream rate limiter stats",
			description = "Reads the shared token bucket without consuming from it. Tokens are refilled up to " +
					"the moment of the read.")
	@ApiResponses(value = {
			@ApiResponse(
					responseCode = "200",
					description = "Current bucket state",
					content = @Content(schema = @Schema(implementation = RateLimiterStats.class))),
			@ApiResponse(
					responseCode = "503",
					description = "Token bucket store unreachable",
					content = @Content)
	})
	@GetMapping("/rate-limiter/stats")
	public Mono<ResponseEntity<RateLimiterStats>> getRateLimiterStats() {
		return rateLimiter.getStats()
				.onErrorMap(ex -> new ServiceUnavailableException("Rate limiter store unavailable", ex))
				.map(ResponseEntity::ok)
				.onErrorResume(ServiceUnavailableException.class, ex -> {
					logger.warn("{}: {}", ex.getMessage(), ex.getCause().getMessage());
					return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
							.body((RateLimiterStats) null));
				});
	}

	@Operation(
			summary = "List active topics",
			description = "Topics with at least one live subscriber, with their worker state and last cycle time.")
	@ApiResponse(
			responseCode = "200",
			description = "Active topics",
			content = @Content(array = @ArraySchema(schema = @Schema(implementation = TopicSummary.class))))
	@GetMapping("/topics")
	public Mono<List<TopicSummary>> getActiveTopics() {
		return Mono.fromCallable(registry::topicSummaries);
	}
}
