package com.GlobeLine.price_broadcaster.health;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.GlobeLine.price_broadcaster.config.FinnhubApiProperties;
import com.GlobeLine.price_broadcaster.connectors.FinnhubClient;
import com.GlobeLine.price_broadcaster.ratelimit.AcquireResult;
import com.GlobeLine.price_broadcaster.ratelimit.TokenBucketRateLimiter;

/**
 * Health indicator that checks the upstream quote provider is reachable.
 *
 * The check is an ordinary quote call, so it takes a token from the shared rate limiter
 * like every other upstream call. When no token is available quickly the status is
 * UNKNOWN rather than DOWN. The result is reused for {@link #CHECK_INTERVAL}, so health
 * polling costs at most one token per interval.
 */
@Component
public class FinnhubApiHealthIndicator implements HealthIndicator {

	private static final Logger logger = LoggerFactory.getLogger(FinnhubApiHealthIndicator.class);

	private static final String HEALTH_CHECK_SYMBOL = "AAPL";
	private static final Duration TOKEN_TIMEOUT = Duration.ofSeconds(1);
	private static final Duration HEALTH_CHECK_TIMEOUT = Duration.ofSeconds(5);
	static final Duration CHECK_INTERVAL = Duration.ofSeconds(60);

	private final FinnhubClient finnhubClient;
	private final TokenBucketRateLimiter rateLimiter;
	private final FinnhubApiProperties apiProperties;
	private final Clock clock;
	private volatile Health lastHealth;
	private volatile Instant lastCheckAt;

	public FinnhubApiHealthIndicator(FinnhubClient finnhubClient, TokenBucketRateLimiter rateLimiter,
			FinnhubApiProperties apiProperties, Clock clock) {
		this.finnhubClient = finnhubClient;
		this.rateLimiter = rateLimiter;
		this.apiProperties = apiProperties;
		this.clock = clock;
	}

	@Override
	public synchronized Health health() {
		Instant now = clock.instant();
		if (lastHealth != null && now.isBefore(lastCheckAt.plus(CHECK_INTERVAL))) {
			return lastHealth;
		}
		lastHealth = check();
		lastCheckAt = now;
		return lastHealth;
	}

	private Health check() {
		try {
			AcquireResult token = rateLimiter.acquire(1, TOKEN_TIMEOUT).block();
			if (token == null || !token.isGranted()) {
				return Health.unknown()
						.withDetail("api", "Finnhub API")
						.withDetail("baseUrl", apiProperties.baseUrl())
						.withDetail("reason", "No rate limiter token available for the check")
						.build();
			}

			finnhubClient.getQuote(HEALTH_CHECK_SYMBOL)
					.timeout(HEALTH_CHECK_TIMEOUT)
					.doOnSuccess(quote -> logger.debug("Finnhub API health check passed for symbol: {}", HEALTH_CHECK_SYMBOL))
					.block();

			return Health.up()
					.withDetail("api", "Finnhub API")
					.withDetail("baseUrl", apiProperties.baseUrl())
					.withDetail("status", "reachable")
					.build();

		} catch (WebClientResponseException ex) {
			int statusCode = ex.getStatusCode().value();
			String errorMessage;
			if (statusCode == 401 || statusCode == 403) {
				logger.error("Finnhub API health check failed: Unauthorized ({}) - check finnhub.api.key", statusCode);
				errorMessage = "Unauthorized - invalid API key";
			} else if (statusCode >= 500) {
				logger.warn("Finnhub API health check failed: Server error ({})", statusCode);
				errorMessage = "Server error - service unavailable";
			} else {
				logger.warn("Finnhub API health check failed: HTTP error ({})", statusCode);
				errorMessage = "HTTP error " + statusCode;
			}

			return Health.down()
					.withDetail("api", "Finnhub API")
					.withDetail("baseUrl", apiProperties.baseUrl())
					.withDetail("error", errorMessage)
					.withDetail("statusCode", statusCode)
					.build();

		} catch (Exception ex) {
			logger.warn("Finnhub API health check failed: {}", ex.getMessage());
			return Health.down()
					.withDetail("api", "Finnhub API")
					.withDetail("baseUrl", apiProperties.baseUrl())
					.withDetail("error", ex.getMessage() != null ? ex.getMessage() : "Unknown error")
					.withDetail("errorType", ex.getClass().getSimpleName())
					.build();
		}
	}
}
