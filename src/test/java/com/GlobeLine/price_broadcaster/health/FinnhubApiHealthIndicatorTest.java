package com.GlobeLine.price_broadcaster.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import com.GlobeLine.price_broadcaster.config.FinnhubApiProperties;
import com.GlobeLine.price_broadcaster.connectors.FinnhubClient;
import com.GlobeLine.price_broadcaster.dto.finnhub.FinnhubQuoteDto;
import com.GlobeLine.price_broadcaster.ratelimit.AcquireResult;
import com.GlobeLine.price_broadcaster.ratelimit.TokenBucketRateLimiter;

import reactor.core.publisher.Mono;

class FinnhubApiHealthIndicatorTest {

	private static final Instant START = Instant.parse("2025-01-06T15:00:00Z");

	@Mock
	private FinnhubClient finnhubClient;

	@Mock
	private TokenBucketRateLimiter rateLimiter;

	private MutableClock clock;
	private FinnhubApiHealthIndicator indicator;

	@BeforeEach
	void setUp() {
		MockitoAnnotations.openMocks(this);
		clock = new MutableClock(START);
		indicator = new FinnhubApiHealthIndicator(finnhubClient, rateLimiter,
				new FinnhubApiProperties("http://localhost", "key", Duration.ofSeconds(4), 5), clock);
		when(finnhubClient.getQuote(anyString())).thenReturn(Mono.just(new FinnhubQuoteDto(
				new BigDecimal("150.00"), null, null, null, null, null, new BigDecimal("149.00"), 1736175600L)));
	}

	@Test
	void health_RepeatedPollsWithinInterval_TakeOneToken() {
		// Arrange
		when(rateLimiter.acquire(eq(1), any(Duration.class))).thenReturn(Mono.just(AcquireResult.GRANTED));

		// Act
		Health first = indicator.health();
		clock.advance(Duration.ofSeconds(30));
		Health second = indicator.health();

		// Assert
		assertThat(first.getStatus()).isEqualTo(Status.UP);
		assertThat(second).isSameAs(first);
		verify(rateLimiter, times(1)).acquire(eq(1), any(Duration.class));
		verify(finnhubClient, times(1)).getQuote(anyString());
	}

	@Test
	void health_AfterInterval_ChecksAgain() {
		when(rateLimiter.acquire(eq(1), any(Duration.class))).thenReturn(Mono.just(AcquireResult.GRANTED));

		indicator.health();
		clock.advance(FinnhubApiHealthIndicator.CHECK_INTERVAL);
		indicator.health();

		verify(rateLimiter, times(2)).acquire(eq(1), any(Duration.class));
	}

	@Test
	void health_NoTokenAvailable_IsUnknownWithoutUpstreamCall() {
		when(rateLimiter.acquire(eq(1), any(Duration.class))).thenReturn(Mono.just(AcquireResult.TIMED_OUT));

		Health health = indicator.health();

		assertThat(health.getStatus()).isEqualTo(Status.UNKNOWN);
		verify(finnhubClient, never()).getQuote(anyString());
	}

	private static final class MutableClock extends Clock {

		private Instant now;

		MutableClock(Instant start) {
			this.now = start;
		}

		void advance(Duration duration) {
			now = now.plus(duration);
		}

		@Override
		public ZoneId getZone() {
			return ZoneOffset.UTC;
		}

		@Override
		public Clock withZone(ZoneId zone) {
			return this;
		}

		@Override
		public Instant instant() {
			return now;
		}
	}
}
