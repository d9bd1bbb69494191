package com.GlobeLine.price_broadcaster.mapper;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Instant;

import org.junit.jupiter.api.Test;

import com.GlobeLine.price_broadcaster.dto.PriceQuote;
import com.GlobeLine.price_broadcaster.dto.finnhub.FinnhubQuoteDto;

class QuoteMapperTest {

	private static final Instant FETCHED_AT = Instant.parse("2025-01-06T15:00:00Z");

	private final QuoteMapper mapper = new QuoteMapper();

	@Test
	void toPriceQuote_ComputesDeltaFromPreviousClose() {
		FinnhubQuoteDto dto = new FinnhubQuoteDto(new BigDecimal("2500"), new BigDecimal("49.99"),
				new BigDecimal("2.04"), null, null, null, new BigDecimal("2450"), 1736175600L);

		PriceQuote quote = mapper.toPriceQuote("7203.T", dto, FETCHED_AT);

		assertThat(quote.available()).isTrue();
		assertThat(quote.delta()).isEqualByComparingTo("50.00");
		assertThat(quote.deltaPercent()).isEqualByComparingTo("2.04");
		assertThat(quote.timestamp()).isEqualTo(Instant.ofEpochSecond(1736175600L));
	}

	@Test
	void toPriceQuote_NoPreviousClose_FallsBackToProviderChange() {
		FinnhubQuoteDto dto = new FinnhubQuoteDto(new BigDecimal("10"), new BigDecimal("0.123"),
				new BigDecimal("1.456"), null, null, null, null, null);

		PriceQuote quote = mapper.toPriceQuote("AAA", dto, FETCHED_AT);

		assertThat(quote.delta()).isEqualByComparingTo("0.12");
		assertThat(quote.deltaPercent()).isEqualByComparingTo("1.46");
		assertThat(quote.timestamp()).isEqualTo(FETCHED_AT);
	}

	@Test
	void toPriceQuote_MissingOrZeroPrice_IsUnavailable() {
		FinnhubQuoteDto zeros = new FinnhubQuoteDto(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO,
				BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, 0L);

		assertThat(mapper.toPriceQuote("ZZZ", zeros, FETCHED_AT).available()).isFalse();
		assertThat(mapper.toPriceQuote("ZZZ", null, FETCHED_AT).available()).isFalse();
	}
}
