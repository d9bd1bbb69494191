package com.GlobeLine.price_broadcaster.mapper;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

import org.springframework.stereotype.Component;

import com.GlobeLine.price_broadcaster.dto.PriceQuote;
import com.GlobeLine.price_broadcaster.dto.finnhub.FinnhubQuoteDto;

/**
 * Maps Finnhub quote payloads to {@link PriceQuote}.
 * Delta and delta percent are recomputed from the previous close and rounded to 2 places.
 */
@Component
public class QuoteMapper {

	private static final int SCALE = 2;
	private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

	public PriceQuote toPriceQuote(String symbol, FinnhubQuoteDto quote, Instant fetchedAt) {
		if (quote == null || quote.currentPrice() == null || quote.currentPrice().signum() == 0) {
			return PriceQuote.unavailable(symbol, fetchedAt);
		}

		BigDecimal price = quote.currentPrice();
		BigDecimal previousClose = quote.previousClose();
		BigDecimal delta = null;
		BigDecimal deltaPercent = null;

		if (previousClose != null && previousClose.signum() != 0) {
			BigDecimal change = price.subtract(previousClose);
			delta = change.setScale(SCALE, RoundingMode.HALF_UP);
			deltaPercent = change.multiply(HUNDRED).divide(previousClose, SCALE, RoundingMode.HALF_UP);
		} else {
			delta = round(quote.change());
			deltaPercent = round(quote.percentChange());
		}

		Instant quotedAt = quote.timestamp() != null && quote.timestamp() > 0
				? Instant.ofEpochSecond(quote.timestamp())
				: fetchedAt;

		return new PriceQuote(symbol, price, delta, deltaPercent, quotedAt, true);
	}

	private BigDecimal round(BigDecimal value) {
		return value != null ? value.setScale(SCALE, RoundingMode.HALF_UP) : null;
	}
}
