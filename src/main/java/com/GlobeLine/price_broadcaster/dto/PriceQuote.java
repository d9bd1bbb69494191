package com.GlobeLine.price_broadcaster.dto;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Latest known price for one symbol. {@code available == false} marks a symbol the
 * provider could not price this cycle; all numeric fields are null then.
 */
public record PriceQuote(
		String symbol,
		BigDecimal price,
		BigDecimal delta,
		BigDecimal deltaPercent,
		Instant timestamp,
		boolean available) {

	public static PriceQuote unavailable(String symbol, Instant timestamp) {
		return new PriceQuote(symbol, null, null, null, timestamp, false);
	}
}
