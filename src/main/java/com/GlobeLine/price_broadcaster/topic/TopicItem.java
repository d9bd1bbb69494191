package com.GlobeLine.price_broadcaster.topic;

import java.math.BigDecimal;

/**
 * One symbol on a watchlist with the optional holding the owner recorded for it.
 */
public record TopicItem(
		String symbol,
		String displayName,
		BigDecimal quantity,
		BigDecimal purchasePrice) {

	public static TopicItem of(String symbol, String displayName) {
		return new TopicItem(symbol, displayName, null, null);
	}
}
