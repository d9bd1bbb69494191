package com.GlobeLine.price_broadcaster.dto;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One row of a price update: the live quote merged with the topic's holding overlay.
 * Missing values are serialised as JSON null so clients keep a stable shape.
 */
public record PriceUpdateItem(
		@JsonProperty("symbol") String symbol,
		@JsonProperty("name") String name,
		@JsonProperty("price") BigDecimal price,
		@JsonProperty("delta") BigDecimal delta,
		@JsonProperty("delta_percent") BigDecimal deltaPercent,
		@JsonProperty("quantity") BigDecimal quantity,
		@JsonProperty("purchase_price") BigDecimal purchasePrice,
		@JsonProperty("unrealized_pnl") BigDecimal unrealizedPnl) {
}
