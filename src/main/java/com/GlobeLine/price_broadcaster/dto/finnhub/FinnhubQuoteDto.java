package com.GlobeLine.price_broadcaster.dto.finnhub;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Finnhub /quote payload. Unknown symbols come back with every field set to 0.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FinnhubQuoteDto(
		@JsonProperty("c") BigDecimal currentPrice,
		@JsonProperty("d") BigDecimal change,
		@JsonProperty("dp") BigDecimal percentChange,
		@JsonProperty("h") BigDecimal high,
		@JsonProperty("l") BigDecimal low,
		@JsonProperty("o") BigDecimal open,
		@JsonProperty("pc") BigDecimal previousClose,
		@JsonProperty("t") Long timestamp) {
}
