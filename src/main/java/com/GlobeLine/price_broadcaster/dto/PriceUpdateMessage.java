package com.GlobeLine.price_broadcaster.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PriceUpdateMessage(
		@JsonProperty("type") String type,
		@JsonProperty("topic_id") long topicId,
		@JsonProperty("items") List<PriceUpdateItem> items,
		@JsonProperty("timestamp") String timestamp) {

	public static final String TYPE = "price_update";

	public static PriceUpdateMessage of(long topicId, List<PriceUpdateItem> items, String timestamp) {
		return new PriceUpdateMessage(TYPE, topicId, List.copyOf(items), timestamp);
	}
}
