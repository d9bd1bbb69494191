package com.GlobeLine.price_broadcaster.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reply to a client keep-alive ping.
 */
public record PongMessage(
		@JsonProperty("type") String type,
		@JsonProperty("timestamp") String timestamp) {

	public static PongMessage at(String timestamp) {
		return new PongMessage("pong", timestamp);
	}
}
