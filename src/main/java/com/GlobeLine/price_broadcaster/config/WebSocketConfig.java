package com.GlobeLine.price_broadcaster.config;

import java.util.Map;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;

import com.GlobeLine.price_broadcaster.gateway.ConnectionGateway;

/**
 * Maps the price stream endpoint to {@link ConnectionGateway}. Ordered ahead of the
 * annotated controllers so the upgrade request never reaches them.
 */
@Configuration
@EnableConfigurationProperties(BroadcasterProperties.class)
public class WebSocketConfig {

	private static final String PRICE_STREAM_PATTERN = "/api/v1/ws/watchlist/*/prices";

	@Bean
	public HandlerMapping priceStreamHandlerMapping(ConnectionGateway connectionGateway) {
		return new SimpleUrlHandlerMapping(Map.of(PRICE_STREAM_PATTERN, connectionGateway), -1);
	}
}
