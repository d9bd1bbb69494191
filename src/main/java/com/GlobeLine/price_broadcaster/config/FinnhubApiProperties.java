package com.GlobeLine.price_broadcaster.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Binds Finnhub settings from application.properties (finnhub.api.*).
 * The quote cache TTL should stay below the poll interval so each cycle sees a fresh price.
 */
@ConfigurationProperties(prefix = "finnhub.api")
public record FinnhubApiProperties(
		String baseUrl,
		String key,
		@DefaultValue("4s") Duration quoteCacheTtl,
		@DefaultValue("5") int maxConcurrency) {
}
