package com.GlobeLine.price_broadcaster.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import com.GlobeLine.price_broadcaster.dto.PriceQuote;

/**
 * In-memory quote cache (Caffeine). Topics sharing a symbol within one TTL window
 * cost a single upstream call.
 */
@Configuration
public class CacheConfig {

	@Bean
	public Cache<String, PriceQuote> quoteCache(FinnhubApiProperties properties) {
		return Caffeine.newBuilder()
				.maximumSize(5000)
				.expireAfterWrite(properties.quoteCacheTtl())
				.recordStats()
				.build();
	}
}
