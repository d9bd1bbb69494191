package com.GlobeLine.price_broadcaster.service;

import java.util.List;
import java.util.Map;

import com.GlobeLine.price_broadcaster.dto.PriceQuote;

import reactor.core.publisher.Mono;

/**
 * Source of current prices. Implementations answer every requested symbol, using
 * {@link PriceQuote#unavailable} for symbols they could not price.
 */
public interface PriceProvider {

	Mono<Map<String, PriceQuote>> fetch(List<String> symbols);
}
