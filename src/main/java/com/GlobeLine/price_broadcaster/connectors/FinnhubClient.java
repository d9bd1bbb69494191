package com.GlobeLine.price_broadcaster.connectors;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.GlobeLine.price_broadcaster.dto.finnhub.FinnhubQuoteDto;

import reactor.core.publisher.Mono;

@Component
public class FinnhubClient {

	private final WebClient finnhubWebClient;

	public FinnhubClient(@Qualifier("finnhubWebClient") WebClient finnhubWebClient) {
		this.finnhubWebClient = finnhubWebClient;
	}

	/**
	 * Fetches the real-time quote for a given symbol.
	 * Callers are expected to hold a rate limiter token for the call.
	 *
	 * @param symbol Stock symbol (e.g., "AAPL")
	 * @return Mono containing quote data (current price, change, previous close, etc.)
	 */
	public Mono<FinnhubQuoteDto> getQuote(String symbol) {
		return finnhubWebClient.get()
				.uri(uriBuilder -> uriBuilder
						.path("/quote")
						.queryParam("symbol", symbol)
						.build())
				.retrieve()
				.bodyToMono(FinnhubQuoteDto.class)
				.onErrorMap(WebClientResponseException.NotFound.class,
						ex -> new SymbolNotFoundException("Symbol not found: " + symbol, ex));
	}

	/**
	 * Thrown when the provider answers 404 for a symbol.
	 */
	public static class SymbolNotFoundException extends RuntimeException {
		public SymbolNotFoundException(String message, Throwable cause) {
			super(message, cause);
		}
	}
}
