package com.GlobeLine.price_broadcaster.config;

import java.time.Duration;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;

import io.netty.channel.ChannelOption;
import reactor.netty.http.client.HttpClient;

@Configuration
@EnableConfigurationProperties(FinnhubApiProperties.class)
public class WebClientConfig {

	private static final Logger logger = LoggerFactory.getLogger(WebClientConfig.class);

	@Bean
	public WebClient finnhubWebClient(FinnhubApiProperties properties) {
		HttpClient httpClient = HttpClient.create()
				.responseTimeout(Duration.ofSeconds(5))
				.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 3000);

		return WebClient.builder()
				.baseUrl(properties.baseUrl())
				.defaultHeader("X-Finnhub-Token", properties.key() != null ? properties.key() : "")
				.clientConnector(new ReactorClientHttpConnector(httpClient))
				.filter(logQuoteRequestWithLatency())
				.build();
	}

	private ExchangeFilterFunction logQuoteRequestWithLatency() {
		return (clientRequest, next) -> {
			Instant startTime = Instant.now();
			String method = clientRequest.method().name();
			String path = clientRequest.url().getPath();

			if (logger.isDebugEnabled()) {
				logger.debug("Upstream request: {} {}", method, clientRequest.url());
			}

			return next.exchange(clientRequest)
					.doOnSuccess(response -> {
						long tookMs = Duration.between(startTime, Instant.now()).toMillis();
						if (response.statusCode().isError()) {
							logger.warn("Upstream returned {} for {} {} (took {}ms)",
									response.statusCode().value(), method, path, tookMs);
						} else if (logger.isDebugEnabled()) {
							logger.debug("Upstream answered {} in {}ms", response.statusCode().value(), tookMs);
						}
					})
					.doOnError(error -> logger.warn("Upstream request {} {} failed after {}ms: {}",
							method, path, Duration.between(startTime, Instant.now()).toMillis(), error.getMessage()));
		};
	}
}
