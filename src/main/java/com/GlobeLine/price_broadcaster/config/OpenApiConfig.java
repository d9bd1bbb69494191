package com.GlobeLine.price_broadcaster.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;

@Configuration
public class OpenApiConfig {

	@Bean
	public OpenAPI priceBroadcasterOpenAPI() {
		return new OpenAPI()
				.info(new Info()
						.title("Price Broadcaster API")
						.description("Diagnostics for the watchlist price broadcaster. Live prices are streamed over " +
								"the WebSocket endpoint /api/v1/ws/watchlist/{topicId}/prices?token=...; these REST " +
								"endpoints expose the shared upstream rate limiter and the active topic workers.")
						.version("1.0.0")
						.contact(new Contact()
								.name("GlobeLine Terminal")
								.email("support@globeline.local"))
						.license(new License()
								.name("Proprietary")
								.url("https://globeline.local")));
	}
}
