package com.GlobeLine.price_broadcaster.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Binds broadcaster settings (broadcaster.*).
 */
@ConfigurationProperties(prefix = "broadcaster")
public record BroadcasterProperties(
		@DefaultValue("5s") Duration pollInterval,
		@DefaultValue("60s") Duration offHoursPollInterval,
		@DefaultValue("5s") Duration workerStopTimeout,
		@DefaultValue("256") int sendBufferSize,
		@DefaultValue TradingHours tradingHours) {

	/**
	 * Upstream trading session, local to {@code zone}, weekdays only.
	 * When disabled the regular poll interval always applies.
	 */
	public record TradingHours(
			@DefaultValue("false") boolean enabled,
			@DefaultValue("America/New_York") String zone,
			@DefaultValue("09:30") String open,
			@DefaultValue("16:00") String close) {
	}
}
