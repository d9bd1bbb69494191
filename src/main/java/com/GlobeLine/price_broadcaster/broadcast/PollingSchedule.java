package com.GlobeLine.price_broadcaster.broadcast;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import org.springframework.stereotype.Component;

import com.GlobeLine.price_broadcaster.config.BroadcasterProperties;
import com.GlobeLine.price_broadcaster.config.BroadcasterProperties.TradingHours;

/**
 * Decides how long a worker sleeps between cycles: the regular poll interval while the
 * market is open, the off-hours interval otherwise.
 */
@Component
public class PollingSchedule {

	private final Duration pollInterval;
	private final Duration offHoursPollInterval;
	private final boolean tradingHoursEnabled;
	private final ZoneId zone;
	private final LocalTime open;
	private final LocalTime close;

	public PollingSchedule(BroadcasterProperties properties) {
		this.pollInterval = properties.pollInterval();
		this.offHoursPollInterval = properties.offHoursPollInterval();
		TradingHours hours = properties.tradingHours();
		this.tradingHoursEnabled = hours.enabled();
		this.zone = ZoneId.of(hours.zone());
		this.open = LocalTime.parse(hours.open());
		this.close = LocalTime.parse(hours.close());
		if (pollInterval.isNegative() || pollInterval.isZero()) {
			throw new IllegalArgumentException("broadcaster.poll-interval must be positive");
		}
	}

	public Duration intervalAt(Instant now) {
		return isMarketOpen(now) ? pollInterval : offHoursPollInterval;
	}

	public boolean isMarketOpen(Instant now) {
		if (!tradingHoursEnabled) {
			return true;
		}
		ZonedDateTime local = now.atZone(zone);
		DayOfWeek day = local.getDayOfWeek();
		if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
			return false;
		}
		LocalTime time = local.toLocalTime();
		return !time.isBefore(open) && time.isBefore(close);
	}
}
