package com.GlobeLine.price_broadcaster.broadcast;

import java.time.Clock;

import org.springframework.stereotype.Component;

import com.GlobeLine.price_broadcaster.service.PriceUpdateService;

@Component
public class TopicWorkerFactory {

	private final PriceUpdateService updateService;
	private final PollingSchedule schedule;
	private final Clock clock;

	public TopicWorkerFactory(PriceUpdateService updateService, PollingSchedule schedule, Clock clock) {
		this.updateService = updateService;
		this.schedule = schedule;
		this.clock = clock;
	}

	TopicWorker create(long topicId, ConnectionRegistry registry) {
		return new TopicWorker(topicId, updateService, schedule, registry, clock);
	}
}
