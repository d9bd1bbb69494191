package com.GlobeLine.price_broadcaster.broadcast;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TopicSummary(
		@JsonProperty("topic_id") long topicId,
		@JsonProperty("subscribers") int subscribers,
		@JsonProperty("worker_state") WorkerState workerState,
		@JsonProperty("last_run_at") Instant lastRunAt) {
}
