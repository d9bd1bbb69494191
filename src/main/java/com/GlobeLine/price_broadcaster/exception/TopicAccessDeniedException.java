package com.GlobeLine.price_broadcaster.exception;

/**
 * Thrown when a watchlist does not exist or the user may not stream it.
 * Both cases look the same to the client.
 */
public class TopicAccessDeniedException extends RuntimeException {

	private final long topicId;

	public TopicAccessDeniedException(long topicId, long userId) {
		super("Watchlist " + topicId + " not found or not accessible by user " + userId);
		this.topicId = topicId;
	}

	public long getTopicId() {
		return topicId;
	}
}
