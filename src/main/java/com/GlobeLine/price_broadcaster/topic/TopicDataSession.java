package com.GlobeLine.price_broadcaster.topic;

import java.util.Optional;

import com.GlobeLine.price_broadcaster.exception.TopicAccessDeniedException;

/**
 * Short-lived unit of work against topic persistence. Implementations may block.
 */
public interface TopicDataSession extends AutoCloseable {

	Optional<WatchlistTopic> findTopic(long topicId);

	/**
	 * Finds the topic and checks the user may stream it.
	 *
	 * @throws TopicAccessDeniedException if the topic does not exist or is neither public nor owned by the user
	 */
	default WatchlistTopic resolveTopic(long topicId, AuthenticatedUser user) {
		return findTopic(topicId)
				.filter(topic -> topic.isAccessibleBy(user))
				.orElseThrow(() -> new TopicAccessDeniedException(topicId, user.userId()));
	}

	@Override
	void close();
}
