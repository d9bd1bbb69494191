package com.GlobeLine.price_broadcaster.topic;

import java.util.List;

/**
 * A watchlist as seen by the broadcaster: who owns it, whether others may stream it,
 * and the ordered symbols it tracks.
 */
public record WatchlistTopic(
		long id,
		long ownerId,
		boolean isPublic,
		List<TopicItem> items) {

	public WatchlistTopic {
		items = List.copyOf(items);
	}

	public boolean isAccessibleBy(AuthenticatedUser user) {
		return isPublic || ownerId == user.userId();
	}

	public List<String> symbols() {
		return items.stream()
				.map(TopicItem::symbol)
				.distinct()
				.toList();
	}
}
