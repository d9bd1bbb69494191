package com.GlobeLine.price_broadcaster.broadcast;

/**
 * Observer for registry lifecycle and delivery events.
 */
public interface BroadcastEventObserver {

	void onWorkerStarted(long topicId);
	void onWorkerStopped(long topicId);
	void onBroadcast(long topicId, int recipients);
	void onSendFailure(long topicId);
}
