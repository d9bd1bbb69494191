package com.GlobeLine.price_broadcaster.topic;

/**
 * Entry point to topic persistence. Each call hands out a fresh, short-lived session
 * that the caller must close once it is done resolving.
 */
public interface TopicDataAccess {

	TopicDataSession openSession();
}
