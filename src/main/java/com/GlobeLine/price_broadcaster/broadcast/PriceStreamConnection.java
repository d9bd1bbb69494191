package com.GlobeLine.price_broadcaster.broadcast;

/**
 * One subscriber's outbound channel. {@link #send} must not block; it returns false
 * when the payload could not be queued, after which the connection is dropped.
 */
public interface PriceStreamConnection {

	String id();

	long userId();

	boolean send(String payload);

	boolean isOpen();

	void close();
}
