package com.GlobeLine.price_broadcaster.ratelimit;

public enum AcquireResult {
	GRANTED,
	TIMED_OUT;

	public boolean isGranted() {
		return this == GRANTED;
	}
}
