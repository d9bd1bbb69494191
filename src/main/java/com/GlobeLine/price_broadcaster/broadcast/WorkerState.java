package com.GlobeLine.price_broadcaster.broadcast;

public enum WorkerState {
	STARTING,
	RUNNING,
	CANCELLING,
	STOPPED
}
