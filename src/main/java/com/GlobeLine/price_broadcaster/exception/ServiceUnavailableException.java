package com.GlobeLine.price_broadcaster.exception;

/**
 * Thrown when a backing service needed to answer is temporarily unavailable
 * (e.g., the rate limiter store or the session store is down).
 */
public class ServiceUnavailableException extends RuntimeException {
	public ServiceUnavailableException(String message, Throwable cause) {
		super(message, cause);
	}
}
