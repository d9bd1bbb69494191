package com.GlobeLine.price_broadcaster.exception;

/**
 * Thrown when a session token is missing, unknown, expired or malformed.
 * The message is safe to hand back to the client as a close reason.
 */
public class CredentialRejectedException extends RuntimeException {
	public CredentialRejectedException(String reason) {
		super(reason);
	}
}
