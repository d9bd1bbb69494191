package com.GlobeLine.price_broadcaster.topic;

import reactor.core.publisher.Mono;

/**
 * Resolves a session token to the user behind it.
 * Errors with {@link com.GlobeLine.price_broadcaster.exception.CredentialRejectedException} when the token
 * is not accepted; any other error means the verifier itself could not answer.
 */
public interface CredentialVerifier {

	Mono<AuthenticatedUser> verify(String token);
}
