package com.GlobeLine.price_broadcaster.topic;

/**
 * Principal behind a stream connection, as resolved from its session token.
 */
public record AuthenticatedUser(long userId) {
}
