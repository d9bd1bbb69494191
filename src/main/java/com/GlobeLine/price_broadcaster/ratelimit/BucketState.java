package com.GlobeLine.price_broadcaster.ratelimit;

/**
 * Outcome of one atomic refill-and-consume against the shared store.
 *
 * @param granted whether the requested cost was deducted
 * @param tokens  tokens left in the bucket after the operation
 */
public record BucketState(boolean granted, double tokens) {
}
