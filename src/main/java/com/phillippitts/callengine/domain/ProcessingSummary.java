package com.phillippitts.callengine.domain;

import java.time.Instant;

/**
 * Result of one {@code processEvents} batch.
 *
 * <p>{@code processed} and {@code failed} are disjoint. An event whose handlers threw is still
 * processed; the isolated handler exceptions are counted in {@code handlerFailures}. Events
 * without a resolvable call connection id are {@code dropped} and appear in neither count.
 *
 * @param processed events dispatched (including those with zero registered handlers)
 * @param failed events whose dispatch failed outside handler isolation
 * @param handlerFailures handler invocations that threw
 * @param dropped events without a resolvable call connection id
 * @param timestamp when the batch finished
 */
public record ProcessingSummary(
        int processed,
        int failed,
        int handlerFailures,
        int dropped,
        Instant timestamp
) {
    public enum Status { SUCCESS, PARTIAL_FAILURE }

    public Status status() {
        return failed == 0 && handlerFailures == 0 ? Status.SUCCESS : Status.PARTIAL_FAILURE;
    }
}
