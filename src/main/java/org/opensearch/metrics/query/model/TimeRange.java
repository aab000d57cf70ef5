/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Half-open time interval, start inclusive and end exclusive. Ordering of the bounds is not enforced here, the
 * validation layer rejects queries whose start is not before their end.
 *
 * @param start inclusive start
 * @param end exclusive end
 */
public record TimeRange(Instant start, Instant end) {

    /**
     * Validates that both bounds are present.
     */
    public TimeRange {
        Objects.requireNonNull(start, "start cannot be null");
        Objects.requireNonNull(end, "end cannot be null");
    }

    /**
     * Create a range from epoch seconds.
     * @param startSeconds inclusive start in seconds since the epoch
     * @param endSeconds exclusive end in seconds since the epoch
     * @return the range
     */
    public static TimeRange ofEpochSeconds(long startSeconds, long endSeconds) {
        return new TimeRange(Instant.ofEpochSecond(startSeconds), Instant.ofEpochSecond(endSeconds));
    }

    /**
     * Get the start in seconds since the epoch, rounded down to a whole second.
     * @return the start seconds
     */
    public long startSeconds() {
        return start.getEpochSecond();
    }

    /**
     * Get the end in seconds since the epoch, rounded up to a whole second so that the exclusive
     * bound still covers a fractional end.
     * @return the end seconds
     */
    public long endSeconds() {
        return end.getNano() == 0 ? end.getEpochSecond() : end.getEpochSecond() + 1;
    }

    /**
     * Whether the range contains no instant, that is start is not before end.
     * @return true for empty or inverted ranges
     */
    public boolean isEmpty() {
        return start.isBefore(end) == false;
    }

    /**
     * Get the length of the window.
     * @return the window length in seconds, negative for inverted ranges
     */
    public long durationSeconds() {
        return endSeconds() - startSeconds();
    }
}
