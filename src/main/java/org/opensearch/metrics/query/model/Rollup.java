/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.model;

/**
 * Requested bucketing of a query.
 *
 * @param interval the bucket width in seconds, or null to let the timeframe layer infer one
 * @param totals whether a single total per series is also requested
 */
public record Rollup(Long interval, boolean totals) {

    private static final Rollup AUTO = new Rollup(null, false);

    /**
     * Rollup with an inferred interval and no totals.
     * @return the default rollup
     */
    public static Rollup auto() {
        return AUTO;
    }

    /**
     * Rollup with a fixed interval.
     * @param interval bucket width in seconds
     * @return the rollup
     */
    public static Rollup of(long interval) {
        return new Rollup(interval, false);
    }

    /**
     * Whether the interval still has to be inferred.
     * @return true if no interval was requested
     */
    public boolean isAuto() {
        return interval == null;
    }

    /**
     * Copy with a resolved interval.
     * @param newInterval bucket width in seconds
     * @return the new rollup
     */
    public Rollup withInterval(long newInterval) {
        return new Rollup(newInterval, totals);
    }

    /**
     * Copy with the totals flag changed.
     * @param withTotals whether totals are requested
     * @return the new rollup
     */
    public Rollup withTotals(boolean withTotals) {
        return new Rollup(interval, withTotals);
    }

    @Override
    public String toString() {
        return (interval == null ? "auto" : interval + "s") + (totals ? " +totals" : "");
    }
}
