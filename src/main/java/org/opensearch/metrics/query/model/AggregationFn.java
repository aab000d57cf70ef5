/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.model;

import java.util.Locale;

/**
 * Aggregations that reduce a raw metric to a vector of per-bucket values.
 */
public enum AggregationFn implements FunctionName {
    /**
     * Sum of all values.
     */
    SUM("sum"),

    /**
     * Number of values.
     */
    COUNT("count"),

    /**
     * Arithmetic mean of the values.
     */
    AVG("avg"),

    /**
     * Largest value.
     */
    MAX("max"),

    /**
     * Smallest value.
     */
    MIN("min"),

    /**
     * 50th percentile.
     */
    P50("p50"),

    /**
     * 75th percentile.
     */
    P75("p75"),

    /**
     * 95th percentile.
     */
    P95("p95"),

    /**
     * 99th percentile.
     */
    P99("p99"),

    /**
     * Number of distinct values.
     */
    COUNT_UNIQUE("count_unique");

    private final String name;

    AggregationFn(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }

    /**
     * Converts a string representation of an aggregation to the corresponding enum value.
     * @param name The string representation of the aggregation.
     * @return The corresponding AggregationFn enum value.
     * @throws IllegalArgumentException if the input string does not match any known aggregation.
     */
    public static AggregationFn fromString(String name) {
        String normalized = name.toLowerCase(Locale.ROOT);
        for (AggregationFn fn : values()) {
            if (fn.name.equals(normalized)) {
                return fn;
            }
        }
        throw new IllegalArgumentException("Invalid aggregation function: " + name);
    }
}
