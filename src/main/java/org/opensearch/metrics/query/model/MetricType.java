/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Storage kind of a metric, encoded as the first character of its MRI. The storage kind decides which
 * aggregations can be applied to the raw metric and which physical entity holds its rows.
 */
public enum MetricType {
    /**
     * Monotonic counter, stored as per-bucket sums.
     */
    COUNTER('c', EnumSet.of(AggregationFn.SUM)),

    /**
     * Distribution of individual values.
     */
    DISTRIBUTION(
        'd',
        EnumSet.of(
            AggregationFn.COUNT,
            AggregationFn.AVG,
            AggregationFn.MAX,
            AggregationFn.MIN,
            AggregationFn.P50,
            AggregationFn.P75,
            AggregationFn.P95,
            AggregationFn.P99
        )
    ),

    /**
     * Set of distinct values.
     */
    SET('s', EnumSet.of(AggregationFn.COUNT_UNIQUE)),

    /**
     * Derived metric, defined by an expression over other metrics and never stored.
     */
    DERIVED('e', EnumSet.noneOf(AggregationFn.class));

    private final char code;
    private final Set<AggregationFn> allowedAggregations;

    MetricType(char code, Set<AggregationFn> allowedAggregations) {
        this.code = code;
        this.allowedAggregations = Set.copyOf(allowedAggregations);
    }

    /**
     * Get the MRI type character.
     * @return the code, e.g. 'd'
     */
    public char getCode() {
        return code;
    }

    /**
     * Get the aggregations that can be applied to a raw metric of this type.
     * @return the allowed aggregations
     */
    public Set<AggregationFn> getAllowedAggregations() {
        return allowedAggregations;
    }

    /**
     * Whether metrics of this type are backed by a physical entity.
     * @return false for derived metrics
     */
    public boolean isStored() {
        return this != DERIVED;
    }

    /**
     * Look up a metric type by its MRI type character.
     * @param code the type character
     * @return the metric type, or null if the character is unknown
     */
    public static MetricType fromCode(char code) {
        for (MetricType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        return null;
    }
}
