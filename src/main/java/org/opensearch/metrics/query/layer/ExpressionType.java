/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.layer;

import org.opensearch.metrics.query.model.AggregationFn;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Type of an expression as seen by {@link ValidationLayer}.
 * <ul>
 *     <li>{@link Kind#METRIC}: a raw metric, carrying the aggregations it accepts</li>
 *     <li>{@link Kind#VECTOR}: a time series, the result of an aggregation or of arithmetic on series</li>
 *     <li>{@link Kind#SCALAR}: a single value, such as a literal or a condition operand</li>
 * </ul>
 */
public final class ExpressionType {

    /**
     * Kind of expression.
     */
    public enum Kind {
        METRIC,
        VECTOR,
        SCALAR
    }

    public static final ExpressionType VECTOR = new ExpressionType(Kind.VECTOR, Set.of());
    public static final ExpressionType SCALAR = new ExpressionType(Kind.SCALAR, Set.of());

    private final Kind kind;
    private final Set<AggregationFn> allowedAggregations;

    private ExpressionType(Kind kind, Set<AggregationFn> allowedAggregations) {
        this.kind = kind;
        this.allowedAggregations = allowedAggregations;
    }

    /**
     * Type of a raw metric.
     * @param allowedAggregations aggregations that may be applied to it
     * @return the metric type
     */
    public static ExpressionType metric(Set<AggregationFn> allowedAggregations) {
        return new ExpressionType(Kind.METRIC, Set.copyOf(allowedAggregations));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isMetric() {
        return kind == Kind.METRIC;
    }

    public boolean isVector() {
        return kind == Kind.VECTOR;
    }

    /**
     * Whether an aggregation may be applied to an expression of this type.
     * @param aggregation the aggregation
     * @return true only for metrics accepting the aggregation
     */
    public boolean allows(AggregationFn aggregation) {
        return allowedAggregations.contains(aggregation);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ExpressionType other && kind == other.kind && allowedAggregations.equals(other.allowedAggregations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, allowedAggregations);
    }

    @Override
    public String toString() {
        return kind == Kind.METRIC ? "metric" + allowedAggregations : kind.name().toLowerCase(Locale.ROOT);
    }
}
