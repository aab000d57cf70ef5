/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.model;

import org.opensearch.metrics.query.common.InvalidMetricsQueryException;
import org.opensearch.metrics.query.visitor.ExpressionVisitor;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Restricts the wrapped expression to rows matching all of its conditions.
 */
public final class Filter extends Expression {
    private final Expression inner;
    private final List<Condition> conditions;

    /**
     * Create a filter.
     * @param inner the filtered expression
     * @param conditions conditions that must all hold
     * @throws InvalidMetricsQueryException if no inner expression is given
     */
    public Filter(Expression inner, List<Condition> conditions) {
        if (inner == null) {
            throw new InvalidMetricsQueryException("filter requires an expression to filter");
        }
        this.inner = inner;
        this.conditions = List.copyOf(conditions);
    }

    /**
     * Convenience factory for a filter.
     * @param inner the filtered expression
     * @param conditions conditions that must all hold
     * @return the filter node
     */
    public static Filter of(Expression inner, Condition... conditions) {
        return new Filter(inner, Arrays.asList(conditions));
    }

    /**
     * Get the filtered expression.
     * @return the inner expression
     */
    public Expression getInner() {
        return inner;
    }

    /**
     * Get the conditions.
     * @return an unmodifiable list of conditions, in declaration order
     */
    public List<Condition> getConditions() {
        return conditions;
    }

    @Override
    public List<Expression> getChildren() {
        return List.of(inner);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String getExplainName() {
        return inner.getExplainName() + conditions.stream().map(Condition::getExplainName).collect(Collectors.joining(", ", "{", "}"));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Filter other && inner.equals(other.inner) && conditions.equals(other.conditions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Filter.class, inner, conditions);
    }
}
