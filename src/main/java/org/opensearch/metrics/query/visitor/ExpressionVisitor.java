/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.visitor;

import org.opensearch.metrics.query.model.Expression;
import org.opensearch.metrics.query.model.Filter;
import org.opensearch.metrics.query.model.Function;
import org.opensearch.metrics.query.model.Literal;
import org.opensearch.metrics.query.model.MetricName;
import org.opensearch.metrics.query.model.Tag;
import org.opensearch.metrics.query.model.Variable;

/**
 * Visitor for query expressions. Every expression node dispatches to exactly one {@code visit} method; the
 * default implementation of each delegates to {@link #process(Expression)}.
 * @param <T> The return type of the visitor methods
 */
public abstract class ExpressionVisitor<T> {

    /**
     * Protected constructor to allow extension.
     */
    protected ExpressionVisitor() {
        // Allow extension
    }

    /**
     * Default process method for an expression.
     * @param expression the expression to process
     * @return the result of processing the expression
     */
    public abstract T process(Expression expression);

    /**
     * Visit method for MetricName.
     * @param metricName the MetricName to visit
     * @return the result of processing the MetricName
     */
    public T visit(MetricName metricName) {
        return process(metricName);
    }

    /**
     * Visit method for Tag.
     * @param tag the Tag to visit
     * @return the result of processing the Tag
     */
    public T visit(Tag tag) {
        return process(tag);
    }

    /**
     * Visit method for Variable.
     * @param variable the Variable to visit
     * @return the result of processing the Variable
     */
    public T visit(Variable variable) {
        return process(variable);
    }

    /**
     * Visit method for Literal.
     * @param literal the Literal to visit
     * @return the result of processing the Literal
     */
    public T visit(Literal literal) {
        return process(literal);
    }

    /**
     * Visit method for Function.
     * @param function the Function to visit
     * @return the result of processing the Function
     */
    public T visit(Function function) {
        return process(function);
    }

    /**
     * Visit method for Filter.
     * @param filter the Filter to visit
     * @return the result of processing the Filter
     */
    public T visit(Filter filter) {
        return process(filter);
    }
}
