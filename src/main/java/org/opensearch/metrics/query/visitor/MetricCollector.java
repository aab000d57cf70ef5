/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.visitor;

import org.opensearch.metrics.query.model.Expression;
import org.opensearch.metrics.query.model.MetricName;
import org.opensearch.metrics.query.model.SeriesQuery;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects the metric references of an expression tree, in order of first appearance. Metric names used as
 * condition operands are not collected.
 */
public class MetricCollector extends ExpressionVisitor<Set<MetricName>> {
    private final Set<MetricName> metrics = new LinkedHashSet<>();

    private MetricCollector() {}

    /**
     * Collect the metrics referenced by the expressions of a query.
     * @param query the query
     * @return the referenced metrics
     */
    public static Set<MetricName> collect(SeriesQuery query) {
        MetricCollector collector = new MetricCollector();
        for (Expression expression : query.getExpressions()) {
            expression.accept(collector);
        }
        return collector.metrics;
    }

    /**
     * Collect the metrics referenced by a single expression.
     * @param expression the expression
     * @return the referenced metrics
     */
    public static Set<MetricName> collect(Expression expression) {
        MetricCollector collector = new MetricCollector();
        return expression.accept(collector);
    }

    @Override
    public Set<MetricName> process(Expression expression) {
        for (Expression child : expression.getChildren()) {
            child.accept(this);
        }
        return metrics;
    }

    @Override
    public Set<MetricName> visit(MetricName metricName) {
        metrics.add(metricName);
        return metrics;
    }
}
