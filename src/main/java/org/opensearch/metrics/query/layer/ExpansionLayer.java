/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.layer;

import org.opensearch.metrics.query.common.InvalidMetricsQueryException;
import org.opensearch.metrics.query.model.Expression;
import org.opensearch.metrics.query.model.MetricName;
import org.opensearch.metrics.query.model.MetricType;
import org.opensearch.metrics.query.model.Mri;
import org.opensearch.metrics.query.model.SeriesQuery;
import org.opensearch.metrics.query.pipeline.QueryLayer;
import org.opensearch.metrics.query.visitor.QueryTransform;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Replaces derived metrics with the expressions defining them, recursively, until no registered
 * metric is left. Variables are never expanded and plain metric names are left alone.
 *
 * <p>Definitions may reference other derived metrics. A chain of nested definitions longer than
 * {@code maxDepth}, or one that revisits a metric it is already expanding, fails the query.
 */
public class ExpansionLayer implements QueryLayer {

    private final DerivedMetricRegistry registry;
    private final int maxDepth;

    /**
     * Constructor for ExpansionLayer. Freezes the registry.
     * @param registry derived metric definitions
     * @param maxDepth maximum nesting of definitions
     */
    public ExpansionLayer(DerivedMetricRegistry registry, int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
        this.registry = registry.freeze();
        this.maxDepth = maxDepth;
    }

    @Override
    public SeriesQuery transformQuery(SeriesQuery query) {
        return new Expander().visitQuery(query);
    }

    /**
     * Expand a single expression.
     * @param expression the expression
     * @return the expression with all derived metrics replaced
     */
    public Expression expand(Expression expression) {
        return new Expander().process(expression);
    }

    /**
     * Expansion state of one query: the chain of derived metrics being expanded.
     */
    private class Expander extends QueryTransform {
        private final Deque<String> chain = new ArrayDeque<>();

        @Override
        public Expression visit(MetricName metricName) {
            if (metricName.isVariable()) {
                return metricName;
            }
            String name = metricName.getName();
            Optional<Expression> definition = registry.get(name);
            if (definition.isEmpty()) {
                Optional<Mri> mri = metricName.getMri();
                if (mri.isPresent() && mri.get().type() == MetricType.DERIVED) {
                    throw InvalidMetricsQueryException.of("unknown derived metric %s", name);
                }
                return metricName;
            }

            if (chain.contains(name)) {
                throw InvalidMetricsQueryException.of("cyclic derived metric definition: %s -> %s", String.join(" -> ", chainInOrder()), name);
            }
            if (chain.size() >= maxDepth) {
                throw InvalidMetricsQueryException.of(
                    "derived metric expansion exceeded max depth %d: %s -> %s",
                    maxDepth,
                    String.join(" -> ", chainInOrder()),
                    name
                );
            }
            chain.push(name);
            try {
                return process(definition.get());
            } finally {
                chain.pop();
            }
        }

        private List<String> chainInOrder() {
            List<String> ordered = new ArrayList<>(chain);
            Collections.reverse(ordered);
            return ordered;
        }
    }
}
