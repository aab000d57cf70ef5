/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.layer;

import org.opensearch.metrics.query.model.Condition;
import org.opensearch.metrics.query.model.Expression;
import org.opensearch.metrics.query.model.Filter;
import org.opensearch.metrics.query.model.MetricName;
import org.opensearch.metrics.query.model.SeriesQuery;
import org.opensearch.metrics.query.pipeline.QueryLayer;
import org.opensearch.metrics.query.visitor.QueryTransform;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Pushes filters down to the metrics they apply to.
 *
 * <p>Every filter in an expression tree is removed and its conditions are attached to each metric
 * below it, so that each metric ends up wrapped in exactly one filter carrying all conditions that
 * apply to it, outermost first:
 * <pre>
 * sum(d:transactions/duration@ms{tag=a}){tag2=b}  =&gt;  sum(d:transactions/duration@ms{tag2=b, tag=a})
 * </pre>
 * Applying the layer to its own output returns the same query. Query-level filters are not touched.
 */
public class FilterMergeLayer implements QueryLayer {

    /**
     * Constructor for FilterMergeLayer.
     */
    public FilterMergeLayer() {}

    @Override
    public SeriesQuery transformQuery(SeriesQuery query) {
        return new Merger().visitQuery(query);
    }

    /**
     * Merge the filters of a single expression.
     * @param expression the expression
     * @return the expression with filters attached to its metrics
     */
    public Expression merge(Expression expression) {
        return new Merger().process(expression);
    }

    /**
     * Merge state of one query: the condition lists of the enclosing filters, innermost on top.
     */
    private static class Merger extends QueryTransform {
        private final Deque<List<Condition>> stack = new ArrayDeque<>();

        @Override
        public Expression visit(Filter filter) {
            stack.push(filter.getConditions());
            try {
                return process(filter.getInner());
            } finally {
                stack.pop();
            }
        }

        @Override
        public Expression visit(MetricName metricName) {
            List<Condition> conditions = new ArrayList<>();
            Iterator<List<Condition>> outermostFirst = stack.descendingIterator();
            while (outermostFirst.hasNext()) {
                conditions.addAll(outermostFirst.next());
            }
            return conditions.isEmpty() ? metricName : new Filter(metricName, conditions);
        }
    }
}
