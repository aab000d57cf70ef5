/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.layer;

import org.opensearch.metrics.query.model.AggregationFn;
import org.opensearch.metrics.query.model.ArithmeticFn;
import org.opensearch.metrics.query.model.Condition;
import org.opensearch.metrics.query.model.ConditionFn;
import org.opensearch.metrics.query.model.Expression;
import org.opensearch.metrics.query.model.Filter;
import org.opensearch.metrics.query.model.Function;
import org.opensearch.metrics.query.model.Literal;
import org.opensearch.metrics.query.model.MetricName;
import org.opensearch.metrics.query.model.SeriesQuery;
import org.opensearch.metrics.query.model.SeriesQueryBuilder;
import org.opensearch.metrics.query.model.Tag;
import org.opensearch.test.OpenSearchTestCase;

import java.time.Instant;
import java.util.List;
import java.util.Set;

public class FilterMergeLayerTests extends OpenSearchTestCase {

    private static final MetricName DURATION = new MetricName("d:transactions/duration@millisecond");
    private static final MetricName FAILED = new MetricName("c:transactions/failed@none");
    private static final MetricName TOTAL = new MetricName("c:transactions/count@none");

    private final FilterMergeLayer layer = new FilterMergeLayer();

    public void testNestedFiltersMergeOutermostFirst() {
        // Filter(Filter(M, [tag = a]), [tag2 = b])
        Expression nested = Filter.of(Filter.of(DURATION, Condition.eq("tag", "a")), Condition.eq("tag2", "b"));

        Expression merged = layer.merge(nested);

        assertEquals(Filter.of(DURATION, Condition.eq("tag2", "b"), Condition.eq("tag", "a")), merged);
    }

    public void testFilterAroundAggregationIsPushedToMetric() {
        Expression expression = Filter.of(
            Function.of(AggregationFn.AVG, Filter.of(DURATION, Condition.eq("tag", "a"))),
            Condition.eq("tag2", "b")
        );

        Expression merged = layer.merge(expression);

        assertEquals(Function.of(AggregationFn.AVG, Filter.of(DURATION, Condition.eq("tag2", "b"), Condition.eq("tag", "a"))), merged);
    }

    public void testFilterAroundArithmeticAppliesToBothSides() {
        Expression expression = Filter.of(
            Function.of(ArithmeticFn.DIVIDE, Function.of(AggregationFn.SUM, FAILED), Function.of(AggregationFn.SUM, TOTAL)),
            Condition.eq("env", "prod")
        );

        Expression merged = layer.merge(expression);

        assertEquals(
            Function.of(
                ArithmeticFn.DIVIDE,
                Function.of(AggregationFn.SUM, Filter.of(FAILED, Condition.eq("env", "prod"))),
                Function.of(AggregationFn.SUM, Filter.of(TOTAL, Condition.eq("env", "prod")))
            ),
            merged
        );
    }

    public void testMergeIsIdempotent() {
        Condition inList = new Condition(new Tag("release"), ConditionFn.IN, Literal.ofList(List.of("1.0", "1.1")));
        SeriesQuery query = new SeriesQueryBuilder().scope(1, Set.of(1L))
            .range(Instant.ofEpochSecond(0), Instant.ofEpochSecond(3600))
            .expr(Filter.of(Function.of(AggregationFn.P95, Filter.of(DURATION, Condition.eq("tag", "a"))), inList))
            .expr(Function.of(AggregationFn.AVG, DURATION))
            .expr(Function.of(AggregationFn.MAX, Filter.of(DURATION)))
            .filter(Condition.eq("env", "prod"))
            .build();

        SeriesQuery once = layer.transformQuery(query);
        SeriesQuery twice = layer.transformQuery(once);

        assertEquals(once, twice);
        assertEquals(Function.of(AggregationFn.AVG, DURATION), once.getExpressions().get(1));
        assertEquals(Function.of(AggregationFn.MAX, DURATION), once.getExpressions().get(2));
        assertEquals(List.of(Condition.eq("env", "prod")), once.getFilters());
    }
}
