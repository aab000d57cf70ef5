/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.layer;

import org.opensearch.metrics.query.common.InvalidMetricsQueryException;
import org.opensearch.metrics.query.model.AggregationFn;
import org.opensearch.metrics.query.model.ArithmeticFn;
import org.opensearch.metrics.query.model.Condition;
import org.opensearch.metrics.query.model.Expression;
import org.opensearch.metrics.query.model.Filter;
import org.opensearch.metrics.query.model.Function;
import org.opensearch.metrics.query.model.MetricName;
import org.opensearch.metrics.query.model.SeriesQuery;
import org.opensearch.metrics.query.model.SeriesQueryBuilder;
import org.opensearch.test.OpenSearchTestCase;

import java.time.Instant;
import java.util.Set;

public class ExpansionLayerTests extends OpenSearchTestCase {

    private static final String FAILURE_RATE = "e:transactions/failure_rate@ratio";
    private static final String FAILURE_PERCENT = "e:transactions/failure_percent@percent";
    private static final MetricName FAILED = new MetricName("c:transactions/failed@none");
    private static final MetricName TOTAL = new MetricName("c:transactions/count@none");

    private static Expression failureRate() {
        return Function.of(ArithmeticFn.DIVIDE, Function.of(AggregationFn.SUM, FAILED), Function.of(AggregationFn.SUM, TOTAL));
    }

    public void testExpandsRegisteredMetric() {
        ExpansionLayer layer = new ExpansionLayer(new DerivedMetricRegistry().register(FAILURE_RATE, failureRate()), 10);

        SeriesQuery expanded = layer.transformQuery(query(new MetricName(FAILURE_RATE)));

        assertEquals(failureRate(), expanded.getExpressions().get(0));
    }

    public void testExpandsNestedDefinitions() {
        DerivedMetricRegistry registry = new DerivedMetricRegistry().register(FAILURE_RATE, failureRate())
            .register(FAILURE_PERCENT, Function.of(ArithmeticFn.MULTIPLY, new MetricName(FAILURE_RATE), new MetricName(FAILURE_RATE)));
        ExpansionLayer layer = new ExpansionLayer(registry, 10);

        Expression expanded = layer.expand(new MetricName(FAILURE_PERCENT));

        assertEquals(Function.of(ArithmeticFn.MULTIPLY, failureRate(), failureRate()), expanded);
    }

    public void testExpansionReachesFixpoint() {
        DerivedMetricRegistry registry = new DerivedMetricRegistry().register(FAILURE_RATE, failureRate())
            .register(FAILURE_PERCENT, Function.of(ArithmeticFn.MULTIPLY, new MetricName(FAILURE_RATE), new MetricName(FAILURE_RATE)));
        ExpansionLayer layer = new ExpansionLayer(registry, 10);
        SeriesQuery query = query(Function.of(ArithmeticFn.PLUS, new MetricName(FAILURE_PERCENT), new MetricName(FAILURE_RATE)));

        SeriesQuery once = layer.transformQuery(query);

        assertEquals(once, layer.transformQuery(once));
    }

    public void testExpandsInsideFilters() {
        ExpansionLayer layer = new ExpansionLayer(new DerivedMetricRegistry().register(FAILURE_RATE, failureRate()), 10);

        Expression expanded = layer.expand(Filter.of(new MetricName(FAILURE_RATE), Condition.eq("env", "prod")));

        assertEquals(Filter.of(failureRate(), Condition.eq("env", "prod")), expanded);
    }

    public void testVariablesAndPlainNamesAreNotExpanded() {
        ExpansionLayer layer = new ExpansionLayer(new DerivedMetricRegistry(), 10);

        assertEquals(new MetricName("$metric"), layer.expand(new MetricName("$metric")));
        assertEquals(new MetricName("transaction.duration"), layer.expand(new MetricName("transaction.duration")));
        assertEquals(FAILED, layer.expand(FAILED));
    }

    public void testUnregisteredDerivedMetricIsRejected() {
        ExpansionLayer layer = new ExpansionLayer(new DerivedMetricRegistry(), 10);

        InvalidMetricsQueryException e = expectThrows(
            InvalidMetricsQueryException.class,
            () -> layer.expand(new MetricName("e:transactions/unknown@none"))
        );
        assertTrue(e.getMessage().contains("e:transactions/unknown@none"));
    }

    public void testCyclicDefinitionFailsClosed() {
        String a = "e:transactions/a@none";
        String b = "e:transactions/b@none";
        DerivedMetricRegistry registry = new DerivedMetricRegistry().register(a, Function.of(AggregationFn.SUM, new MetricName(b)))
            .register(b, Function.of(AggregationFn.SUM, new MetricName(a)));
        ExpansionLayer layer = new ExpansionLayer(registry, 10);

        InvalidMetricsQueryException e = expectThrows(InvalidMetricsQueryException.class, () -> layer.expand(new MetricName(a)));
        assertTrue(e.getMessage(), e.getMessage().contains(a + " -> " + b + " -> " + a));
    }

    public void testDepthLimitFailsClosed() {
        DerivedMetricRegistry registry = new DerivedMetricRegistry();
        for (int i = 0; i < 5; i++) {
            registry.register("e:transactions/level" + i + "@none", new MetricName("e:transactions/level" + (i + 1) + "@none"));
        }
        registry.register("e:transactions/level5@none", TOTAL);

        assertEquals(TOTAL, new ExpansionLayer(registry, 6).expand(new MetricName("e:transactions/level0@none")));
        expectThrows(InvalidMetricsQueryException.class, () -> new ExpansionLayer(registry, 5).expand(new MetricName("e:transactions/level0@none")));
    }

    public void testRegistryRejectsRegistrationAfterFreeze() {
        DerivedMetricRegistry registry = new DerivedMetricRegistry().register(FAILURE_RATE, failureRate());
        new ExpansionLayer(registry, 10);

        assertTrue(registry.isFrozen());
        expectThrows(IllegalStateException.class, () -> registry.register(FAILURE_PERCENT, failureRate()));
    }

    public void testRegistryRejectsNonDerivedNamesAndDuplicates() {
        DerivedMetricRegistry registry = new DerivedMetricRegistry();

        expectThrows(IllegalArgumentException.class, () -> registry.register("c:transactions/count@none", failureRate()));
        expectThrows(IllegalArgumentException.class, () -> registry.register("failure_rate", failureRate()));
        registry.register(FAILURE_RATE, failureRate());
        expectThrows(IllegalArgumentException.class, () -> registry.register(FAILURE_RATE, failureRate()));
    }

    public void testRegistryLookupRequiresFreeze() {
        expectThrows(IllegalStateException.class, () -> new DerivedMetricRegistry().get(FAILURE_RATE));
    }

    private static SeriesQuery query(Expression expression) {
        return new SeriesQueryBuilder().scope(1, Set.of(1L))
            .range(Instant.ofEpochSecond(0), Instant.ofEpochSecond(3600))
            .expr(expression)
            .build();
    }
}
