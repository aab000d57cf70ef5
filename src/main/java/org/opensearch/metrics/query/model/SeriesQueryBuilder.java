/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Fluent builder for {@link SeriesQuery}.
 * <pre>{@code
 * SeriesQuery query = new SeriesQueryBuilder()
 *     .scope(1L, Set.of(42L))
 *     .range(start, end)
 *     .expr(Function.of(AggregationFn.AVG, new MetricName("d:transactions/duration@millisecond")))
 *     .filter(Condition.eq("environment", "prod"))
 *     .group("transaction")
 *     .build();
 * }</pre>
 */
public class SeriesQueryBuilder {
    private QueryScope scope;
    private TimeRange range;
    private final List<Expression> expressions = new ArrayList<>();
    private final List<Condition> filters = new ArrayList<>();
    private final List<Tag> groups = new ArrayList<>();
    private Rollup rollup = Rollup.auto();

    /**
     * Create an empty builder.
     */
    public SeriesQueryBuilder() {}

    public SeriesQueryBuilder scope(QueryScope queryScope) {
        this.scope = queryScope;
        return this;
    }

    public SeriesQueryBuilder scope(long orgId, Set<Long> projectIds) {
        return scope(QueryScope.of(orgId, projectIds));
    }

    public SeriesQueryBuilder range(Instant start, Instant end) {
        this.range = new TimeRange(start, end);
        return this;
    }

    public SeriesQueryBuilder range(TimeRange timeRange) {
        this.range = timeRange;
        return this;
    }

    /**
     * Append a top-level expression. Its index in the result is the number of expressions added before it.
     * @param expression the expression to evaluate
     * @return this builder
     */
    public SeriesQueryBuilder expr(Expression expression) {
        this.expressions.add(expression);
        return this;
    }

    public SeriesQueryBuilder filter(Condition... conditions) {
        this.filters.addAll(Arrays.asList(conditions));
        return this;
    }

    public SeriesQueryBuilder group(String... tagKeys) {
        for (String key : tagKeys) {
            this.groups.add(new Tag(key));
        }
        return this;
    }

    /**
     * Request a fixed bucket width instead of an inferred one.
     * @param seconds the bucket width in seconds
     * @return this builder
     */
    public SeriesQueryBuilder interval(long seconds) {
        this.rollup = rollup.withInterval(seconds);
        return this;
    }

    public SeriesQueryBuilder totals(boolean totals) {
        this.rollup = rollup.withTotals(totals);
        return this;
    }

    /**
     * Build the query.
     * @return the query
     * @throws IllegalStateException if scope, range or expressions are missing
     */
    public SeriesQuery build() {
        if (scope == null) {
            throw new IllegalStateException("Query scope must be set");
        }
        if (range == null) {
            throw new IllegalStateException("Query range must be set");
        }
        if (expressions.isEmpty()) {
            throw new IllegalStateException("Query requires at least one expression");
        }
        return new SeriesQuery(scope, range, expressions, filters, groups, rollup);
    }
}
