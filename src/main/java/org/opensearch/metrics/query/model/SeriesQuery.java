/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.model;

import org.opensearch.metrics.query.visitor.VariableBinder;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The logical query: which expressions to evaluate over which time range, for which tenant, filtered, grouped and
 * bucketed how. The position of an expression in {@link #getExpressions()} is its index in the {@link SeriesResult}.
 *
 * <p>Instances are immutable, layers derive rewritten copies through the {@code with*} methods. Build new
 * queries with {@link SeriesQueryBuilder}.</p>
 */
public final class SeriesQuery {
    private final QueryScope scope;
    private final TimeRange range;
    private final List<Expression> expressions;
    private final List<Condition> filters;
    private final List<Tag> groups;
    private final Rollup rollup;

    /**
     * Create a query.
     *
     * @param scope tenant scope
     * @param range requested time window
     * @param expressions ordered top-level expressions
     * @param filters conditions applied to every expression
     * @param groups ordered group-by tags
     * @param rollup requested bucketing
     */
    public SeriesQuery(
        QueryScope scope,
        TimeRange range,
        List<Expression> expressions,
        List<Condition> filters,
        List<Tag> groups,
        Rollup rollup
    ) {
        this.scope = Objects.requireNonNull(scope, "scope cannot be null");
        this.range = Objects.requireNonNull(range, "range cannot be null");
        this.expressions = List.copyOf(expressions);
        this.filters = List.copyOf(filters);
        this.groups = List.copyOf(groups);
        this.rollup = Objects.requireNonNull(rollup, "rollup cannot be null");
    }

    public QueryScope getScope() {
        return scope;
    }

    public TimeRange getRange() {
        return range;
    }

    public List<Expression> getExpressions() {
        return expressions;
    }

    public List<Condition> getFilters() {
        return filters;
    }

    public List<Tag> getGroups() {
        return groups;
    }

    public Rollup getRollup() {
        return rollup;
    }

    public SeriesQuery withRange(TimeRange newRange) {
        return new SeriesQuery(scope, newRange, expressions, filters, groups, rollup);
    }

    public SeriesQuery withExpressions(List<Expression> newExpressions) {
        return new SeriesQuery(scope, range, newExpressions, filters, groups, rollup);
    }

    public SeriesQuery withFilters(List<Condition> newFilters) {
        return new SeriesQuery(scope, range, expressions, newFilters, groups, rollup);
    }

    public SeriesQuery withGroups(List<Tag> newGroups) {
        return new SeriesQuery(scope, range, expressions, filters, newGroups, rollup);
    }

    public SeriesQuery withRollup(Rollup newRollup) {
        return new SeriesQuery(scope, range, expressions, filters, groups, newRollup);
    }

    /**
     * Bind values to the variables referenced anywhere in this query. Variables without an entry in
     * {@code values} stay unbound.
     *
     * @param values variable name, without sigil, to value
     * @return a copy of this query with bound variables
     */
    public SeriesQuery bind(Map<String, ?> values) {
        return new VariableBinder(values).visitQuery(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SeriesQuery other)) {
            return false;
        }
        return scope.equals(other.scope)
            && range.equals(other.range)
            && expressions.equals(other.expressions)
            && filters.equals(other.filters)
            && groups.equals(other.groups)
            && rollup.equals(other.rollup);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scope, range, expressions, filters, groups, rollup);
    }

    @Override
    public String toString() {
        return "SeriesQuery{expressions="
            + expressions.stream().map(Expression::getExplainName).collect(Collectors.joining(", ", "[", "]"))
            + ", filters="
            + filters
            + ", groups="
            + groups
            + ", range="
            + range
            + ", rollup="
            + rollup
            + ", scope="
            + scope
            + "}";
    }
}
