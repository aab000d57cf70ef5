/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.backend.physical;

import org.opensearch.core.xcontent.ToXContentObject;
import org.opensearch.core.xcontent.XContentBuilder;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A query against one entity of the time-series store.
 *
 * <p>The result has one row per distinct combination of group-by values, carrying one column per
 * select alias and per group-by alias. Rows are read from data pre-aggregated at {@code granularity}
 * seconds and must satisfy every predicate of {@code where}.
 *
 * <p>Example JSON representation:
 * <pre>{@code
 * {
 *   "dataset": "generic_metrics",
 *   "entity": "generic_metrics_distributions",
 *   "select": [ { "alias": "0", "expression": { "function": "avgIf", "arguments": [ ... ] } } ],
 *   "group_by": [ { "alias": "bucketed_time", "expression": { ... } } ],
 *   "where": [ { "function": "equals", "arguments": [ { "column": "org_id" }, { "constant": 1 } ] } ],
 *   "granularity": 60
 * }
 * }</pre>
 */
public final class PhysicalQuery implements ToXContentObject {
    private final String dataset;
    private final String entity;
    private final List<SelectedExpression> select;
    private final List<SelectedExpression> groupBy;
    private final List<PhysicalExpression> where;
    private final long granularity;

    /**
     * Create a physical query.
     * @param dataset the dataset
     * @param entity the entity within the dataset
     * @param select the selected aggregates
     * @param groupBy the grouping columns
     * @param where predicates that must all hold
     * @param granularity the pre-aggregation level to read, in seconds
     */
    public PhysicalQuery(
        String dataset,
        String entity,
        List<SelectedExpression> select,
        List<SelectedExpression> groupBy,
        List<PhysicalExpression> where,
        long granularity
    ) {
        this.dataset = Objects.requireNonNull(dataset, "dataset cannot be null");
        this.entity = Objects.requireNonNull(entity, "entity cannot be null");
        this.select = List.copyOf(select);
        this.groupBy = List.copyOf(groupBy);
        this.where = List.copyOf(where);
        this.granularity = granularity;
    }

    public String getDataset() {
        return dataset;
    }

    public String getEntity() {
        return entity;
    }

    public List<SelectedExpression> getSelect() {
        return select;
    }

    public List<SelectedExpression> getGroupBy() {
        return groupBy;
    }

    public List<PhysicalExpression> getWhere() {
        return where;
    }

    public long getGranularity() {
        return granularity;
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.field("dataset", dataset);
        builder.field("entity", entity);
        builder.startArray("select");
        for (SelectedExpression expression : select) {
            expression.toXContent(builder, params);
        }
        builder.endArray();
        builder.startArray("group_by");
        for (SelectedExpression expression : groupBy) {
            expression.toXContent(builder, params);
        }
        builder.endArray();
        builder.startArray("where");
        for (PhysicalExpression predicate : where) {
            predicate.toXContent(builder, params);
        }
        builder.endArray();
        builder.field("granularity", granularity);
        return builder.endObject();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PhysicalQuery that = (PhysicalQuery) o;
        return granularity == that.granularity
            && dataset.equals(that.dataset)
            && entity.equals(that.entity)
            && select.equals(that.select)
            && groupBy.equals(that.groupBy)
            && where.equals(that.where);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dataset, entity, select, groupBy, where, granularity);
    }

    @Override
    public String toString() {
        return "SELECT "
            + select.stream().map(SelectedExpression::toString).collect(Collectors.joining(", "))
            + " FROM "
            + dataset
            + "."
            + entity
            + " WHERE "
            + where.stream().map(PhysicalExpression::render).collect(Collectors.joining(" AND "))
            + (groupBy.isEmpty() ? "" : " GROUP BY " + groupBy.stream().map(SelectedExpression::toString).collect(Collectors.joining(", ")))
            + " GRANULARITY "
            + granularity;
    }
}
