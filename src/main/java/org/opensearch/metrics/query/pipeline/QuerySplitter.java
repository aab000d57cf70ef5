/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.pipeline;

import org.opensearch.metrics.query.common.InvalidMetricsQueryException;
import org.opensearch.metrics.query.model.Expression;
import org.opensearch.metrics.query.model.MetricName;
import org.opensearch.metrics.query.model.MetricType;
import org.opensearch.metrics.query.model.Mri;
import org.opensearch.metrics.query.model.SeriesQuery;
import org.opensearch.metrics.query.visitor.MetricCollector;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Splits a query whose top-level expressions read different storage entities into one sub-query
 * per entity. Within a use case each metric type is stored in its own entity.
 */
public class QuerySplitter {

    /**
     * Constructor for QuerySplitter.
     */
    public QuerySplitter() {}

    /**
     * Split a validated query.
     * @param query the query
     * @return the sub-queries in order of first appearance of their entity
     * @throws InvalidMetricsQueryException if a single expression reads more than one entity
     */
    public List<SubQuery> split(SeriesQuery query) {
        Map<MetricType, List<Integer>> indexesByType = new LinkedHashMap<>();
        List<Expression> expressions = query.getExpressions();
        for (int i = 0; i < expressions.size(); i++) {
            MetricType type = entityType(expressions.get(i));
            indexesByType.computeIfAbsent(type, k -> new ArrayList<>()).add(i);
        }

        if (indexesByType.size() <= 1) {
            List<Integer> identity = new ArrayList<>(expressions.size());
            for (int i = 0; i < expressions.size(); i++) {
                identity.add(i);
            }
            return List.of(new SubQuery(query, identity));
        }

        List<SubQuery> subQueries = new ArrayList<>(indexesByType.size());
        for (List<Integer> indexes : indexesByType.values()) {
            List<Expression> part = new ArrayList<>(indexes.size());
            for (int index : indexes) {
                part.add(expressions.get(index));
            }
            subQueries.add(new SubQuery(query.withExpressions(part), indexes));
        }
        return subQueries;
    }

    private static MetricType entityType(Expression expression) {
        Set<MetricType> types = EnumSet.noneOf(MetricType.class);
        for (MetricName metric : MetricCollector.collect(expression)) {
            types.add(Mri.parseOrThrow(metric.getName()).type());
        }
        if (types.size() > 1) {
            throw InvalidMetricsQueryException.of(
                "expression must reference a single entity, found metric types %s in %s",
                types,
                expression.getExplainName()
            );
        }
        return types.isEmpty() ? null : types.iterator().next();
    }
}
