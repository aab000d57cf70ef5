/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.pipeline;

import org.opensearch.metrics.query.model.SeriesQuery;
import org.opensearch.metrics.query.model.SeriesResult;

import java.util.List;
import java.util.Map;

/**
 * Combines the results of the sub-queries of one logical query. Sub-query results are joined on
 * group key and bucket; since every sub-query covers distinct expressions of the logical query, a
 * cell is written by at most one sub-query and a missing cell stays missing.
 */
public class ResultMerger {

    /**
     * Constructor for ResultMerger.
     */
    public ResultMerger() {}

    /**
     * Merge sub-query results.
     * @param subQueries the sub-queries the logical query was split into
     * @param results the backend results keyed by sub-query
     * @return the result of the logical query
     * @throws IllegalStateException if there are no sub-queries or the backend omitted a result
     */
    public SeriesResult merge(List<SubQuery> subQueries, Map<SeriesQuery, SeriesResult> results) {
        if (subQueries.isEmpty()) {
            throw new IllegalStateException("Cannot merge results of zero sub-queries");
        }
        if (subQueries.size() == 1) {
            return resultOf(subQueries.get(0).query(), results);
        }

        SeriesResult.Builder builder = new SeriesResult.Builder();
        for (SubQuery subQuery : subQueries) {
            builder.addAll(resultOf(subQuery.query(), results), subQuery.expressionIndexes());
        }
        return builder.build();
    }

    private static SeriesResult resultOf(SeriesQuery query, Map<SeriesQuery, SeriesResult> results) {
        SeriesResult result = results.get(query);
        if (result == null) {
            throw new IllegalStateException("Backend returned no result for query " + query);
        }
        return result;
    }
}
