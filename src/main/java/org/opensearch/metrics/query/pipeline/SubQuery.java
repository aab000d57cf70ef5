/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.pipeline;

import org.opensearch.metrics.query.model.SeriesQuery;

import java.util.List;

/**
 * A part of a logical query that a backend can execute on its own.
 *
 * @param query the executable query
 * @param expressionIndexes for each expression of {@code query}, its index in the logical query
 */
public record SubQuery(SeriesQuery query, List<Integer> expressionIndexes) {

    /**
     * Creates a sub-query.
     */
    public SubQuery {
        if (query.getExpressions().size() != expressionIndexes.size()) {
            throw new IllegalArgumentException(
                "Sub-query has " + query.getExpressions().size() + " expressions but " + expressionIndexes.size() + " indexes"
            );
        }
        expressionIndexes = List.copyOf(expressionIndexes);
    }
}
