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
 * Executes fully rewritten queries against storage.
 */
public interface QueryBackend {

    /**
     * Execute a batch of queries, each of which references a single storage entity.
     * @param queries the queries
     * @return one result per query, keyed by the query it answers
     */
    Map<SeriesQuery, SeriesResult> execute(List<SeriesQuery> queries);
}
