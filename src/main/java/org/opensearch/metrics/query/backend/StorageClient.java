/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.backend;

import org.opensearch.metrics.query.backend.physical.PhysicalQuery;

import java.util.List;
import java.util.Map;

/**
 * Submits physical queries to the time-series store.
 */
public interface StorageClient {

    /**
     * Execute several physical queries in one round trip. Implementations may run them in parallel.
     * @param queries the queries
     * @return for each query, at the same position, its rows as maps from result column to value
     */
    List<List<Map<String, Object>>> bulkQuery(List<PhysicalQuery> queries);
}
