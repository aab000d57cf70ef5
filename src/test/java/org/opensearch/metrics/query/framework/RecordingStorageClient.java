/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.framework;

import org.opensearch.metrics.query.backend.StorageClient;
import org.opensearch.metrics.query.backend.physical.PhysicalQuery;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link StorageClient} that records every bulk request and answers each physical query with the
 * next prepared row set, or with no rows once those run out.
 */
public class RecordingStorageClient implements StorageClient {
    private final List<List<Map<String, Object>>> responses;
    private final List<List<PhysicalQuery>> requests = new ArrayList<>();
    private int next;

    public RecordingStorageClient(List<List<Map<String, Object>>> responses) {
        this.responses = responses == null ? List.of() : responses;
    }

    @Override
    public synchronized List<List<Map<String, Object>>> bulkQuery(List<PhysicalQuery> queries) {
        requests.add(List.copyOf(queries));
        List<List<Map<String, Object>>> results = new ArrayList<>();
        for (int i = 0; i < queries.size(); i++) {
            results.add(next < responses.size() ? responses.get(next++) : List.of());
        }
        return results;
    }

    /**
     * Get the bulk requests received so far.
     * @return one list of physical queries per bulk call
     */
    public List<List<PhysicalQuery>> getRequests() {
        return requests;
    }

    /**
     * Get all physical queries received so far, across bulk calls.
     * @return the queries in submission order
     */
    public List<PhysicalQuery> getQueries() {
        List<PhysicalQuery> all = new ArrayList<>();
        requests.forEach(all::addAll);
        return all;
    }
}
