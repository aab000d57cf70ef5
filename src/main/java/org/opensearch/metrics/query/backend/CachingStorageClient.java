/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.backend;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.common.cache.Cache;
import org.opensearch.common.cache.CacheBuilder;
import org.opensearch.common.settings.Settings;
import org.opensearch.common.unit.TimeValue;
import org.opensearch.metrics.query.backend.physical.PhysicalQuery;
import org.opensearch.metrics.query.config.MetricsQuerySettings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * {@link StorageClient} that keeps the rows of recent physical queries in memory. Only the queries
 * of a bulk request that are not cached are sent to the delegate, in a single bulk request.
 * Lookups and inserts may happen concurrently.
 */
public class CachingStorageClient implements StorageClient {
    private static final Logger logger = LogManager.getLogger(CachingStorageClient.class);

    private final StorageClient delegate;
    private final Cache<PhysicalQuery, List<Map<String, Object>>> cache;

    /**
     * Constructor for CachingStorageClient.
     * @param delegate the uncached client
     * @param maxEntries maximum number of cached results
     * @param expireAfterWrite lifetime of a cached result
     */
    public CachingStorageClient(StorageClient delegate, long maxEntries, TimeValue expireAfterWrite) {
        this.delegate = delegate;
        this.cache = CacheBuilder.<PhysicalQuery, List<Map<String, Object>>>builder()
            .setMaximumWeight(maxEntries)
            .setExpireAfterWrite(expireAfterWrite)
            .build();
    }

    /**
     * Wrap a client in a cache if {@link MetricsQuerySettings#CACHE_ENABLED} is set.
     * @param settings node settings
     * @param client the client
     * @return the cached client, or {@code client} itself if caching is disabled
     */
    public static StorageClient wrapIfEnabled(Settings settings, StorageClient client) {
        if (MetricsQuerySettings.CACHE_ENABLED.get(settings) == false) {
            return client;
        }
        return new CachingStorageClient(
            client,
            MetricsQuerySettings.CACHE_SIZE.get(settings),
            MetricsQuerySettings.CACHE_EXPIRE_AFTER_WRITE.get(settings)
        );
    }

    @Override
    public List<List<Map<String, Object>>> bulkQuery(List<PhysicalQuery> queries) {
        List<List<Map<String, Object>>> results = new ArrayList<>(Collections.nCopies(queries.size(), null));
        List<PhysicalQuery> misses = new ArrayList<>();
        List<Integer> missPositions = new ArrayList<>();
        for (int i = 0; i < queries.size(); i++) {
            List<Map<String, Object>> cached = cache.get(queries.get(i));
            if (cached != null) {
                results.set(i, cached);
            } else {
                misses.add(queries.get(i));
                missPositions.add(i);
            }
        }
        logger.debug("Result cache: {} hits, {} misses", queries.size() - misses.size(), misses.size());

        if (misses.isEmpty() == false) {
            List<List<Map<String, Object>>> fetched = delegate.bulkQuery(misses);
            if (fetched.size() != misses.size()) {
                throw new IllegalStateException("Storage returned " + fetched.size() + " results for " + misses.size() + " queries");
            }
            for (int i = 0; i < misses.size(); i++) {
                List<Map<String, Object>> rows = List.copyOf(fetched.get(i));
                cache.put(misses.get(i), rows);
                results.set(missPositions.get(i), rows);
            }
        }
        return results;
    }

    /**
     * Get the number of cached results.
     * @return the entry count
     */
    public int cachedCount() {
        return cache.count();
    }

    /**
     * Drop all cached results.
     */
    public void invalidateAll() {
        cache.invalidateAll();
    }
}
