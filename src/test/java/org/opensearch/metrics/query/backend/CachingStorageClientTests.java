/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.backend;

import org.opensearch.common.settings.Settings;
import org.opensearch.common.unit.TimeValue;
import org.opensearch.metrics.query.backend.physical.Call;
import org.opensearch.metrics.query.backend.physical.Column;
import org.opensearch.metrics.query.backend.physical.Constant;
import org.opensearch.metrics.query.backend.physical.PhysicalQuery;
import org.opensearch.metrics.query.backend.physical.SelectedExpression;
import org.opensearch.metrics.query.framework.RecordingStorageClient;
import org.opensearch.test.OpenSearchTestCase;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

public class CachingStorageClientTests extends OpenSearchTestCase {

    public void testCachedQueriesAreNotResubmitted() {
        RecordingStorageClient delegate = new RecordingStorageClient(
            List.of(List.of(Map.of("0", 1)), List.of(Map.of("0", 2)), List.of(Map.of("0", 3)))
        );
        CachingStorageClient client = new CachingStorageClient(delegate, 100, TimeValue.timeValueMinutes(1));

        List<List<Map<String, Object>>> first = client.bulkQuery(List.of(query(1), query(2)));
        List<List<Map<String, Object>>> second = client.bulkQuery(List.of(query(2), query(3), query(1)));

        assertEquals(List.of(List.of(Map.of("0", 1)), List.of(Map.of("0", 2))), first);
        assertEquals(List.of(List.of(Map.of("0", 2)), List.of(Map.of("0", 3)), List.of(Map.of("0", 1))), second);
        assertEquals(2, delegate.getRequests().size());
        assertEquals(List.of(query(3)), delegate.getRequests().get(1));
        assertEquals(3, client.cachedCount());
    }

    public void testFullyCachedRequestSkipsDelegate() {
        RecordingStorageClient delegate = new RecordingStorageClient(List.of(List.of(Map.of("0", 1))));
        CachingStorageClient client = new CachingStorageClient(delegate, 100, TimeValue.timeValueMinutes(1));

        client.bulkQuery(List.of(query(1)));
        client.bulkQuery(List.of(query(1)));

        assertEquals(1, delegate.getRequests().size());
        client.invalidateAll();
        assertEquals(0, client.cachedCount());
    }

    public void testConcurrentLookups() throws Exception {
        AtomicInteger submitted = new AtomicInteger();
        StorageClient delegate = queries -> {
            submitted.addAndGet(queries.size());
            List<List<Map<String, Object>>> results = new ArrayList<>();
            for (PhysicalQuery query : queries) {
                results.add(List.of(Map.of("granularity", query.getGranularity())));
            }
            return results;
        };
        CachingStorageClient client = new CachingStorageClient(delegate, 100, TimeValue.timeValueMinutes(1));
        int threads = 4;
        CountDownLatch start = new CountDownLatch(1);
        List<Thread> workers = new ArrayList<>();
        List<Throwable> failures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            Thread worker = new Thread(() -> {
                try {
                    start.await();
                    for (int i = 0; i < 50; i++) {
                        long granularity = i % 5 + 1;
                        List<List<Map<String, Object>>> rows = client.bulkQuery(List.of(query(granularity)));
                        assertEquals(granularity, rows.get(0).get(0).get("granularity"));
                    }
                } catch (Throwable e) {
                    synchronized (failures) {
                        failures.add(e);
                    }
                }
            });
            workers.add(worker);
            worker.start();
        }
        start.countDown();
        for (Thread worker : workers) {
            worker.join();
        }

        assertTrue(failures.toString(), failures.isEmpty());
        assertEquals(5, client.cachedCount());
        assertTrue(submitted.get() >= 5);
    }

    public void testWrapIfEnabled() {
        StorageClient delegate = queries -> List.of();

        assertSame(delegate, CachingStorageClient.wrapIfEnabled(Settings.EMPTY, delegate));
        assertTrue(
            CachingStorageClient.wrapIfEnabled(Settings.builder().put("metrics.query.cache.enabled", true).build(), delegate)
                instanceof CachingStorageClient
        );
    }

    private static PhysicalQuery query(long granularity) {
        return new PhysicalQuery(
            "generic_metrics",
            "generic_metrics_counters",
            List.of(new SelectedExpression("0", Call.of("sumIf", Column.of("value"), Call.of("equals", Column.of("metric_id"), Constant.of(2L))))),
            List.of(),
            List.of(Call.of("equals", Column.of("org_id"), Constant.of(1L))),
            granularity
        );
    }
}
