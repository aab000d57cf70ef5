/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.model;

import org.opensearch.test.OpenSearchTestCase;

import java.util.List;

public class SeriesResultTests extends OpenSearchTestCase {

    public void testSeriesYieldsNullForMissingBuckets() {
        SeriesResult result = new SeriesResult.Builder().addInterval(180)
            .addValue(GroupKey.EMPTY, 0, 60, 1.5)
            .addValue(GroupKey.EMPTY, 0, 120, 2.5)
            .build();

        assertEquals(List.of(60L, 120L, 180L), result.getIntervals());
        assertEquals(
            List.of(new SeriesResult.Bucket(60, 1.5), new SeriesResult.Bucket(120, 2.5), new SeriesResult.Bucket(180, null)),
            result.series(GroupKey.EMPTY, 0)
        );
        assertNull(result.getValue(GroupKey.EMPTY, 1, 60));
    }

    public void testIterateSeriesOrdersByGroupThenExpression() {
        GroupKey dev = GroupKey.of("env", "dev");
        GroupKey prod = GroupKey.of("env", "prod");
        SeriesResult result = new SeriesResult.Builder().addValue(prod, 1, 0, 4)
            .addValue(prod, 0, 0, 3)
            .addValue(dev, 0, 0, 1)
            .addTag("env", "prod")
            .addTag("env", "dev")
            .build();

        List<SeriesResult.Series> series = result.iterateSeries();

        assertEquals(3, series.size());
        assertEquals(dev, series.get(0).group());
        assertEquals(prod, series.get(1).group());
        assertEquals(0, series.get(1).expression());
        assertEquals(1, series.get(2).expression());
        assertEquals(List.of("dev", "prod"), List.copyOf(result.getTags().get("env")));
    }

    public void testAddAllRemapsExpressionIndexes() {
        SeriesResult counters = new SeriesResult.Builder().addValue(GroupKey.EMPTY, 0, 60, 10).addTotal(GroupKey.EMPTY, 0, 10).build();
        SeriesResult distributions = new SeriesResult.Builder().addValue(GroupKey.EMPTY, 0, 120, 0.5).build();

        SeriesResult merged = new SeriesResult.Builder().addAll(counters, List.of(1)).addAll(distributions, List.of(0)).build();

        assertEquals(Double.valueOf(10), merged.getValue(GroupKey.EMPTY, 1, 60));
        assertEquals(Double.valueOf(0.5), merged.getValue(GroupKey.EMPTY, 0, 120));
        assertEquals(Double.valueOf(10), merged.getTotals().get(GroupKey.EMPTY).get(1));
        assertEquals(List.of(60L, 120L), merged.getIntervals());
    }

    public void testResultIsImmutable() {
        SeriesResult result = new SeriesResult.Builder().addValue(GroupKey.EMPTY, 0, 60, 1).build();

        expectThrows(UnsupportedOperationException.class, () -> result.getGroups().clear());
        expectThrows(UnsupportedOperationException.class, () -> result.getGroups().get(GroupKey.EMPTY).get(0).put(120L, 2.0));
        expectThrows(UnsupportedOperationException.class, () -> result.getIntervals().add(0L));
    }

    public void testEmptyResult() {
        SeriesResult empty = SeriesResult.empty();
        assertTrue(empty.getGroups().isEmpty());
        assertTrue(empty.iterateSeries().isEmpty());
    }
}
