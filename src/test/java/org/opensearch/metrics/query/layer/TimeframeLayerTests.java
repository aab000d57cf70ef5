/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.layer;

import org.opensearch.metrics.query.common.Constants;
import org.opensearch.metrics.query.framework.TestConfigs;
import org.opensearch.metrics.query.model.AggregationFn;
import org.opensearch.metrics.query.model.Function;
import org.opensearch.metrics.query.model.MetricName;
import org.opensearch.metrics.query.model.SeriesQuery;
import org.opensearch.metrics.query.model.SeriesQueryBuilder;
import org.opensearch.test.OpenSearchTestCase;

import java.time.Instant;
import java.util.List;
import java.util.Set;

public class TimeframeLayerTests extends OpenSearchTestCase {

    private static final long START = 1_700_000_000L - 1_700_000_000L % 3600;

    private final TimeframeLayer layer = new TimeframeLayer(
        TestConfigs.lookup(TestConfigs.useCase(TestConfigs.USE_CASE, List.of(60L, 3600L), false)),
        Constants.Time.DEFAULT_MAX_BUCKETS
    );

    public void testSixHoursWithExactlyMaxBucketsKeepsMinuteGranularity() {
        // Arrange: 6h / 60s = 360 buckets, which is within the inclusive bound
        SeriesQuery query = query(START, START + 6 * 3600).build();

        // Act
        SeriesQuery resolved = layer.transformQuery(query);

        // Assert
        assertEquals(Long.valueOf(60), resolved.getRollup().interval());
        assertEquals(START, resolved.getRange().startSeconds());
        assertEquals(START + 6 * 3600, resolved.getRange().endSeconds());
    }

    public void testOneBucketOverMaxUsesNextGranularity() {
        SeriesQuery query = query(START, START + 361 * 60).build();

        SeriesQuery resolved = layer.transformQuery(query);

        assertEquals(Long.valueOf(3600), resolved.getRollup().interval());
        assertEquals(START, resolved.getRange().startSeconds());
        assertEquals(START + 7 * 3600, resolved.getRange().endSeconds());
    }

    public void testWindowBeyondAllGranularitiesUsesLargest() {
        SeriesQuery query = query(START, START + 30L * 86400).build();

        assertEquals(Long.valueOf(3600), layer.transformQuery(query).getRollup().interval());
    }

    public void testRequestedIntervalIsRoundedToBaseGranularity() {
        assertEquals(Long.valueOf(120), layer.transformQuery(query(START, START + 3600).interval(90).build()).getRollup().interval());
        assertEquals(Long.valueOf(60), layer.transformQuery(query(START, START + 3600).interval(20).build()).getRollup().interval());
        assertEquals(Long.valueOf(300), layer.transformQuery(query(START, START + 3600).interval(300).build()).getRollup().interval());
    }

    public void testUnknownUseCaseUsesDefaultGranularities() {
        SeriesQuery query = new SeriesQueryBuilder().scope(1, Set.of(1L))
            .range(Instant.ofEpochSecond(START), Instant.ofEpochSecond(START + 3600))
            .expr(Function.of(AggregationFn.SUM, new MetricName("c:unknown/count@none")))
            .build();

        // 3600 / 10 = 360 buckets at the smallest default granularity
        assertEquals(Long.valueOf(10), layer.transformQuery(query).getRollup().interval());
    }

    public void testInvertedRangeIsNotAligned() {
        SeriesQuery query = query(START + 90, START + 30).build();

        SeriesQuery resolved = layer.transformQuery(query);

        assertEquals(query.getRange(), resolved.getRange());
        assertEquals(Long.valueOf(60), resolved.getRollup().interval());
    }

    public void testNonPositiveIntervalIsLeftForValidation() {
        SeriesQuery resolved = layer.transformQuery(query(START, START + 3600).interval(0).build());
        assertEquals(Long.valueOf(0), resolved.getRollup().interval());
    }

    public void testTotalsFlagIsPreserved() {
        SeriesQuery resolved = layer.transformQuery(query(START, START + 3600).totals(true).build());
        assertTrue(resolved.getRollup().totals());
    }

    public void testAlignmentProperties() {
        for (int i = 0; i < 200; i++) {
            long start = randomLongBetween(-10_000_000L, 2_000_000_000L);
            long end = start + randomLongBetween(1, 40L * 86400);
            SeriesQueryBuilder builder = query(start, end);
            if (randomBoolean()) {
                builder.interval(randomLongBetween(1, 100_000));
            }

            SeriesQuery resolved = layer.transformQuery(builder.build());
            long interval = resolved.getRollup().interval();
            long alignedStart = resolved.getRange().startSeconds();
            long alignedEnd = resolved.getRange().endSeconds();

            assertTrue("interval must be positive", interval > 0);
            assertEquals("interval must be a multiple of the base granularity", 0, interval % 60);
            assertEquals("start must be aligned", 0, Math.floorMod(alignedStart, interval));
            assertEquals("end must be aligned", 0, Math.floorMod(alignedEnd, interval));
            assertTrue("start must not move forward", alignedStart <= start);
            assertTrue("end must not move backward", alignedEnd >= end);
            assertTrue("start must move by less than one interval", start - alignedStart < interval);
            assertTrue("end must move by less than one interval", alignedEnd - end < interval);
        }
    }

    public void testInferredIntervalIsSmallestWithinBound() {
        List<Long> granularities = List.of(10L, 60L, 3600L, 86400L);
        for (int i = 0; i < 200; i++) {
            long window = randomLongBetween(1, 400L * 86400);
            long interval = TimeframeLayer.inferInterval(window, granularities, 360);

            assertTrue(granularities.contains(interval));
            if (interval != 86400L) {
                assertTrue(window <= 360 * interval);
            }
            for (long smaller : granularities) {
                if (smaller < interval) {
                    assertTrue(window > 360 * smaller);
                }
            }
        }
    }

    public void testFractionalEndIsCoveredByAlignedRange() {
        Instant start = Instant.ofEpochSecond(START, 250_000_000);
        Instant end = Instant.ofEpochSecond(START + 7200, 500_000_000);
        SeriesQuery query = new SeriesQueryBuilder().scope(1, Set.of(1L))
            .range(start, end)
            .interval(3600)
            .expr(Function.of(AggregationFn.AVG, new MetricName("d:transactions/duration@millisecond")))
            .build();

        SeriesQuery resolved = layer.transformQuery(query);

        assertEquals(START, resolved.getRange().startSeconds());
        assertEquals(START + 3 * 3600, resolved.getRange().endSeconds());
        assertFalse(resolved.getRange().start().isAfter(start));
        assertFalse(resolved.getRange().end().isBefore(end));
    }

    public void testSubSecondRangeIsAlignedToOneBucket() {
        SeriesQuery query = new SeriesQueryBuilder().scope(1, Set.of(1L))
            .range(Instant.ofEpochSecond(START + 10, 100_000_000), Instant.ofEpochSecond(START + 10, 900_000_000))
            .interval(60)
            .expr(Function.of(AggregationFn.AVG, new MetricName("d:transactions/duration@millisecond")))
            .build();

        SeriesQuery resolved = layer.transformQuery(query);

        assertEquals(START, resolved.getRange().startSeconds());
        assertEquals(START + 60, resolved.getRange().endSeconds());
    }

    private static SeriesQueryBuilder query(long start, long end) {
        return new SeriesQueryBuilder().scope(1, Set.of(1L))
            .range(Instant.ofEpochSecond(start), Instant.ofEpochSecond(end))
            .expr(Function.of(AggregationFn.AVG, new MetricName("d:transactions/duration@millisecond")));
    }
}
