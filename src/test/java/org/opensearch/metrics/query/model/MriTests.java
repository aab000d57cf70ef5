/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.model;

import org.opensearch.metrics.query.common.InvalidMetricsQueryException;
import org.opensearch.test.OpenSearchTestCase;

import java.util.Optional;

public class MriTests extends OpenSearchTestCase {

    public void testParseDistribution() {
        Optional<Mri> mri = Mri.parse("d:transactions/duration@millisecond");

        assertTrue(mri.isPresent());
        assertEquals(MetricType.DISTRIBUTION, mri.get().type());
        assertEquals("transactions", mri.get().namespace());
        assertEquals("transactions", mri.get().useCase());
        assertEquals("duration", mri.get().name());
        assertEquals("millisecond", mri.get().unit());
    }

    public void testToStringRendersIdentifier() {
        String value = "c:custom/page.load_count@none";
        assertEquals(value, Mri.parseOrThrow(value).toString());
    }

    public void testNamesThatAreNotMris() {
        assertFalse(Mri.parse("transaction.duration").isPresent());
        assertFalse(Mri.parse("d:transactions/duration").isPresent());
        assertFalse(Mri.parse("x:transactions/duration@ms").isPresent());
        assertFalse(Mri.parse(null).isPresent());
    }

    public void testParseOrThrowRejectsPlainName() {
        InvalidMetricsQueryException e = expectThrows(InvalidMetricsQueryException.class, () -> Mri.parseOrThrow("transaction.duration"));
        assertTrue(e.getMessage().contains("transaction.duration"));
    }

    public void testAllowedAggregationsByType() {
        assertTrue(MetricType.COUNTER.getAllowedAggregations().contains(AggregationFn.SUM));
        assertFalse(MetricType.COUNTER.getAllowedAggregations().contains(AggregationFn.COUNT_UNIQUE));
        assertTrue(MetricType.SET.getAllowedAggregations().contains(AggregationFn.COUNT_UNIQUE));
        assertTrue(MetricType.DISTRIBUTION.getAllowedAggregations().contains(AggregationFn.P95));
        assertTrue(MetricType.DERIVED.getAllowedAggregations().isEmpty());
        assertFalse(MetricType.DERIVED.isStored());
    }
}
