/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.layer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.metrics.query.common.Constants;
import org.opensearch.metrics.query.config.QueryConfigLookup;
import org.opensearch.metrics.query.config.UseCaseConfig;
import org.opensearch.metrics.query.model.MetricName;
import org.opensearch.metrics.query.model.Mri;
import org.opensearch.metrics.query.model.Rollup;
import org.opensearch.metrics.query.model.SeriesQuery;
import org.opensearch.metrics.query.model.TimeRange;
import org.opensearch.metrics.query.pipeline.QueryLayer;
import org.opensearch.metrics.query.visitor.MetricCollector;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the rollup interval of a query and aligns its time range to it.
 *
 * <p>When no interval is requested, the smallest granularity producing at most {@code maxBuckets}
 * buckets over the query window is used, or the largest granularity if none does. The interval is
 * then rounded to the nearest multiple of the smallest granularity, and the range is widened so
 * that both bounds are multiples of the interval counted from the Unix epoch.
 *
 * <p>Granularities come from the configuration of the query's use case. Queries whose use case
 * cannot be determined use {@link Constants.Time#DEFAULT_GRANULARITIES}. Malformed ranges are left
 * as they are for {@link ValidationLayer} to reject.
 */
public class TimeframeLayer implements QueryLayer {
    private static final Logger logger = LogManager.getLogger(TimeframeLayer.class);

    private final QueryConfigLookup configLookup;
    private final int maxBuckets;

    /**
     * Constructor for TimeframeLayer.
     * @param configLookup use case configuration
     * @param maxBuckets maximum number of buckets of an inferred interval
     */
    public TimeframeLayer(QueryConfigLookup configLookup, int maxBuckets) {
        if (maxBuckets <= 0) {
            throw new IllegalArgumentException("maxBuckets must be positive, got " + maxBuckets);
        }
        this.configLookup = configLookup;
        this.maxBuckets = maxBuckets;
    }

    @Override
    public SeriesQuery transformQuery(SeriesQuery query) {
        List<Long> granularities = granularitiesOf(query);
        TimeRange range = query.getRange();
        Rollup rollup = query.getRollup();

        long interval = rollup.isAuto() ? inferInterval(range.durationSeconds(), granularities, maxBuckets) : rollup.interval();
        if (interval > 0) {
            interval = roundToBase(interval, granularities.get(0));
        }

        TimeRange aligned = range;
        if (interval > 0 && range.isEmpty() == false) {
            aligned = TimeRange.ofEpochSeconds(alignDown(range.startSeconds(), interval), alignUp(range.endSeconds(), interval));
        }
        logger.debug("Resolved interval {}s and range {} for requested rollup {} and range {}", interval, aligned, rollup, range);
        return query.withRange(aligned).withRollup(rollup.withInterval(interval));
    }

    /**
     * Pick the smallest granularity that keeps the bucket count within bounds.
     * @param windowSeconds the query window
     * @param granularities available granularities, ascending
     * @param maxBuckets the bucket bound, inclusive
     * @return the granularity, or the largest one if every granularity exceeds the bound
     */
    static long inferInterval(long windowSeconds, List<Long> granularities, int maxBuckets) {
        for (long granularity : granularities) {
            if (windowSeconds <= (long) maxBuckets * granularity) {
                return granularity;
            }
        }
        return granularities.get(granularities.size() - 1);
    }

    /**
     * Round to the nearest multiple of the base granularity, but never below it.
     * @param interval a positive interval
     * @param base the base granularity
     * @return the rounded interval
     */
    static long roundToBase(long interval, long base) {
        long rounded = (interval + base / 2) / base * base;
        return Math.max(base, rounded);
    }

    static long alignDown(long seconds, long interval) {
        return Math.floorDiv(seconds, interval) * interval;
    }

    static long alignUp(long seconds, long interval) {
        return -Math.floorDiv(-seconds, interval) * interval;
    }

    private List<Long> granularitiesOf(SeriesQuery query) {
        Set<String> useCases = new HashSet<>();
        for (MetricName metric : MetricCollector.collect(query)) {
            Mri.parse(metric.getName()).ifPresent(mri -> useCases.add(mri.useCase()));
        }
        if (useCases.size() == 1) {
            Optional<UseCaseConfig> config = configLookup.find(useCases.iterator().next());
            if (config.isPresent()) {
                return config.get().granularities();
            }
        }
        return Constants.Time.DEFAULT_GRANULARITIES;
    }
}
