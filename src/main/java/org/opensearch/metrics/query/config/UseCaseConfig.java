/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.config;

import org.opensearch.metrics.query.common.InvalidMetricsQueryException;
import org.opensearch.metrics.query.model.MetricType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Physical storage configuration of one use case.
 *
 * @param useCase the use case name, the namespace of its MRIs
 * @param dataset the dataset holding its rows
 * @param entities the entity storing each metric type
 * @param granularities supported bucket widths in seconds, sorted ascending
 * @param indexedTags whether tag keys and values are stored integer-coded
 */
public record UseCaseConfig(String useCase, String dataset, Map<MetricType, String> entities, List<Long> granularities, boolean indexedTags) {

    /**
     * Validates and copies the configuration.
     */
    public UseCaseConfig {
        if (granularities == null || granularities.isEmpty()) {
            throw new IllegalArgumentException("Use case [" + useCase + "] requires at least one granularity");
        }
        List<Long> sorted = new ArrayList<>(granularities);
        Collections.sort(sorted);
        if (sorted.get(0) <= 0) {
            throw new IllegalArgumentException("Use case [" + useCase + "] granularities must be positive, got " + granularities);
        }
        granularities = List.copyOf(sorted);
        Map<MetricType, String> copy = new EnumMap<>(MetricType.class);
        copy.putAll(entities);
        entities = Collections.unmodifiableMap(copy);
    }

    /**
     * Get the smallest supported granularity; every resolved interval is a multiple of it.
     * @return the base granularity in seconds
     */
    public long baseGranularity() {
        return granularities.get(0);
    }

    /**
     * Get the entity storing metrics of the given type.
     * @param type the metric type
     * @return the entity name
     * @throws InvalidMetricsQueryException if the use case does not store metrics of this type
     */
    public String entityFor(MetricType type) {
        String entity = entities.get(type);
        if (entity == null) {
            throw InvalidMetricsQueryException.of("use case [%s] does not store metrics of type %s", useCase, type);
        }
        return entity;
    }

    /**
     * Get the largest supported granularity that evenly divides the interval.
     * @param interval the resolved interval in seconds
     * @return the granularity to read
     * @throws InvalidMetricsQueryException if no granularity divides the interval
     */
    public long granularityFor(long interval) {
        for (int i = granularities.size() - 1; i >= 0; i--) {
            long granularity = granularities.get(i);
            if (interval % granularity == 0) {
                return granularity;
            }
        }
        throw InvalidMetricsQueryException.of("interval %ds is not a multiple of any granularity of use case [%s]", interval, useCase);
    }
}
