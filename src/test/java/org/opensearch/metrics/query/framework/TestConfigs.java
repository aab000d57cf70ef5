/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.framework;

import org.opensearch.metrics.query.config.QueryConfigLookup;
import org.opensearch.metrics.query.config.UseCaseConfig;
import org.opensearch.metrics.query.model.MetricType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Use case configurations shared by tests.
 */
public final class TestConfigs {

    public static final String USE_CASE = "transactions";
    public static final String DATASET = "generic_metrics";

    private TestConfigs() {
        // Prevent instantiation
    }

    public static UseCaseConfig useCase(String name, List<Long> granularities, boolean indexedTags) {
        Map<MetricType, String> entities = new EnumMap<>(MetricType.class);
        entities.put(MetricType.COUNTER, "generic_metrics_counters");
        entities.put(MetricType.DISTRIBUTION, "generic_metrics_distributions");
        entities.put(MetricType.SET, "generic_metrics_sets");
        return new UseCaseConfig(name, DATASET, entities, granularities, indexedTags);
    }

    public static UseCaseConfig transactions(boolean indexedTags) {
        return useCase(USE_CASE, List.of(60L, 3600L, 86400L), indexedTags);
    }

    public static QueryConfigLookup lookup(UseCaseConfig... configs) {
        return useCase -> {
            for (UseCaseConfig config : configs) {
                if (config.useCase().equals(useCase)) {
                    return Optional.of(config);
                }
            }
            return Optional.empty();
        };
    }
}
