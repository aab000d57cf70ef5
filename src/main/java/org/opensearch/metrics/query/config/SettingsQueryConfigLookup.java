/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.common.settings.Settings;
import org.opensearch.metrics.query.model.MetricType;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * {@link QueryConfigLookup} backed by node settings. A use case exists when any
 * {@code metrics.query.use_case.<name>.*} setting is present; unset values fall back to their defaults.
 * <pre>
 * metrics.query.use_case.transactions.dataset: generic_metrics
 * metrics.query.use_case.transactions.granularities: [60, 3600, 86400]
 * metrics.query.use_case.transactions.indexed_tags: false
 * </pre>
 */
public class SettingsQueryConfigLookup implements QueryConfigLookup {
    private static final Logger logger = LogManager.getLogger(SettingsQueryConfigLookup.class);

    private final Map<String, UseCaseConfig> configs;

    /**
     * Read all configured use cases.
     * @param settings the node settings
     */
    public SettingsQueryConfigLookup(Settings settings) {
        Set<String> useCases = new TreeSet<>();
        useCases.addAll(MetricsQuerySettings.USE_CASE_DATASET.getNamespaces(settings));
        useCases.addAll(MetricsQuerySettings.USE_CASE_GRANULARITIES.getNamespaces(settings));
        useCases.addAll(MetricsQuerySettings.USE_CASE_INDEXED_TAGS.getNamespaces(settings));
        useCases.addAll(MetricsQuerySettings.USE_CASE_COUNTER_ENTITY.getNamespaces(settings));
        useCases.addAll(MetricsQuerySettings.USE_CASE_DISTRIBUTION_ENTITY.getNamespaces(settings));
        useCases.addAll(MetricsQuerySettings.USE_CASE_SET_ENTITY.getNamespaces(settings));

        Map<String, UseCaseConfig> result = new HashMap<>();
        for (String useCase : useCases) {
            result.put(useCase, readUseCase(settings, useCase));
        }
        this.configs = Map.copyOf(result);
        logger.info("Loaded query configuration for use cases {}", useCases);
    }

    private static UseCaseConfig readUseCase(Settings settings, String useCase) {
        Map<MetricType, String> entities = new EnumMap<>(MetricType.class);
        entities.put(MetricType.COUNTER, MetricsQuerySettings.USE_CASE_COUNTER_ENTITY.getConcreteSettingForNamespace(useCase).get(settings));
        entities.put(
            MetricType.DISTRIBUTION,
            MetricsQuerySettings.USE_CASE_DISTRIBUTION_ENTITY.getConcreteSettingForNamespace(useCase).get(settings)
        );
        entities.put(MetricType.SET, MetricsQuerySettings.USE_CASE_SET_ENTITY.getConcreteSettingForNamespace(useCase).get(settings));

        return new UseCaseConfig(
            useCase,
            MetricsQuerySettings.USE_CASE_DATASET.getConcreteSettingForNamespace(useCase).get(settings),
            entities,
            MetricsQuerySettings.USE_CASE_GRANULARITIES.getConcreteSettingForNamespace(useCase).get(settings),
            MetricsQuerySettings.USE_CASE_INDEXED_TAGS.getConcreteSettingForNamespace(useCase).get(settings)
        );
    }

    @Override
    public Optional<UseCaseConfig> find(String useCase) {
        return Optional.ofNullable(configs.get(useCase));
    }
}
