/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.config;

import org.opensearch.common.settings.Setting;
import org.opensearch.common.unit.TimeValue;
import org.opensearch.metrics.query.common.Constants;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Settings of the metrics query engine.
 */
public final class MetricsQuerySettings {

    private MetricsQuerySettings() {
        // Prevent instantiation
    }

    private static final String PREFIX = "metrics.query.";
    private static final String USE_CASE_PREFIX = PREFIX + "use_case.";

    /**
     * Upper bound on the number of buckets produced when the interval of a query is inferred.
     */
    public static final Setting<Integer> MAX_BUCKETS = Setting.intSetting(
        PREFIX + "max_buckets",
        Constants.Time.DEFAULT_MAX_BUCKETS,
        1,
        Setting.Property.NodeScope
    );

    /**
     * Maximum nesting of derived metric definitions. Expansion deeper than this fails the query.
     */
    public static final Setting<Integer> EXPANSION_MAX_DEPTH = Setting.intSetting(
        PREFIX + "expansion.max_depth",
        10,
        1,
        Setting.Property.NodeScope
    );

    /**
     * Whether public metric names are translated to MRIs before expansion.
     */
    public static final Setting<Boolean> NAMING_ENABLED = Setting.boolSetting(PREFIX + "naming.enabled", false, Setting.Property.NodeScope);

    /**
     * Whether physical query results are cached in memory.
     */
    public static final Setting<Boolean> CACHE_ENABLED = Setting.boolSetting(PREFIX + "cache.enabled", false, Setting.Property.NodeScope);

    /**
     * Maximum number of cached physical query results.
     */
    public static final Setting<Integer> CACHE_SIZE = Setting.intSetting(PREFIX + "cache.size", 1000, 1, Setting.Property.NodeScope);

    /**
     * Lifetime of a cached physical query result.
     */
    public static final Setting<TimeValue> CACHE_EXPIRE_AFTER_WRITE = Setting.positiveTimeSetting(
        PREFIX + "cache.expire_after_write",
        TimeValue.timeValueMinutes(1),
        Setting.Property.NodeScope
    );

    /**
     * Dataset holding the rows of a use case, e.g. {@code metrics.query.use_case.transactions.dataset}.
     */
    public static final Setting.AffixSetting<String> USE_CASE_DATASET = Setting.affixKeySetting(
        USE_CASE_PREFIX,
        "dataset",
        key -> Setting.simpleString(key, "generic_metrics", Setting.Property.NodeScope)
    );

    /**
     * Supported granularities of a use case in seconds.
     */
    public static final Setting.AffixSetting<List<Long>> USE_CASE_GRANULARITIES = Setting.affixKeySetting(
        USE_CASE_PREFIX,
        "granularities",
        key -> Setting.listSetting(
            key,
            Constants.Time.DEFAULT_GRANULARITIES.stream().map(String::valueOf).collect(Collectors.toList()),
            Long::parseLong,
            Setting.Property.NodeScope
        )
    );

    /**
     * Whether a use case stores integer-coded tags rather than raw strings.
     */
    public static final Setting.AffixSetting<Boolean> USE_CASE_INDEXED_TAGS = Setting.affixKeySetting(
        USE_CASE_PREFIX,
        "indexed_tags",
        key -> Setting.boolSetting(key, true, Setting.Property.NodeScope)
    );

    /**
     * Entity storing counters of a use case.
     */
    public static final Setting.AffixSetting<String> USE_CASE_COUNTER_ENTITY = Setting.affixKeySetting(
        USE_CASE_PREFIX,
        "entity.counter",
        key -> Setting.simpleString(key, "generic_metrics_counters", Setting.Property.NodeScope)
    );

    /**
     * Entity storing distributions of a use case.
     */
    public static final Setting.AffixSetting<String> USE_CASE_DISTRIBUTION_ENTITY = Setting.affixKeySetting(
        USE_CASE_PREFIX,
        "entity.distribution",
        key -> Setting.simpleString(key, "generic_metrics_distributions", Setting.Property.NodeScope)
    );

    /**
     * Entity storing sets of a use case.
     */
    public static final Setting.AffixSetting<String> USE_CASE_SET_ENTITY = Setting.affixKeySetting(
        USE_CASE_PREFIX,
        "entity.set",
        key -> Setting.simpleString(key, "generic_metrics_sets", Setting.Property.NodeScope)
    );

    /**
     * All settings of the query engine, for registration with a settings module.
     * @return the settings
     */
    public static List<Setting<?>> getSettings() {
        return List.of(
            MAX_BUCKETS,
            EXPANSION_MAX_DEPTH,
            NAMING_ENABLED,
            CACHE_ENABLED,
            CACHE_SIZE,
            CACHE_EXPIRE_AFTER_WRITE,
            USE_CASE_DATASET,
            USE_CASE_GRANULARITIES,
            USE_CASE_INDEXED_TAGS,
            USE_CASE_COUNTER_ENTITY,
            USE_CASE_DISTRIBUTION_ENTITY,
            USE_CASE_SET_ENTITY
        );
    }
}
