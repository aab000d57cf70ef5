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
import org.opensearch.metrics.query.common.Constants;
import org.opensearch.metrics.query.config.UseCaseConfig;
import org.opensearch.metrics.query.model.GroupKey;
import org.opensearch.metrics.query.model.SeriesQuery;
import org.opensearch.metrics.query.model.SeriesResult;
import org.opensearch.metrics.query.model.Tag;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Assembles the rows returned for a {@link TranslatedQuery} into a {@link SeriesResult}.
 *
 * <p>The intervals of the result are all bucket starts of the query range, so buckets without a row
 * show up as missing values when a series is iterated. Null and non-finite values are dropped.
 * Integer-coded tag values are translated back to strings.
 */
public class ResultConverter {
    private static final Logger logger = LogManager.getLogger(ResultConverter.class);

    private final TagIndexer indexer;

    /**
     * Constructor for ResultConverter.
     * @param indexer string indexer used to decode integer-coded tag values
     */
    public ResultConverter(TagIndexer indexer) {
        this.indexer = indexer;
    }

    /**
     * Convert physical rows.
     * @param query the logical query the rows answer
     * @param translated its physical form
     * @param seriesRows rows of the bucketed query
     * @param totalsRows rows of the totals query, ignored if totals were not requested
     * @return the result
     */
    public SeriesResult convert(
        SeriesQuery query,
        TranslatedQuery translated,
        List<Map<String, Object>> seriesRows,
        List<Map<String, Object>> totalsRows
    ) {
        SeriesResult.Builder builder = new SeriesResult.Builder();
        long interval = query.getRollup().interval();
        if (interval <= 0) {
            throw new IllegalStateException("Cannot convert rows of a query with interval " + interval);
        }
        for (long bucket = query.getRange().startSeconds(); bucket < query.getRange().endSeconds(); bucket += interval) {
            builder.addInterval(bucket);
        }

        int expressions = translated.series().getSelect().size();
        for (Map<String, Object> row : seriesRows) {
            GroupKey group = groupKey(query, translated.config(), row, builder);
            long bucket = timestampOf(row.get(Constants.Columns.BUCKETED_TIME));
            for (int i = 0; i < expressions; i++) {
                Double value = valueOf(row, i);
                if (value != null) {
                    builder.addValue(group, i, bucket, value);
                }
            }
        }

        if (translated.hasTotals() && totalsRows != null) {
            for (Map<String, Object> row : totalsRows) {
                GroupKey group = groupKey(query, translated.config(), row, builder);
                for (int i = 0; i < expressions; i++) {
                    Double value = valueOf(row, i);
                    if (value != null) {
                        builder.addTotal(group, i, value);
                    }
                }
            }
        }
        return builder.build();
    }

    private GroupKey groupKey(SeriesQuery query, UseCaseConfig config, Map<String, Object> row, SeriesResult.Builder builder) {
        if (query.getGroups().isEmpty()) {
            return GroupKey.EMPTY;
        }
        Map<String, String> tags = new TreeMap<>();
        for (Tag group : query.getGroups()) {
            String value = tagValueOf(group.getKey(), row.get(Constants.Columns.TAG_ALIAS_PREFIX + group.getKey()), config);
            tags.put(group.getKey(), value);
            builder.addTag(group.getKey(), value);
        }
        return GroupKey.of(tags);
    }

    private String tagValueOf(String key, Object raw, UseCaseConfig config) {
        if (raw == null) {
            return "";
        }
        if (config.indexedTags() && !Constants.PROJECT_TAG.equals(key) && raw instanceof Number number) {
            long id = number.longValue();
            return indexer.reverseResolve(config.useCase(), id).orElseGet(() -> {
                logger.debug("Unknown code {} for tag [{}] of use case [{}]", id, key, config.useCase());
                return String.valueOf(id);
            });
        }
        return String.valueOf(raw);
    }

    private static long timestampOf(Object raw) {
        if (raw instanceof Number number) {
            return number.longValue();
        }
        throw new IllegalStateException("Row is missing a numeric [" + Constants.Columns.BUCKETED_TIME + "] column, got " + raw);
    }

    private static Double valueOf(Map<String, Object> row, int expression) {
        Object raw = row.get(String.valueOf(expression));
        if (raw == null) {
            return null;
        }
        if (!(raw instanceof Number number)) {
            throw new IllegalStateException("Non-numeric value [" + raw + "] for expression " + expression);
        }
        double value = number.doubleValue();
        if (!Double.isFinite(value)) {
            logger.debug("Dropping non-finite value {} for expression {}", value, expression);
            return null;
        }
        return value;
    }
}
