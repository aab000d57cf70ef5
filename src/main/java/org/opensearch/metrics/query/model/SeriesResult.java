/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Result of a query execution.
 *
 * <ul>
 *   <li>{@code tags}: every value observed per tag key, for enumeration by callers</li>
 *   <li>{@code intervals}: sorted, deduplicated bucket start times (epoch seconds) covering the returned data</li>
 *   <li>{@code groups}: group key to expression index to bucket timestamp to value</li>
 *   <li>{@code totals}: group key to expression index to value over the whole range, when requested</li>
 * </ul>
 *
 * Missing {@code (group, expression, bucket)} combinations are absent rather than zero. Instances are immutable,
 * use {@link Builder} to assemble one.
 */
public final class SeriesResult {
    private static final SeriesResult EMPTY = new Builder().build();

    private final Map<String, SortedSet<String>> tags;
    private final List<Long> intervals;
    private final Map<GroupKey, Map<Integer, SortedMap<Long, Double>>> groups;
    private final Map<GroupKey, Map<Integer, Double>> totals;

    private SeriesResult(
        Map<String, SortedSet<String>> tags,
        List<Long> intervals,
        Map<GroupKey, Map<Integer, SortedMap<Long, Double>>> groups,
        Map<GroupKey, Map<Integer, Double>> totals
    ) {
        this.tags = tags;
        this.intervals = intervals;
        this.groups = groups;
        this.totals = totals;
    }

    /**
     * A result without any data.
     * @return the empty result
     */
    public static SeriesResult empty() {
        return EMPTY;
    }

    public Map<String, SortedSet<String>> getTags() {
        return tags;
    }

    public List<Long> getIntervals() {
        return intervals;
    }

    public Map<GroupKey, Map<Integer, SortedMap<Long, Double>>> getGroups() {
        return groups;
    }

    public Map<GroupKey, Map<Integer, Double>> getTotals() {
        return totals;
    }

    /**
     * Get the value of one bucket.
     * @param group the group key
     * @param expression the expression index
     * @param bucket the bucket start in epoch seconds
     * @return the value, or null if absent
     */
    public Double getValue(GroupKey group, int expression, long bucket) {
        Map<Integer, SortedMap<Long, Double>> byExpression = groups.get(group);
        if (byExpression == null) {
            return null;
        }
        SortedMap<Long, Double> values = byExpression.get(expression);
        return values == null ? null : values.get(bucket);
    }

    /**
     * Materialize one series over all {@link #getIntervals() intervals}, in ascending time order. Buckets
     * without a value for this group and expression yield a {@link Bucket} with a null value.
     *
     * @param group the group key
     * @param expression the expression index
     * @return one bucket per interval
     */
    public List<Bucket> series(GroupKey group, int expression) {
        List<Bucket> buckets = new ArrayList<>(intervals.size());
        for (long timestamp : intervals) {
            buckets.add(new Bucket(timestamp, getValue(group, expression, timestamp)));
        }
        return buckets;
    }

    /**
     * Materialize every {@code (group, expression)} series present in this result, ordered by group key and then
     * by expression index.
     *
     * @return the series
     */
    public List<Series> iterateSeries() {
        List<Series> result = new ArrayList<>();
        List<GroupKey> keys = new ArrayList<>(groups.keySet());
        Collections.sort(keys);
        for (GroupKey key : keys) {
            for (Integer expression : new TreeSet<>(groups.get(key).keySet())) {
                result.add(new Series(key, expression, series(key, expression)));
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof SeriesResult other)) {
            return false;
        }
        return tags.equals(other.tags) && intervals.equals(other.intervals) && groups.equals(other.groups) && totals.equals(other.totals);
    }

    @Override
    public int hashCode() {
        return groups.hashCode() * 31 + intervals.hashCode();
    }

    @Override
    public String toString() {
        return "SeriesResult{intervals=" + intervals + ", groups=" + groups + ", totals=" + totals + ", tags=" + tags + "}";
    }

    /**
     * Value of one bucket of a series.
     *
     * @param timestamp bucket start in epoch seconds
     * @param value the value, or null if absent
     */
    public record Bucket(long timestamp, Double value) {
    }

    /**
     * One materialized series.
     *
     * @param group the group key
     * @param expression the expression index
     * @param buckets one bucket per result interval
     */
    public record Series(GroupKey group, int expression, List<Bucket> buckets) {
    }

    /**
     * Accumulates values, tags and intervals into a {@link SeriesResult}. Not thread-safe.
     */
    public static class Builder {
        private final Map<String, SortedSet<String>> tags = new TreeMap<>();
        private final SortedSet<Long> intervals = new TreeSet<>();
        private final Map<GroupKey, Map<Integer, SortedMap<Long, Double>>> groups = new LinkedHashMap<>();
        private final Map<GroupKey, Map<Integer, Double>> totals = new LinkedHashMap<>();

        /**
         * Create an empty builder.
         */
        public Builder() {}

        /**
         * Record that a tag value was observed.
         * @param key the tag key
         * @param value the observed value
         * @return this builder
         */
        public Builder addTag(String key, String value) {
            tags.computeIfAbsent(key, k -> new TreeSet<>()).add(value);
            return this;
        }

        /**
         * Record a bucket start time.
         * @param timestamp bucket start in epoch seconds
         * @return this builder
         */
        public Builder addInterval(long timestamp) {
            intervals.add(timestamp);
            return this;
        }

        /**
         * Record the value of one bucket, and its bucket start time.
         * @param group the group key
         * @param expression the expression index
         * @param timestamp the bucket start in epoch seconds
         * @param value the value
         * @return this builder
         */
        public Builder addValue(GroupKey group, int expression, long timestamp, double value) {
            groups.computeIfAbsent(group, g -> new LinkedHashMap<>()).computeIfAbsent(expression, e -> new TreeMap<>()).put(timestamp, value);
            intervals.add(timestamp);
            return this;
        }

        /**
         * Record the total of one series.
         * @param group the group key
         * @param expression the expression index
         * @param value the total
         * @return this builder
         */
        public Builder addTotal(GroupKey group, int expression, double value) {
            totals.computeIfAbsent(group, g -> new LinkedHashMap<>()).put(expression, value);
            return this;
        }

        /**
         * Copy everything from another result into this builder, remapping expression indexes.
         * Values already present for the same {@code (group, expression, bucket)} are overwritten.
         *
         * @param other the result to copy
         * @param expressionIndexes maps each expression index of {@code other} to the index in the built result
         * @return this builder
         */
        public Builder addAll(SeriesResult other, List<Integer> expressionIndexes) {
            other.tags.forEach((key, values) -> values.forEach(value -> addTag(key, value)));
            intervals.addAll(other.intervals);
            other.groups.forEach(
                (group, byExpression) -> byExpression.forEach(
                    (expression, values) -> values.forEach(
                        (timestamp, value) -> addValue(group, expressionIndexes.get(expression), timestamp, value)
                    )
                )
            );
            other.totals.forEach(
                (group, byExpression) -> byExpression.forEach(
                    (expression, value) -> addTotal(group, expressionIndexes.get(expression), value)
                )
            );
            return this;
        }

        /**
         * Build the immutable result.
         * @return the result
         */
        public SeriesResult build() {
            Map<String, SortedSet<String>> frozenTags = new TreeMap<>();
            tags.forEach((key, values) -> frozenTags.put(key, Collections.unmodifiableSortedSet(new TreeSet<>(values))));

            Map<GroupKey, Map<Integer, SortedMap<Long, Double>>> frozenGroups = new LinkedHashMap<>();
            groups.forEach((group, byExpression) -> {
                Map<Integer, SortedMap<Long, Double>> frozen = new TreeMap<>();
                byExpression.forEach((expression, values) -> frozen.put(expression, Collections.unmodifiableSortedMap(new TreeMap<>(values))));
                frozenGroups.put(group, Collections.unmodifiableMap(frozen));
            });

            Map<GroupKey, Map<Integer, Double>> frozenTotals = new LinkedHashMap<>();
            totals.forEach((group, byExpression) -> frozenTotals.put(group, Collections.unmodifiableMap(new TreeMap<>(byExpression))));

            return new SeriesResult(
                Collections.unmodifiableMap(frozenTags),
                List.copyOf(intervals),
                Collections.unmodifiableMap(frozenGroups),
                Collections.unmodifiableMap(frozenTotals)
            );
        }
    }
}
