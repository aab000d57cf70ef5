/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.model;

import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Identifies one grouped series: the set of {@code (tag key, tag value)} pairs of the group-by tags.
 * Ungrouped queries produce a single series under {@link #EMPTY}.
 */
public final class GroupKey implements Comparable<GroupKey> {

    /**
     * Key of the only series of an ungrouped query.
     */
    public static final GroupKey EMPTY = new GroupKey(new TreeMap<>());

    private final SortedMap<String, String> tags;

    private GroupKey(SortedMap<String, String> tags) {
        this.tags = Collections.unmodifiableSortedMap(tags);
    }

    /**
     * Create a group key.
     * @param tags tag key to tag value
     * @return the group key
     */
    public static GroupKey of(Map<String, String> tags) {
        return tags.isEmpty() ? EMPTY : new GroupKey(new TreeMap<>(tags));
    }

    /**
     * Create a group key from alternating keys and values.
     * @param keyValues key1, value1, key2, value2, ...
     * @return the group key
     */
    public static GroupKey of(String... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Group key requires key/value pairs");
        }
        SortedMap<String, String> tags = new TreeMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            tags.put(keyValues[i], keyValues[i + 1]);
        }
        return of(tags);
    }

    /**
     * Get the tags identifying this group, sorted by key.
     * @return an unmodifiable view of the tags
     */
    public SortedMap<String, String> getTags() {
        return tags;
    }

    /**
     * Orders keys by their sorted entries, key first then value; a key that is a prefix of another
     * sorts first.
     */
    @Override
    public int compareTo(GroupKey other) {
        Iterator<Map.Entry<String, String>> left = tags.entrySet().iterator();
        Iterator<Map.Entry<String, String>> right = other.tags.entrySet().iterator();
        while (left.hasNext() && right.hasNext()) {
            Map.Entry<String, String> l = left.next();
            Map.Entry<String, String> r = right.next();
            int cmp = l.getKey().compareTo(r.getKey());
            if (cmp == 0) {
                cmp = l.getValue().compareTo(r.getValue());
            }
            if (cmp != 0) {
                return cmp;
            }
        }
        return Boolean.compare(left.hasNext(), right.hasNext());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof GroupKey other && tags.equals(other.tags);
    }

    @Override
    public int hashCode() {
        return tags.hashCode();
    }

    @Override
    public String toString() {
        return tags.toString();
    }
}
