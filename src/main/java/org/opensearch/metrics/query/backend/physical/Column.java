/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.backend.physical;

import org.opensearch.core.xcontent.XContentBuilder;

import java.io.IOException;
import java.util.Objects;

/**
 * Reference to a stored column, optionally subscripted, e.g. {@code tags[42]} or {@code tags_raw[env]}.
 */
public final class Column implements PhysicalExpression {
    private final String name;
    private final String key;

    private Column(String name, String key) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.key = key;
    }

    public static Column of(String name) {
        return new Column(name, null);
    }

    /**
     * Reference to one key of a map column.
     * @param name the map column
     * @param key the key
     * @return the column
     */
    public static Column subscript(String name, String key) {
        return new Column(name, Objects.requireNonNull(key, "key cannot be null"));
    }

    public String getName() {
        return name;
    }

    public String getKey() {
        return key;
    }

    @Override
    public String render() {
        return key == null ? name : name + "[" + key + "]";
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.field("column", name);
        if (key != null) {
            builder.field("key", key);
        }
        return builder.endObject();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Column other && name.equals(other.name) && Objects.equals(key, other.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, key);
    }

    @Override
    public String toString() {
        return render();
    }
}
