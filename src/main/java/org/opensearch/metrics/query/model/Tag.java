/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.model;

import org.opensearch.metrics.query.visitor.ExpressionVisitor;

import java.util.Objects;

/**
 * Leaf naming a tag key. Tags appear on the left hand side of conditions and in the group-by list.
 */
public final class Tag extends Expression {
    private final String key;

    /**
     * Create a tag reference.
     * @param key the tag key
     */
    public Tag(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Tag key cannot be empty");
        }
        this.key = key;
    }

    /**
     * Get the tag key.
     * @return the key
     */
    public String getKey() {
        return key;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String getExplainName() {
        return key;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Tag other && key.equals(other.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Tag.class, key);
    }
}
