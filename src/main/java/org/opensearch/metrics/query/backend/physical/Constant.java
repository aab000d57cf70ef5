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
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A constant: a string, a number or a list of those.
 */
public final class Constant implements PhysicalExpression {
    private final Object value;

    private Constant(Object value) {
        this.value = value;
    }

    /**
     * Create a constant.
     * @param value a string, a number or a list of strings and numbers
     * @return the constant
     */
    public static Constant of(Object value) {
        Objects.requireNonNull(value, "constant value cannot be null");
        if (value instanceof List<?> list) {
            for (Object element : list) {
                checkScalar(element);
            }
            return new Constant(List.copyOf(list));
        }
        checkScalar(value);
        return new Constant(value);
    }

    private static void checkScalar(Object value) {
        if (!(value instanceof String) && !(value instanceof Number)) {
            throw new IllegalArgumentException("Constants must be strings or numbers, got " + value);
        }
    }

    public Object getValue() {
        return value;
    }

    @Override
    public String render() {
        if (value instanceof List<?> list) {
            return list.stream().map(Constant::renderScalar).collect(Collectors.joining(", ", "[", "]"));
        }
        return renderScalar(value);
    }

    private static String renderScalar(Object value) {
        return value instanceof String s ? "'" + s.replace("'", "\\'") + "'" : String.valueOf(value);
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.field("constant", value);
        return builder.endObject();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Constant other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return render();
    }
}
