/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.model;

import org.opensearch.metrics.query.visitor.ExpressionVisitor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Scalar literal: a string, a number, or a list of strings and numbers used as the operand of list comparisons.
 */
public final class Literal extends Expression {
    private final Object value;

    private Literal(Object value) {
        this.value = value;
    }

    /**
     * Create a string literal.
     * @param value the string value
     * @return the literal
     */
    public static Literal of(String value) {
        return new Literal(Objects.requireNonNull(value, "literal value cannot be null"));
    }

    /**
     * Create a numeric literal.
     * @param value the numeric value
     * @return the literal
     */
    public static Literal of(Number value) {
        return new Literal(Objects.requireNonNull(value, "literal value cannot be null"));
    }

    /**
     * Create a list literal.
     * @param values strings and numbers
     * @return the literal
     */
    public static Literal ofList(Collection<?> values) {
        List<Object> items = new ArrayList<>(values.size());
        for (Object item : values) {
            if (!(item instanceof String) && !(item instanceof Number)) {
                throw new IllegalArgumentException("List literals can only contain strings and numbers, found: " + item);
            }
            items.add(item);
        }
        return new Literal(List.copyOf(items));
    }

    /**
     * Create a literal from an arbitrary Java value, as supplied when binding variables.
     * @param value a string, a number or a collection of those
     * @return the literal
     */
    public static Literal from(Object value) {
        if (value instanceof Literal literal) {
            return literal;
        } else if (value instanceof String string) {
            return of(string);
        } else if (value instanceof Number number) {
            return of(number);
        } else if (value instanceof Collection<?> collection) {
            return ofList(collection);
        }
        throw new IllegalArgumentException("Unsupported literal value: " + value);
    }

    /**
     * Get the raw value.
     * @return a String, a Number or an unmodifiable List
     */
    public Object getValue() {
        return value;
    }

    /**
     * Whether this literal is a list of values.
     * @return true for list literals
     */
    public boolean isList() {
        return value instanceof List;
    }

    /**
     * Whether this literal is numeric.
     * @return true for number literals
     */
    public boolean isNumber() {
        return value instanceof Number;
    }

    /**
     * Get the values of a list literal, or a singleton list holding a scalar.
     * @return the values
     */
    @SuppressWarnings("unchecked")
    public List<Object> getValues() {
        return isList() ? (List<Object>) value : List.of(value);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String getExplainName() {
        if (isList()) {
            return getValues().stream().map(Literal::quote).collect(Collectors.joining(", ", "[", "]"));
        }
        return quote(value);
    }

    private static String quote(Object item) {
        return item instanceof String ? "\"" + item + "\"" : String.valueOf(item);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Literal other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Literal.class, value);
    }
}
