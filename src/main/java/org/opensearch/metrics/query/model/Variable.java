/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.model;

import org.opensearch.metrics.query.common.Constants;
import org.opensearch.metrics.query.visitor.ExpressionVisitor;

import java.util.Objects;

/**
 * Leaf standing for a value supplied at execution time. A variable starts unbound and must be bound,
 * see {@link SeriesQuery#bind(java.util.Map)}, before the query can be executed.
 */
public final class Variable extends Expression {
    private final String name;
    private final Literal value;

    /**
     * Create an unbound variable.
     * @param name the variable name, with or without the leading sigil
     */
    public Variable(String name) {
        this(name, null);
    }

    private Variable(String name, Literal value) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Variable name cannot be empty");
        }
        this.name = name.charAt(0) == Constants.VARIABLE_SIGIL ? name.substring(1) : name;
        this.value = value;
    }

    /**
     * Get the variable name without the sigil.
     * @return the name
     */
    public String getName() {
        return name;
    }

    /**
     * Whether a value has been bound to this variable.
     * @return true if bound
     */
    public boolean isBound() {
        return value != null;
    }

    /**
     * Get the bound value.
     * @return the value, or null if the variable is unbound
     */
    public Literal getValue() {
        return value;
    }

    /**
     * Create a copy of this variable bound to the given value.
     * @param value the value to bind
     * @return the bound variable
     */
    public Variable bind(Literal value) {
        return new Variable(name, Objects.requireNonNull(value, "bound value cannot be null"));
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String getExplainName() {
        return Constants.VARIABLE_SIGIL + name + (value == null ? "" : "=" + value.getExplainName());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Variable other && name.equals(other.name) && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Variable.class, name, value);
    }
}
