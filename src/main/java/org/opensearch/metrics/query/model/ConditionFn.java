/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.model;

import java.util.Locale;

/**
 * Comparison operators available in a {@link Condition}. The operator determines whether the right hand side
 * must be a single scalar or a list of scalars.
 */
public enum ConditionFn {
    /**
     * Tag equals a value.
     */
    EQUALS("equals", false),

    /**
     * Tag does not equal a value.
     */
    NOT_EQUALS("notEquals", false),

    /**
     * Tag matches a pattern.
     */
    LIKE("like", false),

    /**
     * Tag does not match a pattern.
     */
    NOT_LIKE("notLike", false),

    /**
     * Tag is one of the listed values.
     */
    IN("in", true),

    /**
     * Tag is none of the listed values.
     */
    NOT_IN("notIn", true);

    private final String name;
    private final boolean listOperand;

    ConditionFn(String name, boolean listOperand) {
        this.name = name;
        this.listOperand = listOperand;
    }

    /**
     * Get the public name of the operator.
     * @return the operator name
     */
    public String getName() {
        return name;
    }

    /**
     * Whether this operator compares against a list of values rather than a single scalar.
     * @return true for {@link #IN} and {@link #NOT_IN}
     */
    public boolean takesList() {
        return listOperand;
    }

    @Override
    public String toString() {
        return name;
    }

    /**
     * Converts a string representation of an operator to the corresponding enum value.
     * @param name The operator name, case-insensitive.
     * @return The corresponding ConditionFn.
     * @throws IllegalArgumentException if the input string does not match any known operator.
     */
    public static ConditionFn fromString(String name) {
        for (ConditionFn fn : values()) {
            if (fn.name.equalsIgnoreCase(name) || fn.name().equals(name.toUpperCase(Locale.ROOT))) {
                return fn;
            }
        }
        throw new IllegalArgumentException("Invalid condition operator: " + name);
    }
}
