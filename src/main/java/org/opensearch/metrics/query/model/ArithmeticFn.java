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
 * Binary arithmetic between two vectors.
 */
public enum ArithmeticFn implements FunctionName {
    /**
     * Addition.
     */
    PLUS("plus"),

    /**
     * Subtraction.
     */
    MINUS("minus"),

    /**
     * Multiplication.
     */
    MULTIPLY("multiply"),

    /**
     * Division.
     */
    DIVIDE("divide");

    private final String name;

    ArithmeticFn(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }

    /**
     * Converts a string representation of an arithmetic function to the corresponding enum value.
     * @param name The string representation of the function.
     * @return The corresponding ArithmeticFn enum value.
     * @throws IllegalArgumentException if the input string does not match any known function.
     */
    public static ArithmeticFn fromString(String name) {
        String normalized = name.toLowerCase(Locale.ROOT);
        for (ArithmeticFn fn : values()) {
            if (fn.name.equals(normalized)) {
                return fn;
            }
        }
        throw new IllegalArgumentException("Invalid arithmetic function: " + name);
    }
}
