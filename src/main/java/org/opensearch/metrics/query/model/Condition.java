/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.model;

import java.util.Objects;

/**
 * Comparison of a tag against a value.
 *
 * @param lhs the compared expression, a {@link Tag} in any valid query
 * @param op the comparison operator
 * @param rhs the operand, a {@link Literal} or a bound {@link Variable} in any valid query
 */
public record Condition(Expression lhs, ConditionFn op, Expression rhs) {

    /**
     * Validates that all components are present.
     */
    public Condition {
        Objects.requireNonNull(lhs, "condition lhs cannot be null");
        Objects.requireNonNull(op, "condition operator cannot be null");
        Objects.requireNonNull(rhs, "condition rhs cannot be null");
    }

    /**
     * Shorthand for a tag equality.
     * @param tag the tag key
     * @param value the expected value
     * @return the condition
     */
    public static Condition eq(String tag, String value) {
        return new Condition(new Tag(tag), ConditionFn.EQUALS, Literal.of(value));
    }

    /**
     * Create a copy with different operands.
     * @param newLhs the new left hand side
     * @param newRhs the new right hand side
     * @return the new condition
     */
    public Condition withOperands(Expression newLhs, Expression newRhs) {
        return new Condition(newLhs, op, newRhs);
    }

    /**
     * Get a human-readable representation of this condition.
     * @return the explain name
     */
    public String getExplainName() {
        return lhs.getExplainName() + " " + op.getName() + " " + rhs.getExplainName();
    }

    @Override
    public String toString() {
        return getExplainName();
    }
}
