/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.model;

import org.opensearch.metrics.query.visitor.ExpressionVisitor;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Application of an aggregation or arithmetic function to an ordered list of parameters.
 */
public final class Function extends Expression {
    private final FunctionName function;
    private final List<Expression> parameters;

    /**
     * Create a function call.
     * @param function the function to apply
     * @param parameters the ordered parameters
     */
    public Function(FunctionName function, List<Expression> parameters) {
        this.function = Objects.requireNonNull(function, "function cannot be null");
        this.parameters = List.copyOf(parameters);
    }

    /**
     * Convenience factory for a function call.
     * @param function the function to apply
     * @param parameters the ordered parameters
     * @return the function node
     */
    public static Function of(FunctionName function, Expression... parameters) {
        return new Function(function, Arrays.asList(parameters));
    }

    /**
     * Get the applied function.
     * @return the function name
     */
    public FunctionName getFunction() {
        return function;
    }

    /**
     * Get the parameters.
     * @return an unmodifiable list of parameters
     */
    public List<Expression> getParameters() {
        return parameters;
    }

    /**
     * Whether this call applies an aggregation.
     * @return true if the function is an {@link AggregationFn}
     */
    public boolean isAggregation() {
        return function instanceof AggregationFn;
    }

    /**
     * Whether this call applies an arithmetic function.
     * @return true if the function is an {@link ArithmeticFn}
     */
    public boolean isArithmetic() {
        return function instanceof ArithmeticFn;
    }

    /**
     * Create a copy of this call with different parameters.
     * @param newParameters the replacement parameters
     * @return the new function node
     */
    public Function withParameters(List<Expression> newParameters) {
        return new Function(function, newParameters);
    }

    @Override
    public List<Expression> getChildren() {
        return parameters;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String getExplainName() {
        return function.getName() + parameters.stream().map(Expression::getExplainName).collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Function other && function.equals(other.function) && parameters.equals(other.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Function.class, function, parameters);
    }
}
