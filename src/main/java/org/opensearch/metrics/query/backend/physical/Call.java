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
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Call of a storage function, e.g. {@code and(...)} or {@code quantilesIf(0.95)(value, ...)}.
 * Parametric functions carry their parameters separately from their arguments.
 */
public final class Call implements PhysicalExpression {
    private final String function;
    private final List<Object> parameters;
    private final List<PhysicalExpression> arguments;

    /**
     * Create a call.
     * @param function the function name
     * @param parameters constant parameters of a parametric function, empty otherwise
     * @param arguments the arguments
     */
    public Call(String function, List<Object> parameters, List<PhysicalExpression> arguments) {
        this.function = Objects.requireNonNull(function, "function cannot be null");
        this.parameters = List.copyOf(parameters);
        this.arguments = List.copyOf(arguments);
    }

    /**
     * Create a call of a function without parameters.
     * @param function the function name
     * @param arguments the arguments
     * @return the call
     */
    public static Call of(String function, PhysicalExpression... arguments) {
        return new Call(function, List.of(), Arrays.asList(arguments));
    }

    public String getFunction() {
        return function;
    }

    public List<Object> getParameters() {
        return parameters;
    }

    public List<PhysicalExpression> getArguments() {
        return arguments;
    }

    @Override
    public String render() {
        StringBuilder sb = new StringBuilder(function);
        if (parameters.isEmpty() == false) {
            sb.append(parameters.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")")));
        }
        sb.append(arguments.stream().map(PhysicalExpression::render).collect(Collectors.joining(", ", "(", ")")));
        return sb.toString();
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.field("function", function);
        if (parameters.isEmpty() == false) {
            builder.field("parameters", parameters);
        }
        builder.startArray("arguments");
        for (PhysicalExpression argument : arguments) {
            argument.toXContent(builder, params);
        }
        builder.endArray();
        return builder.endObject();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Call other
            && function.equals(other.function)
            && parameters.equals(other.parameters)
            && arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, parameters, arguments);
    }

    @Override
    public String toString() {
        return render();
    }
}
