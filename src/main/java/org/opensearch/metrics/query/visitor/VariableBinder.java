/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.visitor;

import org.opensearch.metrics.query.model.Expression;
import org.opensearch.metrics.query.model.Literal;
import org.opensearch.metrics.query.model.Variable;

import java.util.Map;

/**
 * Binds values to the variables of a query.
 */
public class VariableBinder extends QueryTransform {
    private final Map<String, ?> values;

    /**
     * Create a binder.
     * @param values variable name, without sigil, to a string, number or collection value
     */
    public VariableBinder(Map<String, ?> values) {
        this.values = values;
    }

    @Override
    public Expression visit(Variable variable) {
        if (!values.containsKey(variable.getName())) {
            return variable;
        }
        return variable.bind(Literal.from(values.get(variable.getName())));
    }
}
