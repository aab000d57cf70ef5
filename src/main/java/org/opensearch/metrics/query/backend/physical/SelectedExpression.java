/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.backend.physical;

import org.opensearch.core.xcontent.ToXContentObject;
import org.opensearch.core.xcontent.XContentBuilder;

import java.io.IOException;
import java.util.Objects;

/**
 * An expression of a select or group-by list together with the name its values are returned under.
 *
 * @param alias the result column name
 * @param expression the expression
 */
public record SelectedExpression(String alias, PhysicalExpression expression) implements ToXContentObject {

    /**
     * Validates that both parts are present.
     */
    public SelectedExpression {
        Objects.requireNonNull(alias, "alias cannot be null");
        Objects.requireNonNull(expression, "expression cannot be null");
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.field("alias", alias);
        builder.field("expression");
        expression.toXContent(builder, params);
        return builder.endObject();
    }

    @Override
    public String toString() {
        return expression.render() + " AS " + alias;
    }
}
