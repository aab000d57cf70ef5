/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.backend.physical;

import org.opensearch.core.xcontent.ToXContentObject;

/**
 * An expression of the storage query language: a column, a constant or a function call.
 * Implementations are immutable and comparable by value, so physical queries can be cache keys.
 */
public interface PhysicalExpression extends ToXContentObject {

    /**
     * Render the expression in the storage query syntax, e.g. {@code sumIf(value, equals(metric_id, 7))}.
     * @return the rendered expression
     */
    String render();
}
