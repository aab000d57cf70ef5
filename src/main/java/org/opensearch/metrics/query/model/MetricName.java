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
import java.util.Optional;

/**
 * Leaf referencing a metric, either by its MRI or by a public name that is translated later.
 */
public final class MetricName extends Expression {
    private final String name;

    /**
     * Create a metric reference.
     * @param name the metric identifier
     */
    public MetricName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Metric name cannot be empty");
        }
        this.name = name;
    }

    /**
     * Get the metric identifier.
     * @return the name as given by the caller
     */
    public String getName() {
        return name;
    }

    /**
     * Parse the name as an MRI.
     * @return the parsed MRI, or empty if the name is not an MRI
     */
    public Optional<Mri> getMri() {
        return Mri.parse(name);
    }

    /**
     * Whether this name carries the variable sigil and must never be expanded or resolved.
     * @return true if the name starts with {@link Constants#VARIABLE_SIGIL}
     */
    public boolean isVariable() {
        return name.charAt(0) == Constants.VARIABLE_SIGIL;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String getExplainName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MetricName other && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(MetricName.class, name);
    }
}
