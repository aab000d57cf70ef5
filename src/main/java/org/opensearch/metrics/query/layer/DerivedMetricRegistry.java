/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.layer;

import org.opensearch.metrics.query.model.Expression;
import org.opensearch.metrics.query.model.MetricType;
import org.opensearch.metrics.query.model.Mri;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Definitions of derived metrics, keyed by their MRI.
 *
 * <p>Definitions are registered at startup and the registry is then frozen. After freezing, lookups
 * read an immutable map without locking and further registrations fail.
 */
public class DerivedMetricRegistry {

    private final Map<String, Expression> pending = new HashMap<>();
    private volatile Map<String, Expression> definitions;

    /**
     * Constructor for DerivedMetricRegistry.
     */
    public DerivedMetricRegistry() {}

    /**
     * Register a derived metric.
     * @param mri the MRI of the derived metric, which must have type {@code e}
     * @param expression the expression computing it
     * @return this registry
     * @throws IllegalStateException if the registry is frozen
     * @throws IllegalArgumentException if the MRI is not a derived metric MRI or is already registered
     */
    public synchronized DerivedMetricRegistry register(String mri, Expression expression) {
        Objects.requireNonNull(expression, "expression cannot be null");
        if (definitions != null) {
            throw new IllegalStateException("Cannot register [" + mri + "], the registry is frozen");
        }
        Optional<Mri> parsed = Mri.parse(mri);
        if (parsed.isEmpty() || parsed.get().type() != MetricType.DERIVED) {
            throw new IllegalArgumentException("Derived metrics must be registered under an MRI of type 'e', got [" + mri + "]");
        }
        if (pending.putIfAbsent(mri, expression) != null) {
            throw new IllegalArgumentException("Derived metric [" + mri + "] is already registered");
        }
        return this;
    }

    /**
     * Make the registry read-only. Freezing more than once has no effect.
     * @return this registry
     */
    public synchronized DerivedMetricRegistry freeze() {
        if (definitions == null) {
            definitions = Map.copyOf(pending);
            pending.clear();
        }
        return this;
    }

    /**
     * Whether the registry has been frozen.
     * @return true once {@link #freeze()} was called
     */
    public boolean isFrozen() {
        return definitions != null;
    }

    /**
     * Look up the definition of a derived metric.
     * @param mri the MRI
     * @return the defining expression, or empty if none is registered
     * @throws IllegalStateException if the registry is not frozen yet
     */
    public Optional<Expression> get(String mri) {
        Map<String, Expression> frozen = definitions;
        if (frozen == null) {
            throw new IllegalStateException("Derived metric registry must be frozen before lookups");
        }
        return Optional.ofNullable(frozen.get(mri));
    }
}
