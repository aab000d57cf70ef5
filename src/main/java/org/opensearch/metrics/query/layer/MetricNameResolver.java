/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.layer;

import java.util.Map;
import java.util.Optional;

/**
 * Maps public metric names, such as {@code transaction.duration}, to MRIs.
 */
@FunctionalInterface
public interface MetricNameResolver {

    /**
     * Resolve a public name.
     * @param publicName the public name
     * @return the MRI, or empty if the name is not a known public name
     */
    Optional<String> resolve(String publicName);

    /**
     * Resolver backed by a fixed mapping.
     * @param mapping public name to MRI
     * @return the resolver
     */
    static MetricNameResolver of(Map<String, String> mapping) {
        Map<String, String> copy = Map.copyOf(mapping);
        return publicName -> Optional.ofNullable(copy.get(publicName));
    }
}
