/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.config;

import org.opensearch.metrics.query.common.InvalidMetricsQueryException;

import java.util.Optional;

/**
 * Resolves the physical configuration of a use case.
 */
public interface QueryConfigLookup {

    /**
     * Find the configuration of a use case.
     * @param useCase the use case name
     * @return the configuration, or empty if the use case is unknown
     */
    Optional<UseCaseConfig> find(String useCase);

    /**
     * Get the configuration of a use case that must exist.
     * @param useCase the use case name
     * @return the configuration
     * @throws InvalidMetricsQueryException if the use case is unknown
     */
    default UseCaseConfig get(String useCase) {
        return find(useCase).orElseThrow(() -> InvalidMetricsQueryException.of("unknown use case [%s]", useCase));
    }
}
