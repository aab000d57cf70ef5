/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.backend;

import org.opensearch.metrics.query.backend.physical.PhysicalQuery;
import org.opensearch.metrics.query.config.UseCaseConfig;

/**
 * Physical form of one logical query.
 *
 * @param config configuration of the use case the query reads
 * @param series the bucketed query
 * @param totals the query aggregating over the whole range, or null if totals were not requested
 */
public record TranslatedQuery(UseCaseConfig config, PhysicalQuery series, PhysicalQuery totals) {

    public boolean hasTotals() {
        return totals != null;
    }
}
