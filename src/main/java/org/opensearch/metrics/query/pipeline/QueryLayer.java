/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.pipeline;

import org.opensearch.metrics.query.model.SeriesQuery;
import org.opensearch.metrics.query.model.SeriesResult;

/**
 * A pass of the query pipeline. Query rewrites run in pipeline order before execution; result
 * rewrites run in reverse order after it. Both default to the identity.
 */
public interface QueryLayer {

    /**
     * Get the name of this layer for logging.
     * @return the layer name
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Rewrite a query before execution.
     * @param query the query
     * @return the rewritten query
     */
    default SeriesQuery transformQuery(SeriesQuery query) {
        return query;
    }

    /**
     * Rewrite a result after execution.
     * @param result the result
     * @return the rewritten result
     */
    default SeriesResult transformResult(SeriesResult result) {
        return result;
    }
}
