/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.mql;

import org.opensearch.metrics.query.model.SeriesQuery;
import org.opensearch.metrics.query.model.SeriesQueryBuilder;

/**
 * Entry point for textual metrics queries. Textual queries are not supported; queries are built
 * with {@link SeriesQueryBuilder}.
 */
public final class MqlParser {

    private MqlParser() {
        // Prevent instantiation
    }

    /**
     * Parse a textual query.
     * @param mql the query text
     * @return never returns normally
     * @throws UnsupportedOperationException always
     */
    public static SeriesQuery parse(String mql) {
        throw new UnsupportedOperationException("Textual metrics queries are not supported: " + mql);
    }
}
