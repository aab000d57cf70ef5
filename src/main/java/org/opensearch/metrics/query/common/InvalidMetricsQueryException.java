/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.common;

import java.util.Locale;

/**
 * Raised when a metrics query is structurally or semantically invalid and cannot be executed.
 * Every rejection made while rewriting, validating or translating a query surfaces as this exception.
 */
public class InvalidMetricsQueryException extends IllegalArgumentException {

    /**
     * Create a new exception with a human-readable reason.
     * @param reason why the query was rejected
     */
    public InvalidMetricsQueryException(String reason) {
        super(reason);
    }

    /**
     * Create a new exception with a formatted reason.
     * @param format message format, see {@link String#format(Locale, String, Object...)}
     * @param args format arguments
     * @return the new exception
     */
    public static InvalidMetricsQueryException of(String format, Object... args) {
        return new InvalidMetricsQueryException(String.format(Locale.ROOT, format, args));
    }
}
