/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.backend;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Translates strings stored integer-coded, such as metric identifiers and tag keys and values, to
 * their integer codes and back. Codes are scoped by use case.
 */
public interface TagIndexer {

    /**
     * Look up the code of a string.
     * @param useCase the use case
     * @param value the string
     * @return the code, or empty if the string was never indexed
     */
    OptionalLong resolve(String useCase, String value);

    /**
     * Look up the string of a code.
     * @param useCase the use case
     * @param id the code
     * @return the string, or empty if the code is unknown
     */
    Optional<String> reverseResolve(String useCase, long id);
}
