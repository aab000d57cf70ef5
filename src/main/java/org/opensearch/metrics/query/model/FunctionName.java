/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.model;

/**
 * Name of a function that can be applied in a {@link Function} node.
 */
public interface FunctionName {

    /**
     * Get the public name of the function.
     * @return the function name, e.g. "sum"
     */
    String getName();
}
