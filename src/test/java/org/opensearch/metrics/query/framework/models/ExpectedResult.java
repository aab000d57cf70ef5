/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.framework.models;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Expected outcome of a scenario: either an error message fragment, or properties of the physical
 * queries and values of the result. Unset fields are not checked.
 */
public record ExpectedResult(@JsonProperty("error_message") String errorMessage, @JsonProperty("physical_queries") Integer physicalQueries,
    @JsonProperty("select") List<String> select, @JsonProperty("granularity") Long granularity, @JsonProperty("start") Long start,
    @JsonProperty("end") Long end, @JsonProperty("series") List<ExpectedSeries> series) {
}
