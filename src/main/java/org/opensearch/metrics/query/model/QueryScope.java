/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.model;

import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Tenant scope of a query: the organization and the projects whose data may be read.
 *
 * @param orgId the organization id
 * @param projectIds the project ids, never empty
 */
public record QueryScope(long orgId, SortedSet<Long> projectIds) {

    /**
     * Validates and copies the project ids.
     */
    public QueryScope {
        if (projectIds == null || projectIds.isEmpty()) {
            throw new IllegalArgumentException("Query scope requires at least one project");
        }
        projectIds = Collections.unmodifiableSortedSet(new TreeSet<>(projectIds));
    }

    /**
     * Create a scope.
     * @param orgId the organization id
     * @param projectIds the project ids
     * @return the scope
     */
    public static QueryScope of(long orgId, Set<Long> projectIds) {
        return new QueryScope(orgId, new TreeSet<>(projectIds));
    }
}
