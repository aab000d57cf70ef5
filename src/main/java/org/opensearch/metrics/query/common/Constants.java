/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.common;

import java.util.List;

/**
 * Constants shared by the query layers and the storage translation.
 */
public class Constants {

    /**
     * Private constructor to prevent instantiation.
     */
    private Constants() {
        // Prevent instantiation
    }

    /**
     * Prefix marking an identifier as an unbound query variable.
     */
    public static final char VARIABLE_SIGIL = '$';

    /**
     * Synthetic tag that always maps to the project column, regardless of tag indexing mode.
     */
    public static final String PROJECT_TAG = "project";

    /**
     * Code used for strings the indexer does not know. No stored row carries it.
     */
    public static final long STRING_NOT_FOUND = -1L;

    /**
     * Physical column names of the time-series store.
     */
    public static class Columns {

        /**
         * Private constructor to prevent instantiation.
         */
        private Columns() {
            // Prevent instantiation
        }

        /**
         * Organization (tenant) id column.
         */
        public static final String ORG_ID = "org_id";

        /**
         * Project (sub-tenant) id column.
         */
        public static final String PROJECT_ID = "project_id";

        /**
         * Metric identifier column.
         */
        public static final String METRIC_ID = "metric_id";

        /**
         * Row timestamp column.
         */
        public static final String TIMESTAMP = "timestamp";

        /**
         * Stored value column.
         */
        public static final String VALUE = "value";

        /**
         * Integer-coded tag map column.
         */
        public static final String TAGS = "tags";

        /**
         * Raw string tag map column.
         */
        public static final String TAGS_RAW = "tags_raw";

        /**
         * Reserved alias of the time bucket expression in every returned row.
         */
        public static final String BUCKETED_TIME = "bucketed_time";

        /**
         * Prefix of the aliases of group-by tag columns, keeping them apart from expression indexes
         * and {@link #BUCKETED_TIME}.
         */
        public static final String TAG_ALIAS_PREFIX = "tag:";
    }

    /**
     * Time related defaults. All durations are in seconds.
     */
    public static class Time {

        /**
         * Private constructor to prevent instantiation.
         */
        private Time() {
            // Prevent instantiation
        }

        /**
         * Granularities used when a use case does not configure its own.
         */
        public static final List<Long> DEFAULT_GRANULARITIES = List.of(10L, 60L, 3600L, 86400L);

        /**
         * Upper bound on the number of buckets an inferred interval produces.
         */
        public static final int DEFAULT_MAX_BUCKETS = 360;
    }
}
