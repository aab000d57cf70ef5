/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.backend;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.metrics.query.backend.physical.PhysicalQuery;
import org.opensearch.metrics.query.model.SeriesQuery;
import org.opensearch.metrics.query.model.SeriesResult;
import org.opensearch.metrics.query.pipeline.QueryBackend;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link QueryBackend} that translates queries into physical queries, submits all of them to the
 * store in a single bulk request and converts the rows of each.
 */
public class StorageQueryBackend implements QueryBackend {
    private static final Logger logger = LogManager.getLogger(StorageQueryBackend.class);

    private final QueryTranslator translator;
    private final ResultConverter converter;
    private final StorageClient client;

    /**
     * Constructor for StorageQueryBackend.
     * @param translator logical to physical translation
     * @param converter row assembly
     * @param client the store
     */
    public StorageQueryBackend(QueryTranslator translator, ResultConverter converter, StorageClient client) {
        this.translator = translator;
        this.converter = converter;
        this.client = client;
    }

    @Override
    public Map<SeriesQuery, SeriesResult> execute(List<SeriesQuery> queries) {
        List<TranslatedQuery> translated = new ArrayList<>(queries.size());
        List<PhysicalQuery> physical = new ArrayList<>();
        for (SeriesQuery query : queries) {
            TranslatedQuery translation = translator.translate(query);
            translated.add(translation);
            physical.add(translation.series());
            if (translation.hasTotals()) {
                physical.add(translation.totals());
            }
        }

        logger.debug("Submitting {} physical queries for {} queries", physical.size(), queries.size());
        List<List<Map<String, Object>>> rows = client.bulkQuery(physical);
        if (rows.size() != physical.size()) {
            throw new IllegalStateException("Storage returned " + rows.size() + " results for " + physical.size() + " queries");
        }

        Map<SeriesQuery, SeriesResult> results = new LinkedHashMap<>();
        int position = 0;
        for (int i = 0; i < queries.size(); i++) {
            TranslatedQuery translation = translated.get(i);
            List<Map<String, Object>> seriesRows = rows.get(position++);
            List<Map<String, Object>> totalsRows = translation.hasTotals() ? rows.get(position++) : List.of();
            results.put(queries.get(i), converter.convert(queries.get(i), translation, seriesRows, totalsRows));
        }
        return results;
    }
}
