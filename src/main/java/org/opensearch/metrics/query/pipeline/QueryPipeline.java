/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.pipeline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.common.settings.Settings;
import org.opensearch.metrics.query.config.MetricsQuerySettings;
import org.opensearch.metrics.query.config.QueryConfigLookup;
import org.opensearch.metrics.query.layer.DerivedMetricRegistry;
import org.opensearch.metrics.query.layer.ExpansionLayer;
import org.opensearch.metrics.query.layer.FilterMergeLayer;
import org.opensearch.metrics.query.layer.MetricNameResolver;
import org.opensearch.metrics.query.layer.NamingLayer;
import org.opensearch.metrics.query.layer.TimeframeLayer;
import org.opensearch.metrics.query.layer.ValidationLayer;
import org.opensearch.metrics.query.model.SeriesQuery;
import org.opensearch.metrics.query.model.SeriesResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Runs a query through an ordered list of layers, executes it on a backend and runs the result
 * back through the layers in reverse order.
 *
 * <p>A pipeline is immutable and can execute queries from several threads; each execution runs
 * synchronously on the calling thread.
 */
public class QueryPipeline {
    private static final Logger logger = LogManager.getLogger(QueryPipeline.class);

    private final List<QueryLayer> layers;
    private final QueryBackend backend;
    private final QuerySplitter splitter;
    private final ResultMerger merger;

    private QueryPipeline(List<QueryLayer> layers, QueryBackend backend) {
        this.layers = List.copyOf(layers);
        this.backend = backend;
        this.splitter = new QuerySplitter();
        this.merger = new ResultMerger();
    }

    /**
     * Create a builder for a pipeline executing on the given backend.
     * @param backend the backend
     * @return a new builder
     */
    public static Builder builder(QueryBackend backend) {
        return new Builder(backend);
    }

    /**
     * Assemble the standard pipeline: naming (when enabled), expansion, timeframe, filter merge and validation.
     *
     * @param settings node settings
     * @param configLookup use case configuration
     * @param registry derived metric definitions, frozen by this call
     * @param nameResolver public metric name mapping, only used when naming is enabled
     * @param backend the backend
     * @return the pipeline
     */
    public static QueryPipeline defaultPipeline(
        Settings settings,
        QueryConfigLookup configLookup,
        DerivedMetricRegistry registry,
        MetricNameResolver nameResolver,
        QueryBackend backend
    ) {
        return builder(backend).layerIf(MetricsQuerySettings.NAMING_ENABLED.get(settings), () -> new NamingLayer(nameResolver))
            .layer(new ExpansionLayer(registry, MetricsQuerySettings.EXPANSION_MAX_DEPTH.get(settings)))
            .layer(new TimeframeLayer(configLookup, MetricsQuerySettings.MAX_BUCKETS.get(settings)))
            .layer(new FilterMergeLayer())
            .layer(new ValidationLayer())
            .build();
    }

    /**
     * Get the layers in execution order.
     * @return the layers
     */
    public List<QueryLayer> getLayers() {
        return layers;
    }

    /**
     * Execute a query.
     * @param query the query
     * @return the result
     */
    public SeriesResult execute(SeriesQuery query) {
        SeriesQuery rewritten = query;
        for (QueryLayer layer : layers) {
            rewritten = layer.transformQuery(rewritten);
            if (logger.isDebugEnabled()) {
                logger.debug("Applied layer [{}] to query: {}", layer.name(), rewritten);
            }
        }

        List<SubQuery> subQueries = splitter.split(rewritten);
        if (subQueries.size() > 1) {
            logger.debug("Split query into {} sub-queries", subQueries.size());
        }
        List<SeriesQuery> executable = new ArrayList<>(subQueries.size());
        for (SubQuery subQuery : subQueries) {
            executable.add(subQuery.query());
        }
        Map<SeriesQuery, SeriesResult> results = backend.execute(executable);
        SeriesResult result = merger.merge(subQueries, results);

        for (int i = layers.size() - 1; i >= 0; i--) {
            QueryLayer layer = layers.get(i);
            result = layer.transformResult(result);
            logger.debug("Applied layer [{}] to result", layer.name());
        }
        return result;
    }

    /**
     * Builder for {@link QueryPipeline}.
     */
    public static class Builder {
        private final QueryBackend backend;
        private final List<QueryLayer> layers = new ArrayList<>();

        private Builder(QueryBackend backend) {
            this.backend = Objects.requireNonNull(backend, "backend must not be null");
        }

        /**
         * Append a layer.
         * @param layer the layer
         * @return this builder
         */
        public Builder layer(QueryLayer layer) {
            layers.add(Objects.requireNonNull(layer, "layer must not be null"));
            return this;
        }

        /**
         * Append a layer only if the condition holds. The supplier is not called otherwise.
         * @param condition whether to include the layer
         * @param layer supplies the layer
         * @return this builder
         */
        public Builder layerIf(boolean condition, Supplier<QueryLayer> layer) {
            if (condition) {
                layer(layer.get());
            }
            return this;
        }

        /**
         * Build the pipeline.
         * @return the pipeline
         */
        public QueryPipeline build() {
            return new QueryPipeline(layers, backend);
        }
    }
}
