/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.layer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.metrics.query.model.Expression;
import org.opensearch.metrics.query.model.MetricName;
import org.opensearch.metrics.query.model.SeriesQuery;
import org.opensearch.metrics.query.pipeline.QueryLayer;
import org.opensearch.metrics.query.visitor.QueryTransform;

import java.util.Optional;

/**
 * Replaces public metric names with their MRIs. Names that are already MRIs, variables and unknown
 * public names are left unchanged.
 */
public class NamingLayer extends QueryTransform implements QueryLayer {
    private static final Logger logger = LogManager.getLogger(NamingLayer.class);

    private final MetricNameResolver resolver;

    /**
     * Constructor for NamingLayer.
     * @param resolver public name mapping
     */
    public NamingLayer(MetricNameResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public SeriesQuery transformQuery(SeriesQuery query) {
        return visitQuery(query);
    }

    @Override
    public Expression visit(MetricName metricName) {
        if (metricName.isVariable() || metricName.getMri().isPresent()) {
            return metricName;
        }
        Optional<String> mri = resolver.resolve(metricName.getName());
        if (mri.isEmpty()) {
            return metricName;
        }
        logger.debug("Resolved public metric name [{}] to [{}]", metricName.getName(), mri.get());
        return new MetricName(mri.get());
    }
}
