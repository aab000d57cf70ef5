/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.model;

import org.opensearch.metrics.query.common.InvalidMetricsQueryException;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed metric resource identifier of the form {@code <type>:<namespace>/<name>@<unit>}, for example
 * {@code d:transactions/duration@millisecond}. The namespace is the use case owning the metric.
 *
 * @param type the storage kind
 * @param namespace the use case
 * @param name the metric name within the use case
 * @param unit the unit of the stored values
 */
public record Mri(MetricType type, String namespace, String name, String unit) {

    private static final Pattern MRI_PATTERN = Pattern.compile("^([a-z]):([a-zA-Z0-9_.-]+)/([^@]+)@(.+)$");

    /**
     * Parse an identifier as an MRI.
     * @param value the identifier
     * @return the MRI, or empty if the value is not shaped like an MRI or uses an unknown type
     */
    public static Optional<Mri> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        Matcher matcher = MRI_PATTERN.matcher(value);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        MetricType type = MetricType.fromCode(matcher.group(1).charAt(0));
        if (type == null) {
            return Optional.empty();
        }
        return Optional.of(new Mri(type, matcher.group(2), matcher.group(3), matcher.group(4)));
    }

    /**
     * Parse an identifier that must be an MRI.
     * @param value the identifier
     * @return the MRI
     * @throws InvalidMetricsQueryException if the value is not a valid MRI
     */
    public static Mri parseOrThrow(String value) {
        return parse(value).orElseThrow(() -> InvalidMetricsQueryException.of("invalid metric resource identifier: %s", value));
    }

    /**
     * Get the use case the metric belongs to.
     * @return the namespace
     */
    public String useCase() {
        return namespace;
    }

    @Override
    public String toString() {
        return type.getCode() + ":" + namespace + "/" + name + "@" + unit;
    }
}
