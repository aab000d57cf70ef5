/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.framework;

import org.opensearch.metrics.query.backend.TagIndexer;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * In-memory {@link TagIndexer} sharing one code space across use cases.
 */
public class MapTagIndexer implements TagIndexer {
    private final Map<String, Long> codes = new HashMap<>();
    private final Map<Long, String> strings = new HashMap<>();

    public MapTagIndexer() {}

    public MapTagIndexer(Map<String, ? extends Number> initial) {
        initial.forEach((value, code) -> put(value, code.longValue()));
    }

    public MapTagIndexer put(String value, long code) {
        codes.put(value, code);
        strings.put(code, value);
        return this;
    }

    @Override
    public OptionalLong resolve(String useCase, String value) {
        Long code = codes.get(value);
        return code == null ? OptionalLong.empty() : OptionalLong.of(code);
    }

    @Override
    public Optional<String> reverseResolve(String useCase, long id) {
        return Optional.ofNullable(strings.get(id));
    }
}
