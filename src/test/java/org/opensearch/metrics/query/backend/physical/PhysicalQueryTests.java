/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.backend.physical;

import org.opensearch.common.xcontent.XContentFactory;
import org.opensearch.core.common.bytes.BytesReference;
import org.opensearch.core.xcontent.ToXContent;
import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.test.OpenSearchTestCase;

import java.io.IOException;
import java.util.List;

public class PhysicalQueryTests extends OpenSearchTestCase {

    public void testToXContent() throws IOException {
        PhysicalQuery query = new PhysicalQuery(
            "generic_metrics",
            "generic_metrics_distributions",
            List.of(new SelectedExpression("0", new Call("quantileIf", List.of(0.95), List.of(Column.of("value"), metricId(9))))),
            List.of(
                new SelectedExpression("env", Column.subscript("tags_raw", "env")),
                new SelectedExpression("bucketed_time", Call.of("toStartOfInterval", Column.of("timestamp"), Constant.of(60L)))
            ),
            List.of(Call.of("in", Column.of("project_id"), Constant.of(List.of(1L, 2L)))),
            60
        );

        XContentBuilder builder = XContentFactory.jsonBuilder();
        query.toXContent(builder, ToXContent.EMPTY_PARAMS);
        String json = BytesReference.bytes(builder).utf8ToString();

        assertEquals(
            "{\"dataset\":\"generic_metrics\",\"entity\":\"generic_metrics_distributions\","
                + "\"select\":[{\"alias\":\"0\",\"expression\":{\"function\":\"quantileIf\",\"parameters\":[0.95],\"arguments\":["
                + "{\"column\":\"value\"},{\"function\":\"equals\",\"arguments\":[{\"column\":\"metric_id\"},{\"constant\":9}]}]}}],"
                + "\"group_by\":[{\"alias\":\"env\",\"expression\":{\"column\":\"tags_raw\",\"key\":\"env\"}},"
                + "{\"alias\":\"bucketed_time\",\"expression\":{\"function\":\"toStartOfInterval\",\"arguments\":["
                + "{\"column\":\"timestamp\"},{\"constant\":60}]}}],"
                + "\"where\":[{\"function\":\"in\",\"arguments\":[{\"column\":\"project_id\"},{\"constant\":[1,2]}]}],"
                + "\"granularity\":60}",
            json
        );
    }

    public void testRender() {
        Call predicate = Call.of(
            "and",
            metricId(9),
            Call.of("equals", Column.subscript("tags_raw", "transaction"), Constant.of("it's"))
        );

        assertEquals("and(equals(metric_id, 9), equals(tags_raw[transaction], 'it\\'s'))", predicate.render());
    }

    public void testEqualityByValue() {
        PhysicalQuery first = new PhysicalQuery("d", "e", List.of(new SelectedExpression("0", metricId(1))), List.of(), List.of(), 60);
        PhysicalQuery same = new PhysicalQuery("d", "e", List.of(new SelectedExpression("0", metricId(1))), List.of(), List.of(), 60);
        PhysicalQuery other = new PhysicalQuery("d", "e", List.of(new SelectedExpression("0", metricId(2))), List.of(), List.of(), 60);

        assertEquals(first, same);
        assertEquals(first.hashCode(), same.hashCode());
        assertNotEquals(first, other);
        assertNotEquals(first, new PhysicalQuery("d", "e", first.getSelect(), List.of(), List.of(), 3600));
    }

    public void testConstantsMustBeScalars() {
        expectThrows(IllegalArgumentException.class, () -> Constant.of(new Object()));
        expectThrows(IllegalArgumentException.class, () -> Constant.of(List.of("a", new Object())));
        expectThrows(NullPointerException.class, () -> Constant.of(null));
    }

    private static Call metricId(long id) {
        return Call.of("equals", Column.of("metric_id"), Constant.of(id));
    }
}
