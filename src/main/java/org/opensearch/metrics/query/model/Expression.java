/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.model;

import org.opensearch.metrics.query.visitor.ExpressionVisitor;

import java.util.List;

/**
 * Base class for all nodes of the query expression tree.
 *
 * <p>The hierarchy is closed: {@link MetricName}, {@link Tag}, {@link Variable}, {@link Literal},
 * {@link Function} and {@link Filter} are the only node types, and every node dispatches to exactly one
 * method of an {@link ExpressionVisitor}. Nodes are immutable and compare structurally.</p>
 */
public abstract class Expression {

    /**
     * Package-private constructor, the set of node types is fixed.
     */
    Expression() {}

    /**
     * Accept a visitor to process this node.
     * @param visitor the visitor to accept
     * @param <T> the return type of the visitor
     * @return the result of processing this node
     */
    public abstract <T> T accept(ExpressionVisitor<T> visitor);

    /**
     * Get a human-readable representation of this node and its children.
     * @return the explain name of this node
     */
    public abstract String getExplainName();

    /**
     * Get the direct child expressions of this node. Leaves have none.
     * @return the child expressions, never null
     */
    public List<Expression> getChildren() {
        return List.of();
    }

    @Override
    public String toString() {
        return getExplainName();
    }
}
