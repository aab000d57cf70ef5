/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.visitor;

import org.opensearch.metrics.query.common.InvalidMetricsQueryException;
import org.opensearch.metrics.query.model.Condition;
import org.opensearch.metrics.query.model.Expression;
import org.opensearch.metrics.query.model.Filter;
import org.opensearch.metrics.query.model.Function;
import org.opensearch.metrics.query.model.Literal;
import org.opensearch.metrics.query.model.MetricName;
import org.opensearch.metrics.query.model.SeriesQuery;
import org.opensearch.metrics.query.model.Tag;
import org.opensearch.metrics.query.model.Variable;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for structural rewrites of a query.
 *
 * <p>Each case rebuilds its node from its visited children: a query from its expressions, filters and groups,
 * a function from its parameters, a filter from its inner expression and conditions, a condition from both
 * operands. Leaves are returned unchanged. Without overrides the transform is the identity; subclasses
 * override only the cases they rewrite and inherit identity behavior for the rest.</p>
 */
public class QueryTransform extends ExpressionVisitor<Expression> {

    /**
     * Constructor for QueryTransform.
     */
    public QueryTransform() {}

    /**
     * Rewrite a whole query.
     * @param query the query to rewrite
     * @return the rewritten query
     */
    public SeriesQuery visitQuery(SeriesQuery query) {
        List<Expression> expressions = visitAll(query.getExpressions());

        List<Condition> filters = new ArrayList<>(query.getFilters().size());
        for (Condition condition : query.getFilters()) {
            filters.add(visitCondition(condition));
        }

        List<Tag> groups = new ArrayList<>(query.getGroups().size());
        for (Tag group : query.getGroups()) {
            Expression visited = process(group);
            if (!(visited instanceof Tag tag)) {
                throw InvalidMetricsQueryException.of("group by requires tags, found: %s", visited.getExplainName());
            }
            groups.add(tag);
        }

        return query.withExpressions(expressions).withFilters(filters).withGroups(groups);
    }

    /**
     * Rewrite a condition.
     * @param condition the condition to rewrite
     * @return the rewritten condition
     */
    public Condition visitCondition(Condition condition) {
        Expression lhs = process(condition.lhs());
        Expression rhs = process(condition.rhs());
        if (lhs.equals(condition.lhs()) && rhs.equals(condition.rhs())) {
            return condition;
        }
        return condition.withOperands(lhs, rhs);
    }

    @Override
    public Expression process(Expression expression) {
        return expression.accept(this);
    }

    @Override
    public Expression visit(Function function) {
        List<Expression> parameters = visitAll(function.getParameters());
        if (parameters.equals(function.getParameters())) {
            return function;
        }
        return function.withParameters(parameters);
    }

    @Override
    public Expression visit(Filter filter) {
        Expression inner = process(filter.getInner());
        List<Condition> conditions = new ArrayList<>(filter.getConditions().size());
        for (Condition condition : filter.getConditions()) {
            conditions.add(visitCondition(condition));
        }
        return new Filter(inner, conditions);
    }

    @Override
    public Expression visit(MetricName metricName) {
        return metricName;
    }

    @Override
    public Expression visit(Tag tag) {
        return tag;
    }

    @Override
    public Expression visit(Variable variable) {
        return variable;
    }

    @Override
    public Expression visit(Literal literal) {
        return literal;
    }

    /**
     * Visit each expression in order.
     * @param expressions the expressions to visit
     * @return the visited expressions, in the same order
     */
    protected List<Expression> visitAll(List<Expression> expressions) {
        List<Expression> result = new ArrayList<>(expressions.size());
        for (Expression expression : expressions) {
            result.add(process(expression));
        }
        return result;
    }
}
