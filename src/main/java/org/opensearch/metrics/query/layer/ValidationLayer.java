/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.metrics.query.layer;

import org.opensearch.metrics.query.common.InvalidMetricsQueryException;
import org.opensearch.metrics.query.model.AggregationFn;
import org.opensearch.metrics.query.model.Condition;
import org.opensearch.metrics.query.model.Expression;
import org.opensearch.metrics.query.model.Filter;
import org.opensearch.metrics.query.model.Function;
import org.opensearch.metrics.query.model.Literal;
import org.opensearch.metrics.query.model.MetricName;
import org.opensearch.metrics.query.model.Mri;
import org.opensearch.metrics.query.model.SeriesQuery;
import org.opensearch.metrics.query.model.Tag;
import org.opensearch.metrics.query.model.Variable;
import org.opensearch.metrics.query.pipeline.QueryLayer;
import org.opensearch.metrics.query.visitor.ExpressionVisitor;
import org.opensearch.metrics.query.visitor.MetricCollector;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Rejects queries that cannot be executed. The query itself is returned unchanged.
 *
 * <p>Expressions are type checked bottom-up with {@link ExpressionType}: aggregations take a single
 * metric that allows them and produce a vector, arithmetic combines two vectors, and every top-level
 * expression must be a vector. The layer also checks conditions, the time range, the resolved
 * interval and that all metrics belong to one use case. Group-by entries are tags by construction
 * of {@link SeriesQuery}.
 */
public class ValidationLayer implements QueryLayer {

    /**
     * Constructor for ValidationLayer.
     */
    public ValidationLayer() {}

    @Override
    public SeriesQuery transformQuery(SeriesQuery query) {
        validate(query);
        return query;
    }

    /**
     * Validate a query.
     * @param query the query
     * @throws InvalidMetricsQueryException describing the first problem found
     */
    public void validate(SeriesQuery query) {
        if (query.getRange().isEmpty()) {
            throw InvalidMetricsQueryException.of("query start %s must be before end %s", query.getRange().start(), query.getRange().end());
        }
        Long interval = query.getRollup().interval();
        if (interval == null) {
            throw new InvalidMetricsQueryException("query interval has not been resolved");
        }
        if (interval <= 0) {
            throw InvalidMetricsQueryException.of("query interval must be positive, got %d", interval);
        }

        TypeChecker checker = new TypeChecker();
        for (Expression expression : query.getExpressions()) {
            ExpressionType type = checker.process(expression);
            if (!type.isVector()) {
                throw InvalidMetricsQueryException.of(
                    "top-level expression must be aggregated into a series, got %s: %s",
                    type,
                    expression.getExplainName()
                );
            }
        }
        for (Condition condition : query.getFilters()) {
            checker.checkCondition(condition);
        }
        checkSingleUseCase(query);
    }

    private static void checkSingleUseCase(SeriesQuery query) {
        Set<MetricName> metrics = MetricCollector.collect(query);
        if (metrics.isEmpty()) {
            throw new InvalidMetricsQueryException("query does not reference any metrics");
        }
        Set<String> useCases = new TreeSet<>();
        for (MetricName metric : metrics) {
            useCases.add(Mri.parseOrThrow(metric.getName()).useCase());
        }
        if (useCases.size() > 1) {
            throw InvalidMetricsQueryException.of("query must reference a single use case, found %s", useCases);
        }
    }

    /**
     * Computes the type of an expression, throwing on the first ill-typed node.
     */
    static class TypeChecker extends ExpressionVisitor<ExpressionType> {

        @Override
        public ExpressionType process(Expression expression) {
            return expression.accept(this);
        }

        @Override
        public ExpressionType visit(MetricName metricName) {
            if (metricName.isVariable()) {
                throw InvalidMetricsQueryException.of("unbound variable %s", metricName.getName());
            }
            Mri mri = Mri.parseOrThrow(metricName.getName());
            if (!mri.type().isStored()) {
                throw InvalidMetricsQueryException.of("derived metric %s was not expanded", metricName.getName());
            }
            return ExpressionType.metric(mri.type().getAllowedAggregations());
        }

        @Override
        public ExpressionType visit(Tag tag) {
            return ExpressionType.SCALAR;
        }

        @Override
        public ExpressionType visit(Variable variable) {
            if (!variable.isBound()) {
                throw InvalidMetricsQueryException.of("unbound variable %s", variable.getExplainName());
            }
            return ExpressionType.SCALAR;
        }

        @Override
        public ExpressionType visit(Literal literal) {
            return ExpressionType.SCALAR;
        }

        @Override
        public ExpressionType visit(Function function) {
            List<Expression> parameters = function.getParameters();
            if (function.getFunction() instanceof AggregationFn aggregation) {
                if (parameters.size() != 1) {
                    throw InvalidMetricsQueryException.of(
                        "aggregation %s requires exactly one parameter, got %d",
                        aggregation.getName(),
                        parameters.size()
                    );
                }
                ExpressionType parameterType = process(parameters.get(0));
                if (!parameterType.isMetric()) {
                    throw InvalidMetricsQueryException.of(
                        "aggregation %s requires a metric, got %s: %s",
                        aggregation.getName(),
                        parameterType,
                        parameters.get(0).getExplainName()
                    );
                }
                if (!parameterType.allows(aggregation)) {
                    throw InvalidMetricsQueryException.of(
                        "aggregation %s is not supported for %s",
                        aggregation.getName(),
                        parameters.get(0).getExplainName()
                    );
                }
                return ExpressionType.VECTOR;
            }

            if (parameters.size() != 2) {
                throw InvalidMetricsQueryException.of(
                    "arithmetic %s requires exactly two parameters, got %d",
                    function.getFunction().getName(),
                    parameters.size()
                );
            }
            for (Expression parameter : parameters) {
                ExpressionType parameterType = process(parameter);
                if (!parameterType.isVector()) {
                    throw InvalidMetricsQueryException.of(
                        "arithmetic %s requires series operands, got %s: %s",
                        function.getFunction().getName(),
                        parameterType,
                        parameter.getExplainName()
                    );
                }
            }
            return ExpressionType.VECTOR;
        }

        @Override
        public ExpressionType visit(Filter filter) {
            for (Condition condition : filter.getConditions()) {
                checkCondition(condition);
            }
            return process(filter.getInner());
        }

        void checkCondition(Condition condition) {
            if (!(condition.lhs() instanceof Tag)) {
                throw InvalidMetricsQueryException.of(
                    "condition must compare a tag, got %s",
                    condition.lhs().getExplainName()
                );
            }

            Expression rhs = condition.rhs();
            Literal value;
            if (rhs instanceof Literal literal) {
                value = literal;
            } else if (rhs instanceof Variable variable) {
                if (!variable.isBound()) {
                    throw InvalidMetricsQueryException.of("unbound variable %s", variable.getExplainName());
                }
                value = variable.getValue();
            } else {
                throw InvalidMetricsQueryException.of(
                    "condition value must be a literal or variable, got %s",
                    rhs.getExplainName()
                );
            }

            if (condition.op().takesList() && !value.isList()) {
                throw InvalidMetricsQueryException.of("operator %s requires a list, got %s", condition.op().getName(), value.getExplainName());
            }
            if (!condition.op().takesList() && value.isList()) {
                throw InvalidMetricsQueryException.of(
                    "operator %s requires a single value, got %s",
                    condition.op().getName(),
                    value.getExplainName()
                );
            }
        }
    }
}
