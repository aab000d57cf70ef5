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
import org.opensearch.metrics.query.backend.physical.Call;
import org.opensearch.metrics.query.backend.physical.Column;
import org.opensearch.metrics.query.backend.physical.Constant;
import org.opensearch.metrics.query.backend.physical.PhysicalExpression;
import org.opensearch.metrics.query.backend.physical.PhysicalQuery;
import org.opensearch.metrics.query.backend.physical.SelectedExpression;
import org.opensearch.metrics.query.common.Constants;
import org.opensearch.metrics.query.common.InvalidMetricsQueryException;
import org.opensearch.metrics.query.config.QueryConfigLookup;
import org.opensearch.metrics.query.config.UseCaseConfig;
import org.opensearch.metrics.query.model.AggregationFn;
import org.opensearch.metrics.query.model.ArithmeticFn;
import org.opensearch.metrics.query.model.Condition;
import org.opensearch.metrics.query.model.ConditionFn;
import org.opensearch.metrics.query.model.Expression;
import org.opensearch.metrics.query.model.Filter;
import org.opensearch.metrics.query.model.Function;
import org.opensearch.metrics.query.model.Literal;
import org.opensearch.metrics.query.model.MetricName;
import org.opensearch.metrics.query.model.MetricType;
import org.opensearch.metrics.query.model.Mri;
import org.opensearch.metrics.query.model.SeriesQuery;
import org.opensearch.metrics.query.model.Tag;
import org.opensearch.metrics.query.model.Variable;
import org.opensearch.metrics.query.visitor.MetricCollector;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Translates a validated, filter-merged query reading a single entity into physical queries.
 *
 * <p>Each top-level expression becomes one select column aliased by its index. Aggregations become
 * conditional aggregates restricted to the rows of their metric and to the conditions merged onto
 * it, for example {@code avg(d:transactions/duration@ms{env=prod})} becomes
 * <pre>
 * avgIf(value, and(equals(metric_id, 12), equals(tags[3], 45)))
 * </pre>
 * Rows are grouped by the requested tags and by {@code toStartOfInterval(timestamp, interval)},
 * returned under {@link Constants.Columns#BUCKETED_TIME}, and restricted to the organization,
 * projects and time range of the query.
 *
 * <p>Tags are read from {@code tags[<key code>]} and compared with value codes when the use case
 * stores integer-coded tags, and from {@code tags_raw[<key>]} otherwise. The {@code project} tag
 * always reads the project column.
 */
public class QueryTranslator {
    private static final Logger logger = LogManager.getLogger(QueryTranslator.class);

    private final QueryConfigLookup configLookup;
    private final TagIndexer indexer;

    /**
     * Constructor for QueryTranslator.
     * @param configLookup use case configuration
     * @param indexer string indexer for metric identifiers and integer-coded tags
     */
    public QueryTranslator(QueryConfigLookup configLookup, TagIndexer indexer) {
        this.configLookup = configLookup;
        this.indexer = indexer;
    }

    /**
     * Translate a query.
     * @param query the query, with a resolved interval
     * @return the physical queries
     * @throws InvalidMetricsQueryException if the query reads more than one entity or cannot be expressed physically
     */
    public TranslatedQuery translate(SeriesQuery query) {
        Long interval = query.getRollup().interval();
        if (interval == null) {
            throw new IllegalStateException("query interval must be resolved before translation");
        }

        Set<MetricType> types = EnumSet.noneOf(MetricType.class);
        Set<String> useCases = new TreeSet<>();
        for (MetricName metric : MetricCollector.collect(query)) {
            Mri mri = Mri.parseOrThrow(metric.getName());
            types.add(mri.type());
            useCases.add(mri.useCase());
        }
        if (types.size() != 1) {
            throw InvalidMetricsQueryException.of("query must reference a single entity, found metric types %s", types);
        }
        if (useCases.size() != 1) {
            throw InvalidMetricsQueryException.of("query must reference a single use case, found %s", useCases);
        }
        UseCaseConfig config = configLookup.get(useCases.iterator().next());
        String entity = config.entityFor(types.iterator().next());

        List<SelectedExpression> select = new ArrayList<>();
        List<Expression> expressions = query.getExpressions();
        for (int i = 0; i < expressions.size(); i++) {
            select.add(new SelectedExpression(String.valueOf(i), translateExpression(expressions.get(i), config)));
        }

        List<SelectedExpression> tagGroups = new ArrayList<>();
        for (Tag group : query.getGroups()) {
            tagGroups.add(new SelectedExpression(Constants.Columns.TAG_ALIAS_PREFIX + group.getKey(), tagColumn(group.getKey(), config)));
        }
        List<SelectedExpression> groupBy = new ArrayList<>(tagGroups);
        groupBy.add(
            new SelectedExpression(
                Constants.Columns.BUCKETED_TIME,
                Call.of("toStartOfInterval", Column.of(Constants.Columns.TIMESTAMP), Constant.of(interval))
            )
        );

        List<PhysicalExpression> where = basePredicate(query, config);
        long granularity = config.granularityFor(interval);

        PhysicalQuery series = new PhysicalQuery(config.dataset(), entity, select, groupBy, where, granularity);
        PhysicalQuery totals = query.getRollup().totals()
            ? new PhysicalQuery(config.dataset(), entity, select, tagGroups, where, granularity)
            : null;
        logger.debug("Translated query {} into {}", query, series);
        return new TranslatedQuery(config, series, totals);
    }

    private List<PhysicalExpression> basePredicate(SeriesQuery query, UseCaseConfig config) {
        List<PhysicalExpression> where = new ArrayList<>();
        where.add(Call.of("equals", Column.of(Constants.Columns.ORG_ID), Constant.of(query.getScope().orgId())));
        where.add(Call.of("in", Column.of(Constants.Columns.PROJECT_ID), Constant.of(new ArrayList<>(query.getScope().projectIds()))));
        where.add(Call.of("greaterOrEquals", Column.of(Constants.Columns.TIMESTAMP), Constant.of(query.getRange().startSeconds())));
        where.add(Call.of("less", Column.of(Constants.Columns.TIMESTAMP), Constant.of(query.getRange().endSeconds())));
        for (Condition condition : query.getFilters()) {
            where.add(translateCondition(condition, config));
        }
        return where;
    }

    private PhysicalExpression translateExpression(Expression expression, UseCaseConfig config) {
        if (expression instanceof Function function) {
            if (function.getFunction() instanceof AggregationFn aggregation) {
                return translateAggregation(aggregation, function.getParameters().get(0), config);
            }
            if (function.getFunction() instanceof ArithmeticFn arithmetic) {
                List<PhysicalExpression> operands = new ArrayList<>();
                for (Expression parameter : function.getParameters()) {
                    operands.add(translateExpression(parameter, config));
                }
                return new Call(arithmetic.getName(), List.of(), operands);
            }
        }
        throw InvalidMetricsQueryException.of("cannot translate expression %s", expression.getExplainName());
    }

    private PhysicalExpression translateAggregation(AggregationFn aggregation, Expression parameter, UseCaseConfig config) {
        List<Condition> conditions = new ArrayList<>();
        Expression current = parameter;
        while (current instanceof Filter filter) {
            conditions.addAll(filter.getConditions());
            current = filter.getInner();
        }
        if (!(current instanceof MetricName metric)) {
            throw InvalidMetricsQueryException.of("aggregation %s requires a metric, got %s", aggregation, parameter.getExplainName());
        }

        long metricId = indexer.resolve(config.useCase(), metric.getName()).orElse(Constants.STRING_NOT_FOUND);
        PhysicalExpression predicate = Call.of("equals", Column.of(Constants.Columns.METRIC_ID), Constant.of(metricId));
        if (!conditions.isEmpty()) {
            List<PhysicalExpression> conjunction = new ArrayList<>();
            conjunction.add(predicate);
            for (Condition condition : conditions) {
                conjunction.add(translateCondition(condition, config));
            }
            predicate = new Call("and", List.of(), conjunction);
        }

        Column value = Column.of(Constants.Columns.VALUE);
        return switch (aggregation) {
            case SUM -> Call.of("sumIf", value, predicate);
            case COUNT -> Call.of("countIf", value, predicate);
            case AVG -> Call.of("avgIf", value, predicate);
            case MAX -> Call.of("maxIf", value, predicate);
            case MIN -> Call.of("minIf", value, predicate);
            case P50 -> quantile(0.5, value, predicate);
            case P75 -> quantile(0.75, value, predicate);
            case P95 -> quantile(0.95, value, predicate);
            case P99 -> quantile(0.99, value, predicate);
            case COUNT_UNIQUE -> Call.of("uniqIf", value, predicate);
        };
    }

    private static Call quantile(double level, Column value, PhysicalExpression predicate) {
        return new Call("quantileIf", List.of(level), List.of(value, predicate));
    }

    private PhysicalExpression translateCondition(Condition condition, UseCaseConfig config) {
        if (!(condition.lhs() instanceof Tag tag)) {
            throw InvalidMetricsQueryException.of("condition must compare a tag, got %s", condition.lhs().getExplainName());
        }
        Literal literal = literalOf(condition.rhs());
        ConditionFn op = condition.op();
        String key = tag.getKey();

        Object value;
        if (Constants.PROJECT_TAG.equals(key)) {
            requireExactMatch(op, key);
            value = mapValues(literal, QueryTranslator::projectId);
        } else if (config.indexedTags()) {
            requireExactMatch(op, key);
            value = mapValues(literal, v -> indexer.resolve(config.useCase(), String.valueOf(v)).orElse(Constants.STRING_NOT_FOUND));
        } else {
            value = mapValues(literal, String::valueOf);
        }
        return Call.of(op.getName(), tagColumn(key, config), Constant.of(value));
    }

    private static void requireExactMatch(ConditionFn op, String key) {
        if (op == ConditionFn.LIKE || op == ConditionFn.NOT_LIKE) {
            throw InvalidMetricsQueryException.of("operator %s is not supported on tag [%s]", op.getName(), key);
        }
    }

    private static Literal literalOf(Expression rhs) {
        if (rhs instanceof Literal literal) {
            return literal;
        }
        if (rhs instanceof Variable variable && variable.isBound()) {
            return variable.getValue();
        }
        throw InvalidMetricsQueryException.of("condition value must be a literal or bound variable, got %s", rhs.getExplainName());
    }

    private static Object mapValues(Literal literal, java.util.function.Function<Object, Object> mapper) {
        if (literal.isList()) {
            List<Object> mapped = new ArrayList<>();
            for (Object value : literal.getValues()) {
                mapped.add(mapper.apply(value));
            }
            return mapped;
        }
        return mapper.apply(literal.getValue());
    }

    private static Object projectId(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(String.valueOf(value));
        } catch (NumberFormatException e) {
            throw InvalidMetricsQueryException.of("project must be a numeric id, got [%s]", value);
        }
    }

    private PhysicalExpression tagColumn(String key, UseCaseConfig config) {
        if (Constants.PROJECT_TAG.equals(key)) {
            return Column.of(Constants.Columns.PROJECT_ID);
        }
        if (config.indexedTags()) {
            long keyId = indexer.resolve(config.useCase(), key).orElse(Constants.STRING_NOT_FOUND);
            return Column.subscript(Constants.Columns.TAGS, String.valueOf(keyId));
        }
        return Column.subscript(Constants.Columns.TAGS_RAW, key);
    }
}
