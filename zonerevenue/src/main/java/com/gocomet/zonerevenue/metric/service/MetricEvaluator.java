package com.gocomet.zonerevenue.metric.service;

import com.gocomet.zonerevenue.common.aggregate.Accumulator;
import com.gocomet.zonerevenue.common.aggregate.Numbers;
import com.gocomet.zonerevenue.common.exception.MetricConfigurationException;
import com.gocomet.zonerevenue.metric.model.*;
import com.gocomet.zonerevenue.trip.model.ColumnType;
import com.gocomet.zonerevenue.trip.model.Trip;
import com.gocomet.zonerevenue.trip.model.TripColumn;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Computes one time series per (metric, grain) over a trip snapshot.
 *
 * The definition is resolved against {@link TripColumn} before any row is
 * read, so a bad column name fails the metric instead of yielding an empty
 * series. Rows are filtered first, then bucketed by the truncated timestamp,
 * then folded with the calculation method. Only buckets that received at least
 * one filtered row are emitted.
 */
@Component
@Slf4j
public class MetricEvaluator {

    public static final String FACT_MODEL = "fact_trips";

    public MetricSeries evaluate(MetricDefinition definition, TimeGrain grain, Collection<Trip> trips) {
        CompiledMetric metric = compile(definition);
        if (grain == null || !definition.getTimeGrains().contains(grain)) {
            throw new MetricConfigurationException(definition.getName(),
                    "time grain " + grain + " is not one of " + definition.getTimeGrains());
        }

        long started = System.nanoTime();
        Map<LocalDate, Accumulator> buckets = new TreeMap<>();
        for (Trip trip : trips) {
            if (!metric.filter.test(trip)) {
                continue;
            }
            LocalDateTime timestamp = (LocalDateTime) metric.timestamp.read(trip);
            if (timestamp == null) {
                continue;
            }
            buckets.computeIfAbsent(grain.truncate(timestamp), bucket -> definition.getCalculationMethod().newAccumulator())
                    .add(metric.expression.evaluate(trip));
        }

        List<MetricPoint> points = new ArrayList<>(buckets.size());
        buckets.forEach((bucket, accumulator) -> points.add(new MetricPoint(bucket, toValue(accumulator.result()))));
        log.debug("Metric {} at grain {} → {} points in {} µs",
                definition.getName(), grain.label(), points.size(), (System.nanoTime() - started) / 1_000);

        return MetricSeries.builder()
                .metricName(definition.getName())
                .label(definition.getLabel())
                .calculationMethod(definition.getCalculationMethod())
                .grain(grain)
                .points(List.copyOf(points))
                .build();
    }

    /**
     * Resolve every reference in the definition.
     *
     * @throws MetricConfigurationException on the first unresolvable reference
     */
    CompiledMetric compile(MetricDefinition definition) {
        String name = definition.getName();
        if (definition.getModel() != null && !FACT_MODEL.equalsIgnoreCase(definition.getModel().trim())) {
            throw new MetricConfigurationException(name, "unsupported model '" + definition.getModel() + "'");
        }
        if (definition.getCalculationMethod() == null) {
            throw new MetricConfigurationException(name, "calculation method is missing");
        }
        if (definition.getTimeGrains() == null || definition.getTimeGrains().isEmpty()) {
            throw new MetricConfigurationException(name, "no time grains declared");
        }

        TripColumn timestamp = TripColumn.find(definition.getTimestamp())
                .orElseThrow(() -> new MetricConfigurationException(name,
                        "timestamp column '" + definition.getTimestamp() + "' does not exist"));
        if (timestamp.type() != ColumnType.TIMESTAMP) {
            throw new MetricConfigurationException(name,
                    "timestamp column '" + timestamp.columnName() + "' is not a timestamp");
        }

        MetricExpression expression = MetricExpression.parse(name, definition.getExpression());
        CalculationMethod method = definition.getCalculationMethod();
        if (expression.isRow() && method != CalculationMethod.COUNT) {
            throw new MetricConfigurationException(name, "'*' can only be counted");
        }
        if (method.isNumericOnly() && !expression.type().isNumeric()) {
            throw new MetricConfigurationException(name,
                    method.label() + " needs a numeric expression, got '" + expression + "'");
        }

        Predicate<Trip> filter = trip -> true;
        for (MetricFilter metricFilter : definition.getFilters()) {
            filter = filter.and(compileFilter(name, metricFilter));
        }
        return new CompiledMetric(timestamp, expression, filter);
    }

    private Predicate<Trip> compileFilter(String name, MetricFilter metricFilter) {
        TripColumn column = TripColumn.find(metricFilter.getField())
                .orElseThrow(() -> new MetricConfigurationException(name,
                        "filter column '" + metricFilter.getField() + "' does not exist"));
        FilterOperator operator = metricFilter.getOperator();
        if (operator == null) {
            throw new MetricConfigurationException(name, "filter on '" + column.columnName() + "' has no operator");
        }
        String literal = metricFilter.literal();
        if (operator.comparesWithNull() != (literal == null)) {
            throw new MetricConfigurationException(name, "filter '" + metricFilter + "' compares "
                    + (literal == null ? "with null using " + operator.symbol() : "a value using " + operator.symbol()));
        }

        Object expected;
        try {
            expected = column.type().coerce(literal);
        } catch (IllegalArgumentException e) {
            throw new MetricConfigurationException(name,
                    "filter '" + metricFilter + "' does not fit column type " + column.type(), e);
        }

        return switch (operator) {
            case IS -> trip -> column.read(trip) == null;
            case IS_NOT -> trip -> column.read(trip) != null;
            case EQUALS -> trip -> matches(column, trip, expected);
            case NOT_EQUALS -> trip -> column.read(trip) != null && !matches(column, trip, expected);
        };
    }

    private static boolean matches(TripColumn column, Trip trip, Object expected) {
        Object actual = column.type().normalize(column.read(trip));
        if (actual == null) {
            return false;
        }
        if (actual instanceof BigDecimal number) {
            return number.compareTo((BigDecimal) expected) == 0;
        }
        return actual.equals(expected);
    }

    private static BigDecimal toValue(Object result) {
        return result == null ? null : Numbers.toBigDecimal(result);
    }

    static final class CompiledMetric {
        final TripColumn timestamp;
        final MetricExpression expression;
        final Predicate<Trip> filter;

        CompiledMetric(TripColumn timestamp, MetricExpression expression, Predicate<Trip> filter) {
            this.timestamp = timestamp;
            this.expression = expression;
            this.filter = filter;
        }
    }
}
