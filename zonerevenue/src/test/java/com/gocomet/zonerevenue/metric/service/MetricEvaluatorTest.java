package com.gocomet.zonerevenue.metric.service;

import com.gocomet.zonerevenue.aggregation.config.AggregationProperties;
import com.gocomet.zonerevenue.aggregation.model.MonthlyZoneStatistic;
import com.gocomet.zonerevenue.aggregation.service.MonthlyAggregationEngine;
import com.gocomet.zonerevenue.aggregation.service.ZoneMonthGrouping;
import com.gocomet.zonerevenue.common.exception.MetricConfigurationException;
import com.gocomet.zonerevenue.metric.model.*;
import com.gocomet.zonerevenue.trip.model.Trip;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.gocomet.zonerevenue.trip.TripFixtures.at;
import static com.gocomet.zonerevenue.trip.TripFixtures.trip;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetricEvaluatorTest {

    private final MetricEvaluator evaluator = new MetricEvaluator();

    private static MetricDefinition.MetricDefinitionBuilder metric() {
        return MetricDefinition.builder()
                .name("average_trip_distance")
                .label("Average trip distance")
                .expression("trip_distance")
                .calculationMethod(CalculationMethod.AVERAGE)
                .timestamp("pickup_datetime")
                .timeGrains(List.of(TimeGrain.MONTH, TimeGrain.QUARTER, TimeGrain.YEAR));
    }

    @Test
    void averagesPerMonthIgnoringNulls() {
        List<Trip> trips = List.of(
                trip().pickupDatetime(at(2019, 1, 3)).tripDistance(2.0).build(),
                trip().pickupDatetime(at(2019, 1, 9)).tripDistance(4.0).build(),
                trip().pickupDatetime(at(2019, 1, 12)).tripDistance(null).build(),
                trip().pickupDatetime(at(2019, 3, 1)).tripDistance(1.5).build());

        MetricSeries series = evaluator.evaluate(metric().build(), TimeGrain.MONTH, trips);

        assertThat(series.getMetricName()).isEqualTo("average_trip_distance");
        assertThat(series.getGrain()).isEqualTo(TimeGrain.MONTH);
        assertThat(series.getPoints()).extracting(MetricPoint::getBucketStart)
                .containsExactly(LocalDate.of(2019, 1, 1), LocalDate.of(2019, 3, 1));
        assertThat(series.getPoints().get(0).getValue()).isEqualByComparingTo("3.0");
        assertThat(series.getPoints().get(1).getValue()).isEqualByComparingTo("1.5");
    }

    @Test
    void eachGrainIsAnIndependentSeries() {
        List<Trip> trips = List.of(
                trip().pickupDatetime(at(2019, 1, 3)).tripDistance(2.0).build(),
                trip().pickupDatetime(at(2019, 2, 9)).tripDistance(4.0).build(),
                trip().pickupDatetime(at(2019, 11, 30)).tripDistance(9.0).build());
        MetricDefinition definition = metric().calculationMethod(CalculationMethod.SUM).build();

        MetricSeries quarters = evaluator.evaluate(definition, TimeGrain.QUARTER, trips);
        MetricSeries years = evaluator.evaluate(definition, TimeGrain.YEAR, trips);

        assertThat(quarters.getPoints()).extracting(MetricPoint::getBucketStart)
                .containsExactly(LocalDate.of(2019, 1, 1), LocalDate.of(2019, 10, 1));
        assertThat(quarters.getPoints()).extracting(MetricPoint::getValue)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("6.0"), new BigDecimal("9.0"));
        assertThat(years.getPoints()).singleElement().satisfies(point -> {
            assertThat(point.getBucketStart()).isEqualTo(LocalDate.of(2019, 1, 1));
            assertThat(point.getValue()).isEqualByComparingTo("15.0");
        });
    }

    @Test
    void filtersAreAndedAndRejectRowsFailingAnyOne() {
        List<Trip> trips = List.of(
                trip().pickupBorough("Manhattan").dropoffBorough("Manhattan").build(),
                trip().pickupBorough("Manhattan").dropoffBorough("Queens").build(),
                trip().pickupBorough("Brooklyn").dropoffBorough("Manhattan").build(),
                trip().pickupBorough("Manhattan").dropoffBorough(null).build());
        MetricDefinition definition = metric()
                .name("manhattan_trip_count")
                .expression("tripid")
                .calculationMethod(CalculationMethod.COUNT)
                .filters(List.of(
                        MetricFilter.equalTo("pickup_borough", "'Manhattan'"),
                        MetricFilter.equalTo("dropoff_borough", "'Manhattan'")))
                .build();

        MetricSeries series = evaluator.evaluate(definition, TimeGrain.MONTH, trips);

        assertThat(series.getPoints()).singleElement()
                .extracting(MetricPoint::getValue)
                .satisfies(value -> assertThat(value).isEqualByComparingTo("1"));
    }

    @Test
    void monthlyCountMatchesZoneStatistics() {
        List<Trip> trips = List.of(
                trip().pickupZone("Midtown").pickupDatetime(at(2019, 1, 3)).build(),
                trip().pickupZone("Midtown").pickupDatetime(at(2019, 1, 25)).build(),
                trip().pickupZone("Midtown").pickupDatetime(at(2019, 2, 2)).build(),
                trip().pickupZone("Astoria").pickupDatetime(at(2019, 1, 4)).build(),
                trip().pickupZone("Midtown").pickupDatetime(at(2019, 5, 17)).serviceType("green").build());
        MonthlyAggregationEngine engine = new MonthlyAggregationEngine(new ZoneMonthGrouping(new AggregationProperties()));
        MetricDefinition midtownYellowCount = metric()
                .expression("tripid")
                .calculationMethod(CalculationMethod.COUNT)
                .filters(List.of(
                        MetricFilter.equalTo("pickup_zone", "'Midtown'"),
                        MetricFilter.equalTo("service_type", "'yellow'")))
                .build();

        Map<LocalDate, Long> expected = engine.computeStatistics(trips).stream()
                .filter(row -> row.getRevenueZone().equals("Midtown") && row.getServiceType().equals("yellow"))
                .collect(Collectors.toMap(MonthlyZoneStatistic::getRevenueMonth, MonthlyZoneStatistic::getTotalMonthlyTrips));
        Map<LocalDate, Long> actual = evaluator.evaluate(midtownYellowCount, TimeGrain.MONTH, trips).getPoints().stream()
                .collect(Collectors.toMap(MetricPoint::getBucketStart, point -> point.getValue().longValueExact()));

        assertThat(actual).isEqualTo(expected).hasSize(2);
    }

    @Test
    void otherOperatorsAndNumericLiterals() {
        List<Trip> trips = List.of(
                trip().passengerCount(1).paymentType(1).build(),
                trip().passengerCount(2).paymentType(2).build(),
                trip().passengerCount(null).paymentType(1).build());
        MetricDefinition.MetricDefinitionBuilder count = metric().expression("*").calculationMethod(CalculationMethod.COUNT);

        assertThat(single(count.filters(List.of(new MetricFilter("payment_type", FilterOperator.EQUALS, "1"))).build(), trips))
                .isEqualByComparingTo("2");
        assertThat(single(count.filters(List.of(new MetricFilter("passenger_count", FilterOperator.NOT_EQUALS, "1.0"))).build(), trips))
                .isEqualByComparingTo("1");
        assertThat(single(count.filters(List.of(new MetricFilter("passenger_count", FilterOperator.IS, "null"))).build(), trips))
                .isEqualByComparingTo("1");
        assertThat(single(count.filters(List.of(new MetricFilter("passenger_count", FilterOperator.IS_NOT, "NULL"))).build(), trips))
                .isEqualByComparingTo("2");
    }

    @Test
    void countDistinctMinAndMax() {
        List<Trip> trips = List.of(
                trip().pickupZone("Midtown").tripDistance(2.0).build(),
                trip().pickupZone("Astoria").tripDistance(7.5).build(),
                trip().pickupZone("Midtown").tripDistance(0.4).build());

        assertThat(single(metric().expression("pickup_zone").calculationMethod(CalculationMethod.COUNT_DISTINCT).build(), trips))
                .isEqualByComparingTo("2");
        assertThat(single(metric().calculationMethod(CalculationMethod.MIN).build(), trips))
                .isEqualByComparingTo("0.4");
        assertThat(single(metric().calculationMethod(CalculationMethod.MAX).build(), trips))
                .isEqualByComparingTo("7.5");
    }

    @Test
    void bucketsWithoutMatchingRowsAreAbsent() {
        List<Trip> trips = List.of(
                trip().pickupDatetime(at(2019, 1, 3)).build(),
                trip().pickupDatetime(at(2019, 6, 3)).pickupBorough("Queens").build(),
                trip().pickupDatetime(null).build());
        MetricDefinition definition = metric()
                .filters(List.of(MetricFilter.equalTo("pickup_borough", "'Manhattan'")))
                .build();

        assertThat(evaluator.evaluate(definition, TimeGrain.MONTH, trips).getPoints())
                .extracting(MetricPoint::getBucketStart)
                .containsExactly(LocalDate.of(2019, 1, 1));
        assertThat(evaluator.evaluate(definition, TimeGrain.MONTH, List.of()).getPoints()).isEmpty();
    }

    @Test
    void unknownTimestampColumnFailsInsteadOfReturningEmptySeries() {
        MetricDefinition definition = metric().timestamp("pickup_time").build();

        assertThatThrownBy(() -> evaluator.evaluate(definition, TimeGrain.MONTH, List.of()))
                .isInstanceOf(MetricConfigurationException.class)
                .hasMessageContaining("timestamp column 'pickup_time' does not exist");
    }

    @Test
    void nonTimestampColumnCannotBucket() {
        MetricDefinition definition = metric().timestamp("trip_distance").build();

        assertThatThrownBy(() -> evaluator.evaluate(definition, TimeGrain.MONTH, List.of(trip().build())))
                .isInstanceOf(MetricConfigurationException.class)
                .hasMessageContaining("is not a timestamp");
    }

    @Test
    void unknownExpressionColumnFails() {
        MetricDefinition definition = metric().expression("distance").build();

        assertThatThrownBy(() -> evaluator.evaluate(definition, TimeGrain.MONTH, List.of(trip().build())))
                .isInstanceOf(MetricConfigurationException.class)
                .hasMessageContaining("unknown column 'distance'");
    }

    @Test
    void undeclaredGrainFails() {
        MetricDefinition definition = metric().timeGrains(List.of(TimeGrain.MONTH)).build();

        assertThatThrownBy(() -> evaluator.evaluate(definition, TimeGrain.YEAR, List.of(trip().build())))
                .isInstanceOf(MetricConfigurationException.class)
                .hasMessageContaining("time grain YEAR");
    }

    @Test
    void invalidFiltersFail() {
        assertThatThrownBy(() -> evaluator.compile(metric()
                .filters(List.of(MetricFilter.equalTo("borough", "'Manhattan'"))).build()))
                .isInstanceOf(MetricConfigurationException.class)
                .hasMessageContaining("filter column 'borough'");
        assertThatThrownBy(() -> evaluator.compile(metric()
                .filters(List.of(MetricFilter.equalTo("passenger_count", "'two'"))).build()))
                .isInstanceOf(MetricConfigurationException.class)
                .hasMessageContaining("does not fit column type");
        assertThatThrownBy(() -> evaluator.compile(metric()
                .filters(List.of(MetricFilter.equalTo("pickup_borough", "null"))).build()))
                .isInstanceOf(MetricConfigurationException.class);
    }

    @Test
    void numericMethodsRejectTextExpressions() {
        assertThatThrownBy(() -> evaluator.compile(metric().expression("pickup_zone").build()))
                .isInstanceOf(MetricConfigurationException.class)
                .hasMessageContaining("needs a numeric expression");
        assertThatThrownBy(() -> evaluator.compile(metric().expression("*").build()))
                .isInstanceOf(MetricConfigurationException.class);
    }

    @Test
    void unsupportedModelFails() {
        assertThatThrownBy(() -> evaluator.compile(metric().model("dm_monthly_zone_revenue").build()))
                .isInstanceOf(MetricConfigurationException.class)
                .hasMessageContaining("unsupported model");
    }

    private BigDecimal single(MetricDefinition definition, List<Trip> trips) {
        List<MetricPoint> points = evaluator.evaluate(definition, TimeGrain.MONTH, trips).getPoints();
        assertThat(points).hasSize(1);
        return points.get(0).getValue();
    }
}
