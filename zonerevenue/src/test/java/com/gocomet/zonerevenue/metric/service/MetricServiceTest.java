package com.gocomet.zonerevenue.metric.service;

import com.gocomet.zonerevenue.common.exception.MetricConfigurationException;
import com.gocomet.zonerevenue.common.exception.ResourceNotFoundException;
import com.gocomet.zonerevenue.metric.config.MetricProperties;
import com.gocomet.zonerevenue.metric.dto.MetricDefinitionResponse;
import com.gocomet.zonerevenue.metric.dto.MetricResultResponse;
import com.gocomet.zonerevenue.metric.dto.MetricResultResponse.Status;
import com.gocomet.zonerevenue.metric.model.MetricSeries;
import com.gocomet.zonerevenue.metric.model.TimeGrain;
import com.gocomet.zonerevenue.trip.service.TripSnapshotReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.gocomet.zonerevenue.metric.service.MetricDefinitionFactoryTest.source;
import static com.gocomet.zonerevenue.trip.TripFixtures.at;
import static com.gocomet.zonerevenue.trip.TripFixtures.trip;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MetricServiceTest {

    @Mock
    private TripSnapshotReader snapshotReader;

    private MetricProperties properties;
    private MetricService service;

    @BeforeEach
    void setUp() {
        properties = new MetricProperties();
        properties.setDefinitions(List.of(
                source("total_distance", "sum", "month", "year"),
                source("broken_method", "median", "month"),
                withTimestamp(source("broken_timestamp", "count", "month"), "pickup_time")));
        service = new MetricService(properties, new MetricDefinitionFactory(), new MetricEvaluator(), snapshotReader);
    }

    @Test
    void oneBadDefinitionDoesNotBlockTheOthers() {
        when(snapshotReader.readSnapshot()).thenReturn(List.of(
                trip().pickupDatetime(at(2019, 1, 5)).tripDistance(2.0).build(),
                trip().pickupDatetime(at(2019, 7, 5)).tripDistance(3.0).build()));

        List<MetricResultResponse> results = service.evaluateAll(List.of("month", "year"));

        assertThat(results).extracting(MetricResultResponse::getMetricName, MetricResultResponse::getGrain,
                        MetricResultResponse::getStatus)
                .containsExactly(
                        tuple("total_distance", "month", Status.SUCCEEDED),
                        tuple("total_distance", "year", Status.SUCCEEDED),
                        tuple("broken_method", "month", Status.FAILED),
                        tuple("broken_method", "year", Status.FAILED),
                        tuple("broken_timestamp", "month", Status.FAILED),
                        tuple("broken_timestamp", "year", Status.FAILED));
        assertThat(results.get(0).getPoints()).hasSize(2);
        assertThat(results.get(1).getPoints()).singleElement()
                .satisfies(point -> assertThat(point.getValue()).isEqualByComparingTo("5.0"));
        assertThat(results.get(4).getError()).contains("timestamp column 'pickup_time' does not exist");
        verify(snapshotReader, times(1)).readSnapshot();
    }

    @Test
    void undeclaredGrainFailsOnlyThatSeries() {
        when(snapshotReader.readSnapshot()).thenReturn(List.of(trip().build()));
        properties.setDefinitions(List.of(source("total_distance", "sum", "month")));

        List<MetricResultResponse> results = service.evaluateAll(List.of("month", "quarter", "decade"));

        assertThat(results).extracting(MetricResultResponse::getStatus)
                .containsExactly(Status.SUCCEEDED, Status.FAILED, Status.FAILED);
    }

    @Test
    void nonFiniteDistanceFailsOnlyTheMetricsReadingIt() {
        when(snapshotReader.readSnapshot()).thenReturn(List.of(
                trip().pickupDatetime(at(2019, 1, 5)).tripDistance(Double.NaN).build(),
                trip().pickupDatetime(at(2019, 1, 9)).tripDistance(1.5).build()));
        MetricProperties.Definition tripCount = source("trip_count", "count", "month");
        tripCount.setExpression("tripid");
        properties.setDefinitions(List.of(source("total_distance", "sum", "month"), tripCount));

        List<MetricResultResponse> results = service.evaluateAll(List.of("month"));

        assertThat(results).extracting(MetricResultResponse::getMetricName, MetricResultResponse::getStatus)
                .containsExactly(
                        tuple("total_distance", Status.FAILED),
                        tuple("trip_count", Status.SUCCEEDED));
        assertThat(results.get(0).getError()).contains("NaN");
        assertThat(results.get(1).getPoints()).singleElement()
                .satisfies(point -> assertThat(point.getValue()).isEqualByComparingTo("2"));
    }

    @Test
    void evaluatesSingleMetric() {
        when(snapshotReader.readSnapshot()).thenReturn(List.of(trip().tripDistance(4.0).build()));

        MetricSeries series = service.evaluate("total_distance", "Year");

        assertThat(series.getGrain()).isEqualTo(TimeGrain.YEAR);
        assertThat(series.getPoints()).hasSize(1);
    }

    @Test
    void singleMetricErrors() {
        assertThatThrownBy(() -> service.evaluate("nope", "month"))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> service.evaluate("broken_method", "month"))
                .isInstanceOf(MetricConfigurationException.class);
        assertThatThrownBy(() -> service.evaluate("total_distance", "fortnight"))
                .isInstanceOf(MetricConfigurationException.class);
        verifyNoInteractions(snapshotReader);
    }

    @Test
    void listsDefinitionsWithValidity() {
        List<MetricDefinitionResponse> definitions = service.getDefinitions();

        assertThat(definitions).extracting(MetricDefinitionResponse::getName, MetricDefinitionResponse::isValid)
                .containsExactly(
                        tuple("total_distance", true),
                        tuple("broken_method", false),
                        tuple("broken_timestamp", false));
        assertThat(definitions.get(0).getTimeGrains()).containsExactly("month", "year");
    }

    private static MetricProperties.Definition withTimestamp(MetricProperties.Definition source, String timestamp) {
        source.setTimestamp(timestamp);
        return source;
    }
}
