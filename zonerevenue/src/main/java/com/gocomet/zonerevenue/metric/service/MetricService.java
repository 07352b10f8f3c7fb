package com.gocomet.zonerevenue.metric.service;

import com.gocomet.zonerevenue.common.exception.MetricConfigurationException;
import com.gocomet.zonerevenue.common.exception.ResourceNotFoundException;
import com.gocomet.zonerevenue.metric.config.MetricProperties;
import com.gocomet.zonerevenue.metric.dto.MetricDefinitionResponse;
import com.gocomet.zonerevenue.metric.dto.MetricResultResponse;
import com.gocomet.zonerevenue.metric.dto.MetricResultResponse.Status;
import com.gocomet.zonerevenue.metric.model.MetricDefinition;
import com.gocomet.zonerevenue.metric.model.MetricFilter;
import com.gocomet.zonerevenue.metric.model.MetricSeries;
import com.gocomet.zonerevenue.metric.model.TimeGrain;
import com.gocomet.zonerevenue.trip.model.Trip;
import com.gocomet.zonerevenue.trip.service.TripSnapshotReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class MetricService {

    private final MetricProperties metricProperties;
    private final MetricDefinitionFactory definitionFactory;
    private final MetricEvaluator metricEvaluator;
    private final TripSnapshotReader snapshotReader;

    /**
     * List configured metrics, flagging the ones that cannot be evaluated.
     */
    public List<MetricDefinitionResponse> getDefinitions() {
        List<MetricDefinitionResponse> responses = new ArrayList<>();
        for (MetricProperties.Definition source : metricProperties.getDefinitions()) {
            try {
                MetricDefinition definition = definitionFactory.create(source);
                metricEvaluator.compile(definition);
                responses.add(toResponse(definition, null));
            } catch (MetricConfigurationException e) {
                responses.add(MetricDefinitionResponse.builder()
                        .name(source.getName())
                        .label(source.getLabel())
                        .expression(source.getExpression())
                        .calculationMethod(source.getCalculationMethod())
                        .timestamp(source.getTimestamp())
                        .timeGrains(source.getTimeGrains())
                        .valid(false)
                        .error(e.getMessage())
                        .build());
            }
        }
        return responses;
    }

    /**
     * Evaluate one metric at one grain over the current fact table.
     */
    public MetricSeries evaluate(String name, String grain) {
        MetricDefinition definition = definitionFactory.create(findSource(name));
        TimeGrain timeGrain = TimeGrain.find(grain)
                .orElseThrow(() -> new MetricConfigurationException(name, "unsupported time grain '" + grain + "'"));
        return metricEvaluator.evaluate(definition, timeGrain, snapshotReader.readSnapshot());
    }

    /**
     * Evaluate every configured metric at each requested grain, all over one
     * snapshot. A metric that cannot be evaluated yields FAILED results and does
     * not stop the rest.
     */
    public List<MetricResultResponse> evaluateAll(List<String> grains) {
        List<Trip> snapshot = snapshotReader.readSnapshot();
        List<MetricResultResponse> results = new ArrayList<>();

        for (MetricProperties.Definition source : metricProperties.getDefinitions()) {
            MetricDefinition definition;
            try {
                definition = definitionFactory.create(source);
            } catch (MetricConfigurationException e) {
                log.warn("Skipping metric {}: {}", source.getName(), e.getMessage());
                grains.forEach(grain -> results.add(failed(source.getName(), grain, e)));
                continue;
            }

            for (String grain : grains) {
                try {
                    TimeGrain timeGrain = TimeGrain.find(grain)
                            .orElseThrow(() -> new MetricConfigurationException(definition.getName(),
                                    "unsupported time grain '" + grain + "'"));
                    MetricSeries series = metricEvaluator.evaluate(definition, timeGrain, snapshot);
                    results.add(MetricResultResponse.builder()
                            .metricName(series.getMetricName())
                            .grain(timeGrain.label())
                            .status(Status.SUCCEEDED)
                            .points(series.getPoints())
                            .build());
                } catch (RuntimeException e) {
                    // bad configuration, or data the method cannot fold (e.g. a NaN trip_distance)
                    log.warn("Metric {} failed at grain {}: {}", definition.getName(), grain, e.getMessage());
                    results.add(failed(definition.getName(), grain, e));
                }
            }
        }

        log.info("Evaluated {} metric series over {} trips", results.size(), snapshot.size());
        return results;
    }

    private MetricProperties.Definition findSource(String name) {
        return metricProperties.getDefinitions().stream()
                .filter(source -> name.equals(source.getName()))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("Metric", "name", name));
    }

    private static MetricResultResponse failed(String name, String grain, RuntimeException e) {
        return MetricResultResponse.builder()
                .metricName(name)
                .grain(grain)
                .status(Status.FAILED)
                .points(List.of())
                .error(e.getMessage())
                .build();
    }

    private MetricDefinitionResponse toResponse(MetricDefinition definition, String error) {
        return MetricDefinitionResponse.builder()
                .name(definition.getName())
                .label(definition.getLabel())
                .description(definition.getDescription())
                .model(definition.getModel())
                .expression(definition.getExpression())
                .calculationMethod(definition.getCalculationMethod().label())
                .timestamp(definition.getTimestamp())
                .timeGrains(definition.getTimeGrains().stream().map(TimeGrain::label).toList())
                .filters(definition.getFilters().stream().map(MetricFilter::toString).toList())
                .valid(error == null)
                .error(error)
                .build();
    }
}
