package com.gocomet.zonerevenue.metric.service;

import com.gocomet.zonerevenue.common.exception.MetricConfigurationException;
import com.gocomet.zonerevenue.metric.config.MetricProperties;
import com.gocomet.zonerevenue.metric.model.CalculationMethod;
import com.gocomet.zonerevenue.metric.model.FilterOperator;
import com.gocomet.zonerevenue.metric.model.MetricDefinition;
import com.gocomet.zonerevenue.metric.model.MetricFilter;
import com.gocomet.zonerevenue.metric.model.TimeGrain;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class MetricDefinitionFactory {

    /**
     * Convert one configured entry, rejecting unknown methods, grains and operators.
     */
    public MetricDefinition create(MetricProperties.Definition source) {
        String name = source.getName();
        if (name == null || name.isBlank()) {
            throw new MetricConfigurationException("<unnamed>", "name is required");
        }

        CalculationMethod method = CalculationMethod.find(source.getCalculationMethod())
                .orElseThrow(() -> new MetricConfigurationException(name,
                        "unsupported calculation method '" + source.getCalculationMethod() + "'"));

        List<TimeGrain> grains = source.getTimeGrains().stream()
                .map(grain -> TimeGrain.find(grain)
                        .orElseThrow(() -> new MetricConfigurationException(name,
                                "unsupported time grain '" + grain + "'")))
                .distinct()
                .toList();

        List<MetricFilter> filters = source.getFilters().stream()
                .map(filter -> new MetricFilter(filter.getField(),
                        FilterOperator.find(filter.getOperator())
                                .orElseThrow(() -> new MetricConfigurationException(name,
                                        "unsupported filter operator '" + filter.getOperator() + "'")),
                        filter.getValue()))
                .toList();

        MetricDefinition.MetricDefinitionBuilder builder = MetricDefinition.builder()
                .name(name)
                .label(source.getLabel() != null ? source.getLabel() : name)
                .description(source.getDescription())
                .expression(source.getExpression())
                .calculationMethod(method)
                .timestamp(source.getTimestamp())
                .timeGrains(grains)
                .filters(filters);
        if (source.getModel() != null) {
            builder.model(source.getModel());
        }
        return builder.build();
    }
}
