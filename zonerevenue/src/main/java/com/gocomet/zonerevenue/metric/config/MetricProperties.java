package com.gocomet.zonerevenue.metric.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Metric definitions as written in configuration. Values stay textual here;
 * {@code MetricDefinitionFactory} turns them into typed definitions one at a
 * time so that one bad entry cannot block the others.
 */
@ConfigurationProperties(prefix = "app.metrics")
@Getter
@Setter
public class MetricProperties {

    private List<Definition> definitions = new ArrayList<>();

    @Getter
    @Setter
    public static class Definition {
        private String name;
        private String label;
        private String description;
        private String model;
        private String expression;
        private String calculationMethod;
        private String timestamp;
        private List<String> timeGrains = new ArrayList<>();
        private List<Filter> filters = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Filter {
        private String field;
        private String operator;
        private String value;
    }
}
