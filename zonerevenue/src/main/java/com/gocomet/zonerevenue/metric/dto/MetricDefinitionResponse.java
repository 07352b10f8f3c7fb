package com.gocomet.zonerevenue.metric.dto;

import lombok.*;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MetricDefinitionResponse {

    private String name;
    private String label;
    private String description;
    private String model;
    private String expression;
    private String calculationMethod;
    private String timestamp;
    private List<String> timeGrains;
    private List<String> filters;
    private boolean valid;
    private String error;
}
