package com.gocomet.zonerevenue.metric.dto;

import com.gocomet.zonerevenue.metric.model.MetricPoint;
import lombok.*;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MetricResultResponse {

    private String metricName;
    private String grain;
    private Status status;
    private List<MetricPoint> points;
    private String error; // FAILED only

    public enum Status {
        SUCCEEDED,
        FAILED
    }
}
