package com.gocomet.zonerevenue.aggregation.dto;

import com.gocomet.zonerevenue.aggregation.model.DataQualityWarning;
import lombok.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AggregationRunResponse {

    private UUID runId;
    private Instant startedAt;
    private Instant finishedAt;
    private long tripCount;
    private int statisticRows;
    private int revenueRows;
    private List<DataQualityWarning> warnings;
}
