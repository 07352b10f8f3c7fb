package com.gocomet.zonerevenue.aggregation.model;

import lombok.Builder;
import lombok.Value;

/**
 * Non-fatal finding about the trip snapshot. Logged and reported, never aborts a run.
 */
@Value
@Builder
public class DataQualityWarning {

    public enum Check {
        NULL_RATIO,
        PICKUP_AFTER_DROPOFF,
        TOTAL_AMOUNT_MISMATCH
    }

    Check check;
    String column;
    long affectedRows;
    long totalRows;
    double ratio;
    String message;
}
