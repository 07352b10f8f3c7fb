package com.gocomet.zonerevenue.aggregation.config;

import jakarta.validation.constraints.AssertTrue;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.ZoneId;

/**
 * Month truncation settings. With both zones unset, pickup timestamps are
 * truncated as stored, with no time zone conversion. Setting only one of the
 * two fails binding at startup.
 */
@ConfigurationProperties(prefix = "app.aggregation")
@Validated
@Getter
@Setter
public class AggregationProperties {

    /** Zone the stored pickup timestamps are recorded in. */
    private ZoneId sourceTimeZone;

    /** Zone months are cut in. */
    private ZoneId bucketTimeZone;

    @AssertTrue(message = "source-time-zone and bucket-time-zone must be set together")
    public boolean isTimeZonePairComplete() {
        return (sourceTimeZone == null) == (bucketTimeZone == null);
    }

    public boolean convertsTimeZone() {
        return sourceTimeZone != null && bucketTimeZone != null && !sourceTimeZone.equals(bucketTimeZone);
    }
}
