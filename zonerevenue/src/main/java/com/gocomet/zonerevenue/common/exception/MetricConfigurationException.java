package com.gocomet.zonerevenue.common.exception;

/**
 * A metric definition references something that does not exist or is not
 * supported. Fatal for that metric only.
 */
public class MetricConfigurationException extends RuntimeException {

    private final String metricName;

    public MetricConfigurationException(String metricName, String message) {
        super(String.format("Metric '%s' is misconfigured: %s", metricName, message));
        this.metricName = metricName;
    }

    public MetricConfigurationException(String metricName, String message, Throwable cause) {
        super(String.format("Metric '%s' is misconfigured: %s", metricName, message), cause);
        this.metricName = metricName;
    }

    public String getMetricName() {
        return metricName;
    }
}
