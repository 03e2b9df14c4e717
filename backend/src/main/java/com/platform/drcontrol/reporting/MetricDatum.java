package com.platform.drcontrol.reporting;

import java.time.Instant;

/**
 * One data point as accepted by the external metrics collector.
 */
public record MetricDatum(
    String namespace,
    String metricName,
    double value,
    MetricUnit unit,
    Instant timestamp
) {
}
