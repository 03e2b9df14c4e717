package com.platform.drcontrol.reporting;

import com.platform.drcontrol.error.BackendUnavailableException;

/**
 * Transport to the external metrics collector.
 */
public interface MetricsCollectorClient {
    
    /**
     * Send a single datum, at most once.
     *
     * @throws BackendUnavailableException when the collector rejects or cannot be reached
     */
    void send(MetricDatum datum);
}
