package com.platform.drcontrol.reporting;

import com.platform.drcontrol.config.DrControlProperties;
import com.platform.drcontrol.connectors.dynamodb.RegionalClientFactory;
import com.platform.drcontrol.error.BackendUnavailableException;
import com.platform.drcontrol.model.Region;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.cloudwatch.model.MetricDatum;
import software.amazon.awssdk.services.cloudwatch.model.PutMetricDataRequest;
import software.amazon.awssdk.services.cloudwatch.model.StandardUnit;

/**
 * CloudWatch transport. Data points go to the collector of the region this control plane runs in.
 */
@Slf4j
@Component
public class CloudWatchMetricsCollector implements MetricsCollectorClient {
    
    private final RegionalClientFactory clientFactory;
    private final Region collectorRegion;
    
    public CloudWatchMetricsCollector(RegionalClientFactory clientFactory, DrControlProperties properties) {
        this.clientFactory = clientFactory;
        this.collectorRegion = Region.parse("drcontrol.current-region", properties.getCurrentRegion());
    }
    
    @Override
    public void send(com.platform.drcontrol.reporting.MetricDatum datum) {
        try {
            clientFactory.cloudWatch(collectorRegion).putMetricData(PutMetricDataRequest.builder()
                .namespace(datum.namespace())
                .metricData(MetricDatum.builder()
                    .metricName(datum.metricName())
                    .value(datum.value())
                    .unit(StandardUnit.fromValue(datum.unit().collectorName()))
                    .timestamp(datum.timestamp())
                    .build())
                .build());
            log.debug("Sent {}={} to {}/{}", datum.metricName(), datum.value(), datum.namespace(), collectorRegion);
        } catch (SdkException e) {
            throw BackendUnavailableException.metricsCollector(collectorRegion.id(), datum.metricName(), e);
        }
    }
}
