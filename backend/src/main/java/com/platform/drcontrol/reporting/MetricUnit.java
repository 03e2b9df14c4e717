package com.platform.drcontrol.reporting;

/**
 * Units understood by the external metrics collector.
 */
public enum MetricUnit {
    PERCENT("Percent"),
    COUNT("Count"),
    SECONDS("Seconds"),
    NONE("None");
    
    private final String collectorName;
    
    MetricUnit(String collectorName) {
        this.collectorName = collectorName;
    }
    
    public String collectorName() {
        return collectorName;
    }
}
