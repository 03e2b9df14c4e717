package com.platform.drcontrol.api.dto;

public record RegionProbeResponse(String region, boolean healthy) {
}
