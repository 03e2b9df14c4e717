package com.platform.drcontrol.probe;

import com.platform.drcontrol.model.Region;

/**
 * Answers whether a region is reachable for core storage operations right now.
 * 
 * Implementations never throw: any error or timeout is reported as {@code false}.
 * Safe to call concurrently for different regions.
 */
public interface RegionHealthProbe {
    
    boolean probe(Region region);
}
