package com.platform.drcontrol.model;

import com.platform.drcontrol.error.ValidationException;

import java.util.Objects;

/**
 * The primary (source of truth) and secondary (DR) regions of one validation run.
 */
public record RegionPair(Region primary, Region secondary) {
    
    public RegionPair {
        Objects.requireNonNull(primary, "primary");
        Objects.requireNonNull(secondary, "secondary");
        if (primary.equals(secondary)) {
            throw new ValidationException("target_region", secondary.id(),
                "target region must differ from source region");
        }
    }
}
