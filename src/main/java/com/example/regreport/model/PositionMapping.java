package com.example.regreport.model;

import lombok.Builder;

/**
 * Position-level mapping row, keyed on security id + investment type + LT/ST flag.
 */
@Builder
public record PositionMapping(
        String key,
        RegulatoryAttributes attributes
) {
}
