package com.example.regreport.model;

import lombok.Builder;

@Builder
public record ClassifiedPosition(
        InvestmentPosition position,
        String positionKey,
        PositionMapping mapping
) {

    public RegulatoryAttributes attributes() {
        return mapping == null ? RegulatoryAttributes.EMPTY : mapping.attributes();
    }
}
