package com.example.regreport.model;

import lombok.Builder;

@Builder
public record ClassifiedAccount(
        AccountBalance account,
        String accountKey,
        AccountMapping mapping
) {

    public RegulatoryAttributes attributes() {
        return mapping == null || mapping.attributes() == null ? RegulatoryAttributes.EMPTY : mapping.attributes();
    }

    public InstrumentDetails details() {
        return mapping == null || mapping.details() == null ? InstrumentDetails.EMPTY : mapping.details();
    }
}
