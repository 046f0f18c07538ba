package com.example.regreport.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * Inbound run request; a missing report date means the default quarter end.
 */
public record ReportRunRequest(

        @JsonProperty("report_date")
        LocalDate reportDate,

        @JsonProperty("requested_by")
        String requestedBy
) {
}
