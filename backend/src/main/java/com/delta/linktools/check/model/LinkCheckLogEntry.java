package com.delta.linktools.check.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LinkCheckLogEntry(
    String site,
    String status,
    String error,
    Instant ts
) {
}
