package com.delta.linktools.check.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DomainCheckLogEntry(
    String domain,
    String status,
    int linksCount,
    String error,
    Instant ts
) {
}
