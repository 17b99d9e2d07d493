package com.delta.linktools.check.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record DomainCheckStatusResponse(
    boolean running,
    int total,
    int checked,
    Map<String, Integer> counts,
    List<DomainCheckLogEntry> log,
    Instant startedAt,
    Instant finishedAt
) {
}
