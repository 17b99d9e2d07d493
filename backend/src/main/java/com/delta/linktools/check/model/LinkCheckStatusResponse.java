package com.delta.linktools.check.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record LinkCheckStatusResponse(
    boolean running,
    int total,
    int checked,
    int totalSites,
    int checkedSites,
    Map<String, Integer> counts,
    List<LinkCheckLogEntry> log,
    Instant startedAt,
    Instant finishedAt
) {
}
