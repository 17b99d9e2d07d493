package com.delta.linktools.check.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable copy of an engine's job state taken under the store lock.
 */
public record JobStatusSnapshot<R, L>(
    boolean running,
    int total,
    int checked,
    int totalUnits,
    int checkedUnits,
    Map<String, Integer> counts,
    List<L> log,
    List<R> results,
    Instant startedAt,
    Instant finishedAt
) {
    public JobStatusSnapshot {
        counts = counts == null ? Map.of() : counts;
        log = log == null ? List.of() : List.copyOf(log);
        results = results == null ? List.of() : List.copyOf(results);
    }
}
