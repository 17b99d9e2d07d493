package com.delta.linktools.check.service;

import com.delta.linktools.check.model.JobStatusSnapshot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Progress and results of the current run of one engine. Every field is guarded by a single lock;
 * readers get immutable snapshots and never see a half-published result set.
 *
 * <p>Each run gets a generation number when it claims the slot. Writes carrying an older generation
 * are dropped, so a batch left running after an advisory stop cannot touch the next run's state.
 */
public class JobStatusStore<R, L> {
    private final Object lock = new Object();

    private long generation;
    private boolean running;
    private int total;
    private int checked;
    private int totalUnits;
    private int checkedUnits;
    private List<R> results = List.of();
    private Map<String, Integer> counts = Map.of();
    private List<L> log = new ArrayList<>();
    private Instant startedAt;
    private Instant finishedAt;

    /**
     * Claims the slot and resets all state for a new run.
     *
     * @return the new run's generation, or empty when a run is already active
     */
    public OptionalLong tryStart(int total, int totalUnits) {
        synchronized (lock) {
            if (running) {
                return OptionalLong.empty();
            }
            generation++;
            running = true;
            this.total = total;
            this.checked = 0;
            this.totalUnits = totalUnits;
            this.checkedUnits = 0;
            this.results = List.of();
            this.counts = Map.of();
            this.log = new ArrayList<>();
            this.startedAt = Instant.now();
            this.finishedAt = null;
            return OptionalLong.of(generation);
        }
    }

    /**
     * Records one completed unit covering {@code items} input items.
     *
     * @return false when the write belongs to a superseded run and was dropped
     */
    public boolean recordUnit(long runGeneration, int items, L entry) {
        synchronized (lock) {
            if (runGeneration != generation) {
                return false;
            }
            checkedUnits++;
            checked += items;
            log.add(entry);
            return true;
        }
    }

    /**
     * Publishes the final results and counts and releases the slot in one step.
     */
    public boolean publish(long runGeneration, List<R> finalResults, Map<String, Integer> finalCounts) {
        synchronized (lock) {
            if (runGeneration != generation) {
                return false;
            }
            results = List.copyOf(finalResults);
            counts = Collections.unmodifiableMap(new LinkedHashMap<>(finalCounts));
            running = false;
            finishedAt = Instant.now();
            return true;
        }
    }

    /**
     * Releases the slot without publishing; used when a run dies before it can publish.
     */
    public void finish(long runGeneration) {
        synchronized (lock) {
            if (runGeneration == generation && running) {
                running = false;
                finishedAt = Instant.now();
            }
        }
    }

    /**
     * Advisory stop: clears {@code running} so a new run may start. In-flight work is not interrupted.
     *
     * @return whether a run was marked running
     */
    public boolean requestStop() {
        synchronized (lock) {
            boolean wasRunning = running;
            running = false;
            return wasRunning;
        }
    }

    public boolean isRunning() {
        synchronized (lock) {
            return running;
        }
    }

    public JobStatusSnapshot<R, L> snapshot() {
        synchronized (lock) {
            return new JobStatusSnapshot<>(
                running,
                total,
                checked,
                totalUnits,
                checkedUnits,
                counts,
                log,
                results,
                startedAt,
                finishedAt
            );
        }
    }
}
