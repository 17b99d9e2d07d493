package com.delta.linktools.check.runner;

import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Outcomes of a dispatched set of units, yielded in completion order. Each unit produces exactly one
 * outcome; the batch is single-use and shuts its worker pool down when closed.
 *
 * <p>Outcomes are consumed by a single thread (the supervising task of a run).
 */
public class CompletionBatch<K, R> implements Iterator<UnitOutcome<K, R>>, AutoCloseable {
    private final ExecutorService pool;
    private final ExecutorCompletionService<R> completion;
    private final Map<Future<R>, K> ids = new IdentityHashMap<>();
    private int remaining;

    CompletionBatch(ExecutorService pool, List<WorkItem<K, R>> units) {
        this.pool = pool;
        this.completion = new ExecutorCompletionService<>(pool);
        for (WorkItem<K, R> unit : units) {
            ids.put(completion.submit(unit.task()), unit.id());
            remaining++;
        }
    }

    public int size() {
        return ids.size();
    }

    @Override
    public boolean hasNext() {
        return remaining > 0;
    }

    /**
     * Blocks until the next unit finishes.
     *
     * @throws NoSuchElementException when every outcome has been consumed
     */
    @Override
    public UnitOutcome<K, R> next() {
        if (remaining <= 0) {
            throw new NoSuchElementException("all units have completed");
        }
        Future<R> future;
        try {
            future = completion.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the next unit", e);
        }
        remaining--;
        K id = ids.get(future);
        try {
            return UnitOutcome.success(id, future.get());
        } catch (ExecutionException e) {
            return UnitOutcome.failure(id, e.getCause() == null ? e : e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return UnitOutcome.failure(id, e);
        }
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }
}
