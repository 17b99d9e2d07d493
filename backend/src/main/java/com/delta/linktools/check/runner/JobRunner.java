package com.delta.linktools.check.runner;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded-concurrency dispatcher: runs up to {@code concurrency} units at once on a pool owned by
 * the returned batch. Units are never retried; a failed unit yields one error outcome.
 */
@Component
public class JobRunner {

    public <K, R> CompletionBatch<K, R> start(String name, List<WorkItem<K, R>> units, int concurrency) {
        int workers = Math.max(1, Math.min(concurrency, Math.max(1, units.size())));
        ExecutorService pool = Executors.newFixedThreadPool(workers, namedThreads(name));
        try {
            return new CompletionBatch<>(pool, units);
        } catch (RuntimeException e) {
            pool.shutdownNow();
            throw e;
        }
    }

    private static ThreadFactory namedThreads(String name) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, name + "-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
