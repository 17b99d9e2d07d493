package com.delta.linktools.check.runner;

import java.util.concurrent.Callable;

/**
 * One independent unit of work, identified by {@code id} when its outcome is reported.
 */
public record WorkItem<K, R>(K id, Callable<R> task) {
}
