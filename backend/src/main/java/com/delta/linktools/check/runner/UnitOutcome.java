package com.delta.linktools.check.runner;

/**
 * Terminal outcome of one unit: exactly one of {@code result} or {@code error} is meaningful.
 */
public record UnitOutcome<K, R>(K id, R result, Throwable error) {

    public static <K, R> UnitOutcome<K, R> success(K id, R result) {
        return new UnitOutcome<>(id, result, null);
    }

    public static <K, R> UnitOutcome<K, R> failure(K id, Throwable error) {
        return new UnitOutcome<>(id, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
