package com.example.legalrag.util;

/**
 * Outcome of one fallback strategy: a value tagged with where it came from, or the failure it raised.
 */
public interface Attempt<T> {

    String source();

    record Success<T>(String source, T value) implements Attempt<T> {}

    record Failure<T>(String source, Throwable cause) implements Attempt<T> {}

    static <T> Attempt<T> success(String source, T value) {
        return new Success<>(source, value);
    }

    static <T> Attempt<T> failure(String source, Throwable cause) {
        return new Failure<>(source, cause);
    }
}
