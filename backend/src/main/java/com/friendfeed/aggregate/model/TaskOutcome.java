package com.friendfeed.aggregate.model;

/**
 * Result of one scheduled task: exactly one of {@code value} and {@code error} is meaningful.
 */
public record TaskOutcome<T>(
    int index,
    T value,
    Throwable error
) {
    public static <T> TaskOutcome<T> completed(int index, T value) {
        return new TaskOutcome<>(index, value, null);
    }

    public static <T> TaskOutcome<T> failed(int index, Throwable error) {
        return new TaskOutcome<>(index, null, error);
    }

    public boolean isCompleted() {
        return error == null;
    }
}
