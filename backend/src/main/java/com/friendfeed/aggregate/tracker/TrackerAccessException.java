package com.friendfeed.aggregate.tracker;

public class TrackerAccessException extends RuntimeException {
    public TrackerAccessException(String message) {
        super(message);
    }

    public TrackerAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
