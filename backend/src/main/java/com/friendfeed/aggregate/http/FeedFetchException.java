package com.friendfeed.aggregate.http;

public class FeedFetchException extends RuntimeException {
    private final String url;
    private final int attempts;

    public FeedFetchException(String url, int attempts, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.attempts = attempts;
    }

    public String getUrl() {
        return url;
    }

    public int getAttempts() {
        return attempts;
    }
}
