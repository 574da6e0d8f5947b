package com.friendfeed.aggregate.model;

import java.time.Duration;

public record HttpFetchResult(
    String requestedUrl,
    int statusCode,
    byte[] bodyBytes,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public String failureDescription() {
        if (errorCode != null) {
            return errorMessage == null ? errorCode : errorCode + ": " + errorMessage;
        }
        return "http_" + statusCode;
    }
}
