package com.friendfeed.aggregate.report;

public class ReportWriteException extends RuntimeException {
    public ReportWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
