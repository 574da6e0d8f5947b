package com.friendfeed.aggregate.model;

/**
 * Why an entry ended up in {@link EntryStatus#ERROR}.
 */
public enum EntryFailure {
    MISSING_BODY,
    MISSING_BLOCK,
    MALFORMED_BLOCK,
    MISSING_FEED,
    FEED_UNAVAILABLE,
    EMPTY_FEED,
    UNEXPECTED
}
