package com.friendfeed.aggregate.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EntryStatus {
    ACTIVE,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
