package com.friendfeed.aggregate.model;

public record Post(
    String title,
    String link,
    String published
) {
}
