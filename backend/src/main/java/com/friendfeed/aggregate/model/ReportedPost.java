package com.friendfeed.aggregate.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One article of the report. Fields missing from the stored post are left out of the output.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"title", "created", "link", "author", "avatar"})
public record ReportedPost(
    String title,
    String created,
    String link,
    String author,
    String avatar
) {
}
