package com.friendfeed.aggregate.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"friends_num", "active_num", "error_num", "article_num", "last_updated_time"})
public record ReportStatistics(
    @JsonProperty("friends_num") int entriesTotal,
    @JsonProperty("active_num") int activeCount,
    @JsonProperty("error_num") int errorCount,
    @JsonProperty("article_num") int postCount,
    @JsonProperty("last_updated_time") String generatedAt
) {
}
