package com.friendfeed.aggregate.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"statistical_data", "article_data"})
public record AggregateReport(
    @JsonProperty("statistical_data") ReportStatistics statistics,
    @JsonProperty("article_data") List<ReportedPost> posts
) {
    public AggregateReport {
        posts = posts == null ? List.of() : List.copyOf(posts);
    }
}
