package com.friendfeed.aggregate.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

public record AggregationRunSummary(
    Instant startedAt,
    Instant finishedAt,
    AggregateReport report,
    Path outputPath,
    int entriesUpdated,
    Map<EntryFailure, Integer> failuresByKind
) {
}
