package com.friendfeed.aggregate.model;

import java.time.Instant;
import java.util.List;

public record TrackerEntry(
    long number,
    String body,
    List<String> labels,
    Instant createdAt
) {
    public TrackerEntry {
        labels = labels == null ? List.of() : List.copyOf(labels);
    }

    public boolean hasAnyLabel(List<String> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return false;
        }
        for (String candidate : candidates) {
            if (labels.contains(candidate)) {
                return true;
            }
        }
        return false;
    }
}
