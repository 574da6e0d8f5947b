package com.friendfeed.aggregate.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.friendfeed.aggregate.feed.PublishedDateFormatter;
import com.friendfeed.aggregate.model.AggregateReport;
import com.friendfeed.aggregate.model.EntryResult;
import com.friendfeed.aggregate.model.ReportStatistics;
import com.friendfeed.aggregate.model.ReportedPost;
import com.friendfeed.aggregate.model.TaskOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Folds per-entry outcomes into one report. Runs on a single thread after every task has joined.
 *
 * <p>{@code active_num} counts entries whose processing completed, whatever their feed status, and
 * the article list is built from the {@code posts} array stored in each entry's JSON block rather
 * than from the posts fetched during this run. Both mirror what downstream consumers of the report
 * already rely on.
 */
@Service
public class ReportAggregator {
    private static final Logger log = LoggerFactory.getLogger(ReportAggregator.class);

    private final PublishedDateFormatter dateFormatter;

    public ReportAggregator(PublishedDateFormatter dateFormatter) {
        this.dateFormatter = dateFormatter;
    }

    public AggregateReport aggregate(int entriesTotal, List<TaskOutcome<EntryResult>> outcomes, Instant generatedAt) {
        int activeCount = 0;
        int errorCount = 0;
        List<ReportedPost> posts = new ArrayList<>();
        for (TaskOutcome<EntryResult> outcome : outcomes) {
            if (!outcome.isCompleted() || outcome.value() == null) {
                errorCount++;
                continue;
            }
            activeCount++;
            posts.addAll(storedPosts(outcome.value().data()));
        }

        List<ReportedPost> sorted = sortNewestFirst(posts);
        String generated = dateFormatter.format(generatedAt);
        log.info(
            "Aggregated {} entries: active={} errors={} articles={}",
            entriesTotal,
            activeCount,
            errorCount,
            sorted.size()
        );
        return new AggregateReport(
            new ReportStatistics(entriesTotal, activeCount, errorCount, sorted.size(), generated),
            sorted
        );
    }

    private List<ReportedPost> storedPosts(ObjectNode data) {
        if (data == null || !data.path("posts").isArray()) {
            return List.of();
        }
        String author = data.path("name").asText("");
        if (author.isEmpty()) {
            author = data.path("author").asText("");
        }
        String avatar = data.path("avatar").asText("");
        List<ReportedPost> posts = new ArrayList<>();
        for (JsonNode post : data.path("posts")) {
            posts.add(new ReportedPost(
                textOrNull(post, "title"),
                textOrNull(post, "published"),
                textOrNull(post, "link"),
                author,
                avatar
            ));
        }
        return posts;
    }

    /**
     * Stable sort, newest first; posts whose date cannot be parsed go last.
     */
    List<ReportedPost> sortNewestFirst(List<ReportedPost> posts) {
        Comparator<Instant> newestFirst = Comparator.nullsLast(Comparator.<Instant>reverseOrder());
        List<Keyed> keyed = new ArrayList<>(posts.size());
        for (ReportedPost post : posts) {
            keyed.add(new Keyed(post, dateFormatter.parse(post.created())));
        }
        keyed.sort(Comparator.comparing(Keyed::created, newestFirst));
        return keyed.stream().map(Keyed::post).toList();
    }

    private String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private record Keyed(ReportedPost post, Instant created) {
    }
}
