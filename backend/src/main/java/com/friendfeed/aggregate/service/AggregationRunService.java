package com.friendfeed.aggregate.service;

import com.friendfeed.aggregate.entry.EntryProcessor;
import com.friendfeed.aggregate.model.AggregateReport;
import com.friendfeed.aggregate.model.AggregationRunSummary;
import com.friendfeed.aggregate.model.EntryFailure;
import com.friendfeed.aggregate.model.EntryResult;
import com.friendfeed.aggregate.model.TaskOutcome;
import com.friendfeed.aggregate.model.TrackerEntry;
import com.friendfeed.aggregate.report.ReportAggregator;
import com.friendfeed.aggregate.report.ReportWriter;
import com.friendfeed.aggregate.scheduler.BoundedTaskScheduler;
import com.friendfeed.aggregate.tracker.TrackerClient;
import com.friendfeed.config.AggregatorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Service
public class AggregationRunService {
    private static final Logger log = LoggerFactory.getLogger(AggregationRunService.class);

    private final TrackerClient trackerClient;
    private final EntryProcessor entryProcessor;
    private final BoundedTaskScheduler scheduler;
    private final ReportAggregator aggregator;
    private final ReportWriter reportWriter;
    private final AggregatorProperties properties;

    public AggregationRunService(
        TrackerClient trackerClient,
        EntryProcessor entryProcessor,
        BoundedTaskScheduler scheduler,
        ReportAggregator aggregator,
        ReportWriter reportWriter,
        AggregatorProperties properties
    ) {
        this.trackerClient = trackerClient;
        this.entryProcessor = entryProcessor;
        this.scheduler = scheduler;
        this.aggregator = aggregator;
        this.reportWriter = reportWriter;
        this.properties = properties;
    }

    /**
     * Lists entries, processes them under the concurrency ceiling and writes the report.
     *
     * @throws com.friendfeed.aggregate.tracker.TrackerAccessException when listing fails; nothing is written
     * @throws com.friendfeed.aggregate.report.ReportWriteException when the report cannot be written
     */
    public AggregationRunSummary run() {
        Instant startedAt = Instant.now();
        log.info("Aggregation run started");
        List<TrackerEntry> entries = trackerClient.listOpenEntries(properties.getExcludeLabels());
        log.info("Processing {} entries with concurrency {}", entries.size(), scheduler.ceiling());

        List<Callable<ProcessedEntry>> tasks = new ArrayList<>(entries.size());
        for (TrackerEntry entry : entries) {
            tasks.add(() -> processAndUpdate(entry));
        }
        List<TaskOutcome<ProcessedEntry>> processed = scheduler.runAll(tasks);

        List<TaskOutcome<EntryResult>> outcomes = new ArrayList<>(processed.size());
        Map<EntryFailure, Integer> failuresByKind = new EnumMap<>(EntryFailure.class);
        int updated = 0;
        for (TaskOutcome<ProcessedEntry> outcome : processed) {
            if (!outcome.isCompleted()) {
                log.warn("Entry #{} failed to process", entries.get(outcome.index()).number(), outcome.error());
                outcomes.add(TaskOutcome.failed(outcome.index(), outcome.error()));
                continue;
            }
            EntryResult result = outcome.value().result();
            outcomes.add(TaskOutcome.completed(outcome.index(), result));
            if (outcome.value().bodyUpdated()) {
                updated++;
            }
            if (result.failure() != null) {
                failuresByKind.merge(result.failure(), 1, Integer::sum);
            }
        }

        AggregateReport report = aggregator.aggregate(entries.size(), outcomes, Instant.now());
        Path outputPath = reportWriter.write(report, Path.of(properties.getDataPath()));
        Instant finishedAt = Instant.now();
        log.info(
            "Aggregation run finished: entries={} updated={} failures={} output={}",
            entries.size(),
            updated,
            failuresByKind,
            outputPath
        );
        return new AggregationRunSummary(startedAt, finishedAt, report, outputPath, updated, failuresByKind);
    }

    private ProcessedEntry processAndUpdate(TrackerEntry entry) {
        EntryResult result = entryProcessor.process(entry);
        if (!result.hasRewrittenBody()) {
            return new ProcessedEntry(result, false);
        }
        if (properties.isDryRun()) {
            log.info("Dry run: not updating entry #{}", entry.number());
            return new ProcessedEntry(result, false);
        }
        boolean updated;
        try {
            updated = trackerClient.updateEntryBody(entry.number(), result.rewrittenBody());
        } catch (RuntimeException e) {
            log.warn("Updating entry #{} failed", entry.number(), e);
            updated = false;
        }
        return new ProcessedEntry(result, updated);
    }

    private record ProcessedEntry(EntryResult result, boolean bodyUpdated) {
    }
}
