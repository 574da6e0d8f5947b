package com.friendfeed.aggregate.service;

import com.friendfeed.aggregate.model.AggregationRunSummary;
import com.friendfeed.aggregate.report.ReportWriteException;
import com.friendfeed.aggregate.tracker.TrackerAccessException;
import com.friendfeed.config.AggregatorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class AggregationCliRunner implements ApplicationRunner, ExitCodeGenerator {
    public static final int EXIT_OK = 0;
    public static final int EXIT_LISTING_FAILED = 1;
    public static final int EXIT_WRITE_FAILED = 2;

    private static final Logger log = LoggerFactory.getLogger(AggregationCliRunner.class);

    private final AggregatorProperties properties;
    private final AggregationRunService runService;
    private final ConfigurableApplicationContext applicationContext;
    private volatile int exitCode = EXIT_OK;

    public AggregationCliRunner(
        AggregatorProperties properties,
        AggregationRunService runService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.runService = runService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }
        exitCode = runOnce();
        if (properties.getCli().isExitAfterRun()) {
            int code = SpringApplication.exit(applicationContext, this);
            System.exit(code);
        }
    }

    int runOnce() {
        try {
            AggregationRunSummary summary = runService.run();
            log.info(
                "Summary: friends={} active={} errors={} articles={} updated={} generated={}",
                summary.report().statistics().entriesTotal(),
                summary.report().statistics().activeCount(),
                summary.report().statistics().errorCount(),
                summary.report().statistics().postCount(),
                summary.entriesUpdated(),
                summary.report().statistics().generatedAt()
            );
            return EXIT_OK;
        } catch (TrackerAccessException e) {
            log.error("Listing tracker entries failed, no report written", e);
            return EXIT_LISTING_FAILED;
        } catch (ReportWriteException e) {
            log.error("Writing the report failed", e);
            return EXIT_WRITE_FAILED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
