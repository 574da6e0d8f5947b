package com.friendfeed.aggregate.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.friendfeed.aggregate.entry.EntryProcessor;
import com.friendfeed.aggregate.feed.FeedParser;
import com.friendfeed.aggregate.feed.PublishedDateFormatter;
import com.friendfeed.aggregate.http.FeedHttpClient;
import com.friendfeed.aggregate.http.RetryingFeedFetcher;
import com.friendfeed.aggregate.model.AggregationRunSummary;
import com.friendfeed.aggregate.model.EntryFailure;
import com.friendfeed.aggregate.model.HttpFetchResult;
import com.friendfeed.aggregate.model.TrackerEntry;
import com.friendfeed.aggregate.report.ReportAggregator;
import com.friendfeed.aggregate.report.ReportWriter;
import com.friendfeed.aggregate.scheduler.BoundedTaskScheduler;
import com.friendfeed.aggregate.tracker.TrackerAccessException;
import com.friendfeed.aggregate.tracker.TrackerClient;
import com.friendfeed.config.AggregatorProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AggregationRunServiceTest {
    private static final String RSS = "<rss><channel><item><title>Hello</title><link>https://x/1</link>"
        + "<pubDate>Mon, 01 Jan 2024 00:00:00 GMT</pubDate></item></channel></rss>";

    @Mock
    private TrackerClient trackerClient;

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ExecutorService executor;
    private AggregatorProperties properties;
    private Path output;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(8);
        properties = new AggregatorProperties();
        properties.setRetryDelayMs(1);
        properties.setConcurrency(2);
        output = tempDir.resolve("data/friends.json");
        properties.setDataPath(output.toString());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void tenEntriesNeverExceedTwoConcurrentFetches() throws Exception {
        List<TrackerEntry> entries = new ArrayList<>();
        for (int i = 1; i <= 10; i++) {
            entries.add(entry(i, "```json\n{\"feed\":\"https://feed/" + i + "\"}\n```"));
        }
        when(trackerClient.listOpenEntries(List.of())).thenReturn(entries);
        when(trackerClient.updateEntryBody(anyLong(), anyString())).thenReturn(true);
        CountingHttpClient httpClient = new CountingHttpClient(RSS);

        AggregationRunSummary summary = service(httpClient).run();

        assertThat(httpClient.peak.get()).isBetween(1, 2);
        assertThat(httpClient.calls.get()).isEqualTo(10);
        assertThat(summary.entriesUpdated()).isEqualTo(10);
        assertThat(summary.report().statistics().entriesTotal()).isEqualTo(10);
        assertThat(summary.report().statistics().activeCount()).isEqualTo(10);
        assertThat(summary.failuresByKind()).isEmpty();
        assertThat(Files.exists(output)).isTrue();
    }

    @Test
    void listingFailureWritesNothingAndUpdatesNothing() {
        when(trackerClient.listOpenEntries(List.of())).thenThrow(new TrackerAccessException("down"));

        assertThrows(TrackerAccessException.class, () -> service(new CountingHttpClient(RSS)).run());

        assertThat(Files.exists(output)).isFalse();
        verify(trackerClient, never()).updateEntryBody(anyLong(), anyString());
    }

    @Test
    void exhaustedFeedStillProducesCompleteReport() throws Exception {
        when(trackerClient.listOpenEntries(List.of())).thenReturn(List.of(
            entry(1, "```json\n{\"feed\":\"https://down/rss\",\"name\":\"Ada\","
                + "\"posts\":[{\"title\":\"Kept\",\"published\":\"2023-01-01 00:00:00\",\"link\":\"https://down/1\"}]}\n```")
        ));
        when(trackerClient.updateEntryBody(eq(1L), anyString())).thenReturn(true);
        CountingHttpClient httpClient = new CountingHttpClient(null);

        AggregationRunSummary summary = service(httpClient).run();

        assertThat(httpClient.calls.get()).isEqualTo(3);
        assertThat(summary.failuresByKind()).containsEntry(EntryFailure.FEED_UNAVAILABLE, 1);
        JsonNode written = objectMapper.readTree(Files.readString(output));
        assertThat(written.path("statistical_data").path("friends_num").asInt()).isEqualTo(1);
        assertThat(written.path("statistical_data").path("active_num").asInt()).isEqualTo(1);
        assertThat(written.path("article_data").get(0).path("title").asText()).isEqualTo("Kept");
        assertThat(written.path("article_data").get(0).path("author").asText()).isEqualTo("Ada");
    }

    @Test
    void failedUpdateDoesNotBlockAggregation() throws Exception {
        when(trackerClient.listOpenEntries(List.of())).thenReturn(List.of(
            entry(1, "```json\n{\"feed\":\"https://a/rss\",\"posts\":[{\"title\":\"A\",\"published\":\"2024-01-01 00:00:00\",\"link\":\"l\"}]}\n```"),
            entry(2, "```json\n{\"feed\":\"https://b/rss\"}\n```")
        ));
        when(trackerClient.updateEntryBody(eq(1L), anyString())).thenThrow(new IllegalStateException("rate limited"));
        when(trackerClient.updateEntryBody(eq(2L), anyString())).thenReturn(false);

        AggregationRunSummary summary = service(new CountingHttpClient(RSS)).run();

        assertThat(summary.entriesUpdated()).isZero();
        assertThat(summary.report().statistics().postCount()).isEqualTo(1);
        assertThat(summary.report().statistics().activeCount()).isEqualTo(2);
    }

    @Test
    void entriesWithoutBlockAreNotUpdated() {
        when(trackerClient.listOpenEntries(List.of())).thenReturn(List.of(
            entry(1, "no block here"),
            entry(2, null)
        ));

        AggregationRunSummary summary = service(new CountingHttpClient(RSS)).run();

        verify(trackerClient, never()).updateEntryBody(anyLong(), anyString());
        assertThat(summary.failuresByKind())
            .containsEntry(EntryFailure.MISSING_BLOCK, 1)
            .containsEntry(EntryFailure.MISSING_BODY, 1);
        assertThat(summary.report().statistics().activeCount()).isEqualTo(2);
    }

    @Test
    void dryRunSkipsUpdatesButWritesReport() {
        properties.setDryRun(true);
        when(trackerClient.listOpenEntries(List.of())).thenReturn(List.of(
            entry(1, "```json\n{\"feed\":\"https://a/rss\"}\n```")
        ));

        AggregationRunSummary summary = service(new CountingHttpClient(RSS)).run();

        verify(trackerClient, times(0)).updateEntryBody(anyLong(), anyString());
        assertThat(summary.entriesUpdated()).isZero();
        assertThat(Files.exists(output)).isTrue();
    }

    private AggregationRunService service(FeedHttpClient httpClient) {
        PublishedDateFormatter formatter = new PublishedDateFormatter("YYYY-MM-DD HH:mm:ss", ZoneOffset.UTC);
        RetryingFeedFetcher fetcher = new RetryingFeedFetcher(httpClient, new FeedParser(formatter), properties);
        return new AggregationRunService(
            trackerClient,
            new EntryProcessor(fetcher, objectMapper, properties),
            new BoundedTaskScheduler(executor, properties.getConcurrency()),
            new ReportAggregator(formatter),
            new ReportWriter(objectMapper),
            properties
        );
    }

    private TrackerEntry entry(long number, String body) {
        return new TrackerEntry(number, body, List.of(), Instant.parse("2024-01-01T00:00:00Z"));
    }

    /**
     * Records how many fetches overlap. A null body answers every request with a timeout.
     */
    private class CountingHttpClient extends FeedHttpClient {
        private final String body;
        private final AtomicInteger inFlight = new AtomicInteger();
        private final AtomicInteger peak = new AtomicInteger();
        private final AtomicInteger calls = new AtomicInteger();

        CountingHttpClient(String body) {
            super(properties, executor);
            this.body = body;
        }

        @Override
        public HttpFetchResult get(String url) {
            calls.incrementAndGet();
            peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            try {
                Thread.sleep(15);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                inFlight.decrementAndGet();
            }
            if (body == null) {
                return new HttpFetchResult(url, 0, null, Duration.ZERO, "timeout", "timed out");
            }
            return new HttpFetchResult(url, 200, body.getBytes(StandardCharsets.UTF_8), Duration.ofMillis(15), null, null);
        }
    }
}
