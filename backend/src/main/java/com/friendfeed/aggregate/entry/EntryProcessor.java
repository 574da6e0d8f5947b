package com.friendfeed.aggregate.entry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.friendfeed.aggregate.http.FeedFetchException;
import com.friendfeed.aggregate.http.RetryingFeedFetcher;
import com.friendfeed.aggregate.model.EntryFailure;
import com.friendfeed.aggregate.model.EntryResult;
import com.friendfeed.aggregate.model.EntryStatus;
import com.friendfeed.aggregate.model.Post;
import com.friendfeed.aggregate.model.TrackerEntry;
import com.friendfeed.aggregate.util.CanonicalJson;
import com.friendfeed.config.AggregatorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class EntryProcessor {
    private static final Logger log = LoggerFactory.getLogger(EntryProcessor.class);

    private final RetryingFeedFetcher feedFetcher;
    private final ObjectMapper objectMapper;
    private final AggregatorProperties properties;

    public EntryProcessor(RetryingFeedFetcher feedFetcher, ObjectMapper objectMapper, AggregatorProperties properties) {
        this.feedFetcher = feedFetcher;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Never throws: every failure is reported through {@link EntryResult#failure()}.
     */
    public EntryResult process(TrackerEntry entry) {
        long number = entry.number();
        try {
            return processOrThrow(entry);
        } catch (Exception e) {
            log.warn("Unexpected failure processing entry #{}", number, e);
            return EntryResult.failed(number, EntryFailure.UNEXPECTED);
        }
    }

    private EntryResult processOrThrow(TrackerEntry entry) throws JsonProcessingException {
        long number = entry.number();
        String body = entry.body();
        if (body == null || body.isBlank()) {
            log.warn("Entry #{} has no body content, skipping", number);
            return EntryResult.failed(number, EntryFailure.MISSING_BODY);
        }

        Optional<String> blockText = StructuredBlockLocator.locate(body);
        if (blockText.isEmpty()) {
            log.warn("No JSON block found in entry #{}", number);
            return EntryResult.failed(number, EntryFailure.MISSING_BLOCK);
        }

        ObjectNode data = parseBlock(number, blockText.get());
        if (data == null) {
            return EntryResult.failed(number, EntryFailure.MALFORMED_BLOCK);
        }
        String rewrittenBody = StructuredBlockLocator.replaceFirst(
            body,
            blockText.get(),
            CanonicalJson.write(objectMapper, data)
        );
        String author = data.path("author").asText("");
        String avatar = data.path("avatar").asText("");

        String feedUrl = data.path("feed").asText("").trim();
        if (feedUrl.isEmpty()) {
            log.warn("Entry #{} declares no feed", number);
            return new EntryResult(number, EntryStatus.ERROR, EntryFailure.MISSING_FEED, List.of(), rewrittenBody, data, null, author, avatar);
        }

        List<Post> posts;
        try {
            posts = feedFetcher.fetchWithRetry(feedUrl, properties.getRetryTimes(), properties.getPostsCount());
        } catch (FeedFetchException e) {
            log.warn("Feed {} for entry #{} unavailable after {} attempts", feedUrl, number, e.getAttempts(), e.getCause());
            return new EntryResult(number, EntryStatus.ERROR, EntryFailure.FEED_UNAVAILABLE, List.of(), rewrittenBody, data, feedUrl, author, avatar);
        }

        EntryStatus status = posts.isEmpty() ? EntryStatus.ERROR : EntryStatus.ACTIVE;
        EntryFailure failure = posts.isEmpty() ? EntryFailure.EMPTY_FEED : null;
        log.info("Processed entry #{}: feed={} posts={} status={}", number, feedUrl, posts.size(), status.wireName());
        return new EntryResult(number, status, failure, posts, rewrittenBody, data, feedUrl, author, avatar);
    }

    private ObjectNode parseBlock(long number, String blockText) {
        try {
            JsonNode node = objectMapper.readTree(blockText);
            if (node instanceof ObjectNode object) {
                return object;
            }
            log.warn("JSON block in entry #{} is not an object", number);
            return null;
        } catch (JsonProcessingException e) {
            log.warn("Malformed JSON block in entry #{}: {}", number, e.getOriginalMessage());
            return null;
        }
    }
}
