package com.friendfeed.aggregate.http;

import com.friendfeed.aggregate.feed.FeedParser;
import com.friendfeed.aggregate.model.HttpFetchResult;
import com.friendfeed.aggregate.model.Post;
import com.friendfeed.config.AggregatorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Fetch-and-parse with a fixed number of attempts and a fixed pause between them.
 */
@Service
public class RetryingFeedFetcher {
    private static final Logger log = LoggerFactory.getLogger(RetryingFeedFetcher.class);

    private final FeedHttpClient httpClient;
    private final FeedParser feedParser;
    private final AggregatorProperties properties;

    public RetryingFeedFetcher(FeedHttpClient httpClient, FeedParser feedParser, AggregatorProperties properties) {
        this.httpClient = httpClient;
        this.feedParser = feedParser;
        this.properties = properties;
    }

    public List<Post> fetchWithRetry(String url, int maxAttempts) {
        return fetchWithRetry(url, maxAttempts, properties.getPostsCount());
    }

    /**
     * @throws FeedFetchException when every attempt failed; carries the last attempt's cause
     */
    public List<Post> fetchWithRetry(String url, int maxAttempts, int maxPosts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        RuntimeException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return attemptOnce(url, attempt, maxAttempts, maxPosts);
            } catch (RuntimeException e) {
                lastError = e;
                log.warn("Feed attempt {}/{} for {} failed: {}", attempt, maxAttempts, url, e.getMessage());
            }
            if (attempt < maxAttempts && !sleepBetweenAttempts()) {
                throw new FeedFetchException(url, attempt, "Interrupted while retrying " + url, lastError);
            }
        }
        throw new FeedFetchException(
            url,
            maxAttempts,
            "Feed " + url + " failed after " + maxAttempts + " attempts",
            lastError
        );
    }

    private List<Post> attemptOnce(String url, int attempt, int maxAttempts, int maxPosts) {
        HttpFetchResult fetch = httpClient.get(url);
        if (fetch == null) {
            throw new FeedAttemptException("no response");
        }
        if (!fetch.isSuccessful()) {
            throw new FeedAttemptException(fetch.failureDescription());
        }
        List<Post> posts = feedParser.parse(fetch.bodyBytes(), maxPosts);
        log.info(
            "Fetched {} posts from {} on attempt {}/{} in {}ms",
            posts.size(),
            url,
            attempt,
            maxAttempts,
            millis(fetch)
        );
        return posts;
    }

    private long millis(HttpFetchResult fetch) {
        return fetch.duration() == null ? 0 : fetch.duration().toMillis();
    }

    private boolean sleepBetweenAttempts() {
        long delayMs = properties.getRetryDelayMs();
        if (delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static class FeedAttemptException extends RuntimeException {
        FeedAttemptException(String message) {
            super(message);
        }
    }
}
