package com.friendfeed.aggregate.tracker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.friendfeed.aggregate.model.TrackerEntry;
import com.friendfeed.config.AggregatorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Lists and edits issues of one repository through the GitHub REST API.
 */
@Service
public class GitHubIssueClient implements TrackerClient {
    private static final Logger log = LoggerFactory.getLogger(GitHubIssueClient.class);
    private static final String ACCEPT = "application/vnd.github+json";
    private static final String API_VERSION = "2022-11-28";
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final AggregatorProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public GitHubIssueClient(
        AggregatorProperties properties,
        ObjectMapper objectMapper,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .connectTimeout(REQUEST_TIMEOUT)
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    @Override
    public List<TrackerEntry> listOpenEntries(List<String> excludeLabels) {
        String repository = requireRepository();
        int pageSize = properties.getGithub().getPageSize();
        List<TrackerEntry> entries = new ArrayList<>();
        for (int page = 1; ; page++) {
            String url = properties.getGithub().getApiUrl() + "/repos/" + repository
                + "/issues?state=open&sort=created&direction=desc&per_page=" + pageSize + "&page=" + page;
            JsonNode items = readArray(send(request(url).GET().build()), url);
            for (JsonNode item : items) {
                entries.add(toEntry(item));
            }
            if (items.size() < pageSize) {
                break;
            }
        }
        log.info(
            "Found {} open entries: {}",
            entries.size(),
            entries.stream().map(entry -> String.valueOf(entry.number())).collect(Collectors.joining(","))
        );

        if (excludeLabels == null || excludeLabels.isEmpty()) {
            return entries;
        }
        List<TrackerEntry> filtered = entries.stream()
            .filter(entry -> !entry.hasAnyLabel(excludeLabels))
            .toList();
        log.info("{} entries left after excluding labels {}", filtered.size(), excludeLabels);
        return filtered;
    }

    @Override
    public boolean updateEntryBody(long entryNumber, String body) {
        String url = properties.getGithub().getApiUrl() + "/repos/" + properties.getGithub().getRepository()
            + "/issues/" + entryNumber;
        try {
            ObjectNode payload = objectMapper.createObjectNode().put("body", body);
            HttpRequest request = request(url)
                .header("Content-Type", "application/json")
                .method("PATCH", HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload), StandardCharsets.UTF_8))
                .build();
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() >= 200 && response.statusCode() < 300) {
                log.info("Updated body of entry #{}", entryNumber);
                return true;
            }
            log.warn("Updating entry #{} failed with HTTP {}: {}", entryNumber, response.statusCode(), response.body());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while updating entry #{}", entryNumber);
            return false;
        } catch (Exception e) {
            log.warn("Updating entry #{} failed", entryNumber, e);
            return false;
        }
    }

    private String requireRepository() {
        String repository = properties.getGithub().getRepository();
        if (repository.isEmpty() || !repository.contains("/")) {
            throw new TrackerAccessException("Repository must be configured as owner/repo, was '" + repository + "'");
        }
        return repository;
    }

    private HttpRequest.Builder request(String url) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url))
            .timeout(REQUEST_TIMEOUT)
            .header("Accept", ACCEPT)
            .header("X-GitHub-Api-Version", API_VERSION)
            .header("User-Agent", properties.getUserAgent());
        String token = properties.getGithub().getToken();
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token.trim());
        }
        return builder;
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new TrackerAccessException(
                    "Listing entries failed with HTTP " + response.statusCode() + " for " + request.uri()
                );
            }
            return response;
        } catch (IOException e) {
            throw new TrackerAccessException("Listing entries failed for " + request.uri(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TrackerAccessException("Interrupted while listing entries", e);
        }
    }

    private JsonNode readArray(HttpResponse<String> response, String url) {
        try {
            JsonNode node = objectMapper.readTree(response.body());
            if (node == null || !node.isArray()) {
                throw new TrackerAccessException("Unexpected listing payload from " + url);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new TrackerAccessException("Unreadable listing payload from " + url, e);
        }
    }

    private TrackerEntry toEntry(JsonNode item) {
        List<String> labels = new ArrayList<>();
        for (JsonNode label : item.path("labels")) {
            String name = label.isTextual() ? label.asText() : label.path("name").asText("");
            if (!name.isEmpty()) {
                labels.add(name);
            }
        }
        JsonNode body = item.get("body");
        return new TrackerEntry(
            item.path("number").asLong(),
            body == null || body.isNull() ? null : body.asText(),
            labels,
            parseInstant(item.path("created_at").asText(null))
        );
    }

    private Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
