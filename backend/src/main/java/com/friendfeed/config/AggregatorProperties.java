package com.friendfeed.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "aggregator")
public class AggregatorProperties {
    private static final String DEFAULT_USER_AGENT = "friend-feed/0.1 (+github-actions)";
    private static final String DEFAULT_DATE_FORMAT = "YYYY-MM-DD HH:mm:ss";

    private String userAgent;
    private int retryTimes = 3;
    private int postsCount = 2;
    private int concurrency = 10;
    private int requestTimeoutSeconds = 5;
    private int retryDelayMs = 1000;
    private String dataPath = "data/friends.json";
    private String dateFormat = DEFAULT_DATE_FORMAT;
    private String timeZone = "UTC";
    private List<String> excludeLabels = new ArrayList<>();
    private boolean dryRun;
    private Github github = new Github();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRetryTimes() {
        return Math.max(1, retryTimes);
    }

    public void setRetryTimes(int retryTimes) {
        this.retryTimes = Math.max(1, retryTimes);
    }

    public int getPostsCount() {
        return Math.max(1, postsCount);
    }

    public void setPostsCount(int postsCount) {
        this.postsCount = Math.max(1, postsCount);
    }

    /**
     * Not clamped: a ceiling below one can never admit a task, so the scheduler rejects it at startup.
     */
    public int getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = concurrency;
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getRetryDelayMs() {
        return Math.max(0, retryDelayMs);
    }

    public void setRetryDelayMs(int retryDelayMs) {
        this.retryDelayMs = Math.max(0, retryDelayMs);
    }

    public String getDataPath() {
        return dataPath;
    }

    public void setDataPath(String dataPath) {
        this.dataPath = dataPath;
    }

    public String getDateFormat() {
        return dateFormat == null || dateFormat.isBlank() ? DEFAULT_DATE_FORMAT : dateFormat;
    }

    public void setDateFormat(String dateFormat) {
        this.dateFormat = dateFormat;
    }

    public String getTimeZone() {
        return timeZone == null || timeZone.isBlank() ? "UTC" : timeZone.trim();
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }

    public List<String> getExcludeLabels() {
        return excludeLabels;
    }

    public void setExcludeLabels(List<String> excludeLabels) {
        List<String> cleaned = new ArrayList<>();
        if (excludeLabels != null) {
            for (String label : excludeLabels) {
                if (label != null && !label.isBlank()) {
                    cleaned.add(label.trim());
                }
            }
        }
        this.excludeLabels = cleaned;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public void setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
    }

    public Github getGithub() {
        return github;
    }

    public void setGithub(Github github) {
        this.github = github;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Github {
        private String apiUrl = "https://api.github.com";
        private String repository = "";
        private String token = "";
        private int pageSize = 100;

        public String getApiUrl() {
            if (apiUrl == null || apiUrl.isBlank()) {
                return "https://api.github.com";
            }
            String trimmed = apiUrl.trim();
            return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        }

        public void setApiUrl(String apiUrl) {
            this.apiUrl = apiUrl;
        }

        public String getRepository() {
            return repository == null ? "" : repository.trim();
        }

        public void setRepository(String repository) {
            this.repository = repository;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public int getPageSize() {
            return Math.min(100, Math.max(1, pageSize));
        }

        public void setPageSize(int pageSize) {
            this.pageSize = Math.min(100, Math.max(1, pageSize));
        }
    }

    public static class Cli {
        private boolean run = true;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
