package com.friendfeed.config;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps GitHub Actions step inputs ({@code INPUT_*} variables) onto {@code aggregator.*} properties.
 * Numeric inputs that are absent or not integers are left out so the configured defaults apply.
 */
public class ActionInputsEnvironmentPostProcessor implements EnvironmentPostProcessor, Ordered {
    public static final String PROPERTY_SOURCE_NAME = "actionInputs";

    private static final Map<String, String> NUMERIC_INPUTS = Map.of(
        "INPUT_RETRY_TIMES", "aggregator.retry-times",
        "INPUT_POSTS_COUNT", "aggregator.posts-count",
        "INPUT_CONCURRENCY", "aggregator.concurrency"
    );
    private static final Map<String, String> TEXT_INPUTS = Map.of(
        "INPUT_DATA_PATH", "aggregator.data-path",
        "INPUT_DATE_FORMAT", "aggregator.date-format",
        "INPUT_EXCLUDE_LABELS", "aggregator.exclude-labels",
        "INPUT_TIME_ZONE", "aggregator.time-zone"
    );

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        Map<String, Object> mapped = new LinkedHashMap<>();
        NUMERIC_INPUTS.forEach((input, property) -> {
            Integer value = parseInteger(environment.getProperty(input));
            if (value != null) {
                mapped.put(property, value);
            }
        });
        TEXT_INPUTS.forEach((input, property) -> {
            String value = environment.getProperty(input);
            if (value != null && !value.isBlank()) {
                mapped.put(property, value.trim());
            }
        });
        if (!mapped.isEmpty()) {
            environment.getPropertySources().addFirst(new MapPropertySource(PROPERTY_SOURCE_NAME, mapped));
        }
    }

    static Integer parseInteger(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public int getOrder() {
        return Ordered.LOWEST_PRECEDENCE;
    }
}
