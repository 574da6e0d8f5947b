package com.friendfeed.aggregate.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.friendfeed.aggregate.model.AggregateReport;
import com.friendfeed.aggregate.util.CanonicalJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

@Service
public class ReportWriter {
    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private final ObjectMapper objectMapper;

    public ReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Replaces {@code target} with the serialized report, creating parent directories as needed.
     */
    public Path write(AggregateReport report, Path target) {
        Path absolute = target.toAbsolutePath().normalize();
        Path temp = null;
        try {
            Path parent = absolute.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            String json = CanonicalJson.write(objectMapper, report);
            temp = Files.createTempFile(parent, absolute.getFileName().toString(), ".tmp");
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
            log.info("Report written to {}", absolute);
            return absolute;
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new ReportWriteException("Failed to write report to " + absolute, e);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.debug("Could not remove temp file {}", temp, e);
        }
    }
}
