package com.feedbackinsights.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Append-only JSON lines history of snapshot commits.
 */
public class CorrelationCommitLog {
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    public void append(Path logPath, CorrelationCommit entry) throws IOException {
        if (logPath.getParent() != null) {
            Files.createDirectories(logPath.getParent());
        }
        String line = mapper.writeValueAsString(entry) + System.lineSeparator();
        Files.writeString(logPath, line, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    public List<CorrelationCommit> readAll(Path logPath) throws IOException {
        if (!Files.exists(logPath)) {
            return List.of();
        }
        List<CorrelationCommit> entries = new ArrayList<>();
        for (String line : Files.readAllLines(logPath)) {
            if (line == null || line.isBlank()) {
                continue;
            }
            entries.add(mapper.readValue(line, CorrelationCommit.class));
        }
        return entries;
    }
}
