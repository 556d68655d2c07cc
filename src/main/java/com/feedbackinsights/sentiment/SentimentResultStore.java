package com.feedbackinsights.sentiment;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.feedbackinsights.feedback.FeedbackRecord;

/**
 * One sentiment result per record id, kept in a JSON map. Writes replace by
 * id so re-analysis never duplicates a record.
 */
public class SentimentResultStore {
    private final Path path;
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    private final Map<String, StoredSentiment> results;

    public SentimentResultStore(Path path) throws IOException {
        this.path = path;
        this.results = load(path);
    }

    public synchronized Optional<StoredSentiment> get(String recordId) {
        return Optional.ofNullable(results.get(recordId));
    }

    public synchronized List<FeedbackRecord> missing(Collection<FeedbackRecord> records) {
        return records.stream()
                .filter(record -> !results.containsKey(record.id()))
                .toList();
    }

    public synchronized void upsertAll(Collection<StoredSentiment> sentiments) throws IOException {
        if (sentiments.isEmpty()) {
            return;
        }
        Map<String, StoredSentiment> updated = new LinkedHashMap<>(results);
        for (StoredSentiment sentiment : sentiments) {
            updated.put(sentiment.recordId(), sentiment);
        }
        save(updated);
        results.clear();
        results.putAll(updated);
    }

    public synchronized int size() {
        return results.size();
    }

    private Map<String, StoredSentiment> load(Path storePath) throws IOException {
        if (!Files.exists(storePath) || Files.size(storePath) == 0L) {
            return new LinkedHashMap<>();
        }
        return mapper.readValue(storePath.toFile(), new TypeReference<LinkedHashMap<String, StoredSentiment>>() {
        });
    }

    private void save(Map<String, StoredSentiment> state) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), state);
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
