package com.feedbackinsights.feedback;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.feedbackinsights.runtime.RunContext;

/**
 * Reads survey responses exported by the ingestion layer as a JSON array.
 */
public class JsonFeedbackRecordSource implements FeedbackRecordSource {
    private static final Logger log = LoggerFactory.getLogger(JsonFeedbackRecordSource.class);

    private final Path recordsPath;
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    public JsonFeedbackRecordSource(Path recordsPath) {
        this.recordsPath = recordsPath;
    }

    @Override
    public List<FeedbackRecord> loadComplete(RunContext context, RecordFilter filter) throws IOException {
        List<FeedbackRecord> all = loadAll();
        List<FeedbackRecord> complete = all.stream()
                .filter(FeedbackRecord::complete)
                .filter(filter::matches)
                .toList();
        log.debug("records.loaded tenant={} path={} total={} complete={}",
                context.tenantId(), recordsPath, all.size(), complete.size());
        return complete;
    }

    public List<FeedbackRecord> loadAll() throws IOException {
        if (!Files.exists(recordsPath) || Files.size(recordsPath) == 0L) {
            return List.of();
        }
        return objectMapper.readValue(recordsPath.toFile(), new TypeReference<List<FeedbackRecord>>() {
        });
    }
}
