package com.feedbackinsights.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.feedbackinsights.error.PersistenceException;
import com.feedbackinsights.runtime.RunContext;

/**
 * Keeps the current snapshot in {@code correlations.json} under a store
 * directory. A commit writes a sibling temp file and renames it over the
 * snapshot file, so a crash mid-write leaves the previous snapshot intact.
 */
public class JsonFileCorrelationStore implements CorrelationStore {
    public static final String SNAPSHOT_FILE = "correlations.json";
    public static final String COMMIT_LOG_FILE = "commits.jsonl";

    private static final Logger log = LoggerFactory.getLogger(JsonFileCorrelationStore.class);

    private final Path snapshotPath;
    private final Path commitLogPath;
    private final CorrelationCommitLog commitLog;
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    private volatile CorrelationSnapshot current;

    public JsonFileCorrelationStore(Path directory) throws IOException {
        this(directory.resolve(SNAPSHOT_FILE), directory.resolve(COMMIT_LOG_FILE), new CorrelationCommitLog());
    }

    public JsonFileCorrelationStore(Path snapshotPath, Path commitLogPath, CorrelationCommitLog commitLog) throws IOException {
        this.snapshotPath = snapshotPath;
        this.commitLogPath = commitLogPath;
        this.commitLog = commitLog;
        this.current = load();
        log.info("store.loaded path={} version={}", snapshotPath, current.version());
    }

    @Override
    public synchronized CorrelationSnapshot replaceAll(
            RunContext context,
            List<ImportanceResult> importanceResults,
            SectionImportanceRanking sectionRanking,
            OverallKeywordSet overallKeywords) {
        CorrelationSnapshot next = new CorrelationSnapshot(
                current.version() + 1,
                context.runId(),
                context.tenantId(),
                Instant.now(),
                importanceResults,
                sectionRanking,
                overallKeywords);

        Path temp = snapshotPath.resolveSibling(snapshotPath.getFileName() + ".tmp");
        try {
            if (snapshotPath.getParent() != null) {
                Files.createDirectories(snapshotPath.getParent());
            }
            mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), next);
            Files.move(temp, snapshotPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            deleteQuietly(temp, e);
            throw new PersistenceException("Failed to commit snapshot version " + next.version() + " to " + snapshotPath, e);
        }

        try {
            commitLog.append(commitLogPath, CorrelationCommit.of(next));
        } catch (IOException e) {
            log.warn("store.commit_log.failed path={} version={}", commitLogPath, next.version(), e);
        }
        current = next;
        log.info("store.committed version={} runId={} results={} ranking={}",
                next.version(),
                next.runId(),
                next.importanceResults().size(),
                next.sectionRanking() != null);
        return next;
    }

    @Override
    public CorrelationSnapshot snapshot() {
        return current;
    }

    public List<CorrelationCommit> history() throws IOException {
        return commitLog.readAll(commitLogPath);
    }

    private CorrelationSnapshot load() throws IOException {
        if (!Files.exists(snapshotPath) || Files.size(snapshotPath) == 0L) {
            return CorrelationSnapshot.empty();
        }
        return mapper.readValue(snapshotPath.toFile(), CorrelationSnapshot.class);
    }

    private static void deleteQuietly(Path temp, IOException failure) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException cleanup) {
            failure.addSuppressed(cleanup);
        }
    }
}
