package com.feedbackinsights;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.feedbackinsights.feedback.FeedbackRecord;
import com.feedbackinsights.feedback.JsonFeedbackRecordSource;
import com.feedbackinsights.feedback.Polarity;
import com.feedbackinsights.pipeline.PipelineRunSummary;
import com.feedbackinsights.runtime.AppConfig;
import com.feedbackinsights.runtime.RunContext;
import com.feedbackinsights.sentiment.SentimentScorer;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "feedback-insights",
        mixinStandardHelpOptions = true,
        version = "feedback-insights 0.1.0",
        description = "Trains and queries survey feedback keyword and sentiment insights.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    Path configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "train")
    Mode mode;

    @Option(names = "--records", description = "JSON array of feedback records", defaultValue = "feedback-records.json")
    Path recordsPath;

    @Option(names = "--category", description = "Category name for keywords mode")
    String category;

    @Option(names = "--polarity", description = "Polarity for keywords mode (strength, lacking)", defaultValue = "lacking")
    String polarity;

    @Option(names = "--text", description = "Text to score in sentiment mode")
    String text;

    @Option(names = "--record-id", description = "Record id for insights mode")
    String recordId;

    @Option(names = "--tenant", description = "Tenant id recorded with the training run", defaultValue = RunContext.DEFAULT_TENANT)
    String tenant;

    private final ObjectMapper output = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    enum Mode {
        train,
        keywords,
        ranking,
        sentiment,
        insights
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = AppConfig.load(configPath);
        log.info("Starting feedback-insights in {} mode", mode);
        log.info("Using config file: {}", configPath);

        if (mode == Mode.sentiment) {
            if (text == null) {
                log.error("--text is required in sentiment mode");
                return 2;
            }
            print(new SentimentScorer().analyze(text));
            return 0;
        }

        FeedbackInsights insights = FeedbackInsights.create(config, new JsonFeedbackRecordSource(recordsPath));
        if (mode == Mode.train) {
            PipelineRunSummary summary = insights.trainAll(RunContext.forTenant(tenant));
            print(summary);
            return summary.succeeded() ? 0 : 1;
        }
        if (mode == Mode.keywords) {
            if (category == null || category.isBlank()) {
                print(insights.getOverallKeywords());
                return 0;
            }
            Polarity bucket;
            try {
                bucket = Polarity.fromLabel(polarity);
            } catch (IllegalArgumentException e) {
                log.error("--polarity must be strength or lacking, got {}", polarity);
                return 2;
            }
            print(insights.getKeywords(category, bucket).orElse(null));
            return 0;
        }
        if (mode == Mode.ranking) {
            print(insights.getSectionRanking().orElse(null));
            return 0;
        }
        if (mode == Mode.insights) {
            if (recordId == null || recordId.isBlank()) {
                log.error("--record-id is required in insights mode");
                return 2;
            }
            Optional<FeedbackRecord> record = findRecord(recordId);
            if (record.isEmpty()) {
                log.error("No record with id {} in {}", recordId, recordsPath);
                return 2;
            }
            print(insights.insightsFor(record.get()));
            return 0;
        }
        return 0;
    }

    private Optional<FeedbackRecord> findRecord(String id) throws IOException {
        return new JsonFeedbackRecordSource(recordsPath).loadAll().stream()
                .filter(record -> id.equals(record.id()))
                .findFirst();
    }

    private void print(Object value) throws IOException {
        System.out.println(output.writerWithDefaultPrettyPrinter().writeValueAsString(value));
    }
}
