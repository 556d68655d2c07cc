package com.feedbackinsights.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.feedbackinsights.forest.ForestHyperparameters;
import com.feedbackinsights.pipeline.DeduplicationSettings;
import com.feedbackinsights.pipeline.ImportanceTrainingSettings;
import com.feedbackinsights.pipeline.RankingSettings;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    public static final List<String> DEFAULT_CATEGORIES = List.of(
            "Compensation & Benefits",
            "Work-Life Balance",
            "Culture & Values",
            "Diversity & Inclusion",
            "Career Development",
            "Management & Leadership");

    private List<String> categories = new ArrayList<>(DEFAULT_CATEGORIES);
    private TrainingConfig training = new TrainingConfig();
    private RankingConfig ranking = new RankingConfig();
    private DeduplicationConfig deduplication = new DeduplicationConfig();
    private StorageConfig storage = new StorageConfig();
    private RecommendationConfig recommendations = new RecommendationConfig();

    /**
     * Reads a YAML config file, or returns defaults when it does not exist.
     */
    public static AppConfig load(Path path) throws IOException {
        if (path == null || !Files.exists(path)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig config = mapper.readValue(path.toFile(), AppConfig.class);
        return config == null ? new AppConfig() : config;
    }

    public List<String> getCategories() {
        return categories;
    }

    public void setCategories(List<String> categories) {
        this.categories = categories == null || categories.isEmpty() ? new ArrayList<>(DEFAULT_CATEGORIES) : categories;
    }

    public TrainingConfig getTraining() {
        return training;
    }

    public void setTraining(TrainingConfig training) {
        this.training = training == null ? new TrainingConfig() : training;
    }

    public RankingConfig getRanking() {
        return ranking;
    }

    public void setRanking(RankingConfig ranking) {
        this.ranking = ranking == null ? new RankingConfig() : ranking;
    }

    public DeduplicationConfig getDeduplication() {
        return deduplication;
    }

    public void setDeduplication(DeduplicationConfig deduplication) {
        this.deduplication = deduplication == null ? new DeduplicationConfig() : deduplication;
    }

    public StorageConfig getStorage() {
        return storage;
    }

    public void setStorage(StorageConfig storage) {
        this.storage = storage == null ? new StorageConfig() : storage;
    }

    public RecommendationConfig getRecommendations() {
        return recommendations;
    }

    public void setRecommendations(RecommendationConfig recommendations) {
        this.recommendations = recommendations == null ? new RecommendationConfig() : recommendations;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ForestConfig {
        private int trees = 100;
        private long seed = 42L;
        private int maxDepth;
        private int minSamplesSplit = 2;
        private double testFraction = 0.2;

        public int getTrees() {
            return trees;
        }

        public void setTrees(int trees) {
            this.trees = trees;
        }

        public long getSeed() {
            return seed;
        }

        public void setSeed(long seed) {
            this.seed = seed;
        }

        public int getMaxDepth() {
            return maxDepth;
        }

        public void setMaxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
        }

        public int getMinSamplesSplit() {
            return minSamplesSplit;
        }

        public void setMinSamplesSplit(int minSamplesSplit) {
            this.minSamplesSplit = minSamplesSplit;
        }

        public double getTestFraction() {
            return testFraction;
        }

        public void setTestFraction(double testFraction) {
            this.testFraction = testFraction;
        }

        public ForestHyperparameters toHyperparameters() {
            return new ForestHyperparameters(trees, seed, maxDepth, minSamplesSplit, testFraction);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TrainingConfig extends ForestConfig {
        private int minSamples = 10;
        private double strengthThreshold = 4.0;
        private double lackingThreshold = 3.0;
        private int topKeywords = 5;
        private int maxFeatures = 200;
        private int minDocumentFrequency = 2;
        private int maxNgram = 2;
        private List<String> noiseWords = new ArrayList<>(ImportanceTrainingSettings.DEFAULT_NOISE_WORDS.stream().sorted().toList());

        public TrainingConfig() {
            setMaxDepth(20);
            setMinSamplesSplit(5);
        }

        public int getMinSamples() {
            return minSamples;
        }

        public void setMinSamples(int minSamples) {
            this.minSamples = minSamples;
        }

        public double getStrengthThreshold() {
            return strengthThreshold;
        }

        public void setStrengthThreshold(double strengthThreshold) {
            this.strengthThreshold = strengthThreshold;
        }

        public double getLackingThreshold() {
            return lackingThreshold;
        }

        public void setLackingThreshold(double lackingThreshold) {
            this.lackingThreshold = lackingThreshold;
        }

        public int getTopKeywords() {
            return topKeywords;
        }

        public void setTopKeywords(int topKeywords) {
            this.topKeywords = topKeywords;
        }

        public int getMaxFeatures() {
            return maxFeatures;
        }

        public void setMaxFeatures(int maxFeatures) {
            this.maxFeatures = maxFeatures;
        }

        public int getMinDocumentFrequency() {
            return minDocumentFrequency;
        }

        public void setMinDocumentFrequency(int minDocumentFrequency) {
            this.minDocumentFrequency = minDocumentFrequency;
        }

        public int getMaxNgram() {
            return maxNgram;
        }

        public void setMaxNgram(int maxNgram) {
            this.maxNgram = maxNgram;
        }

        public List<String> getNoiseWords() {
            return noiseWords;
        }

        public void setNoiseWords(List<String> noiseWords) {
            this.noiseWords = noiseWords == null ? new ArrayList<>() : noiseWords;
        }

        public ImportanceTrainingSettings toSettings() {
            return new ImportanceTrainingSettings(
                    minSamples,
                    strengthThreshold,
                    lackingThreshold,
                    topKeywords,
                    maxFeatures,
                    maxNgram,
                    minDocumentFrequency,
                    toHyperparameters(),
                    Set.copyOf(noiseWords));
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RankingConfig extends ForestConfig {
        private double satisfiedThreshold = 4.0;
        private int minSamples = 10;
        private double defaultScore = 3.0;

        public double getSatisfiedThreshold() {
            return satisfiedThreshold;
        }

        public void setSatisfiedThreshold(double satisfiedThreshold) {
            this.satisfiedThreshold = satisfiedThreshold;
        }

        public int getMinSamples() {
            return minSamples;
        }

        public void setMinSamples(int minSamples) {
            this.minSamples = minSamples;
        }

        public double getDefaultScore() {
            return defaultScore;
        }

        public void setDefaultScore(double defaultScore) {
            this.defaultScore = defaultScore;
        }

        public RankingSettings toSettings() {
            return new RankingSettings(satisfiedThreshold, minSamples, defaultScore, toHyperparameters());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DeduplicationConfig {
        private int commonVocabularySize = 35;
        private int overallKeywordCount = 10;
        private double specializationThreshold = 1.0;
        private int minKeywords = 5;
        private int maxKeywords = 5;
        private List<String> ambiguousWords = new ArrayList<>(List.of("good", "nice", "great", "positive"));

        public int getCommonVocabularySize() {
            return commonVocabularySize;
        }

        public void setCommonVocabularySize(int commonVocabularySize) {
            this.commonVocabularySize = commonVocabularySize;
        }

        public int getOverallKeywordCount() {
            return overallKeywordCount;
        }

        public void setOverallKeywordCount(int overallKeywordCount) {
            this.overallKeywordCount = overallKeywordCount;
        }

        public double getSpecializationThreshold() {
            return specializationThreshold;
        }

        public void setSpecializationThreshold(double specializationThreshold) {
            this.specializationThreshold = specializationThreshold;
        }

        public int getMinKeywords() {
            return minKeywords;
        }

        public void setMinKeywords(int minKeywords) {
            this.minKeywords = minKeywords;
        }

        public int getMaxKeywords() {
            return maxKeywords;
        }

        public void setMaxKeywords(int maxKeywords) {
            this.maxKeywords = maxKeywords;
        }

        public List<String> getAmbiguousWords() {
            return ambiguousWords;
        }

        public void setAmbiguousWords(List<String> ambiguousWords) {
            this.ambiguousWords = ambiguousWords == null ? new ArrayList<>() : ambiguousWords;
        }

        public DeduplicationSettings toSettings() {
            return new DeduplicationSettings(
                    commonVocabularySize,
                    overallKeywordCount,
                    specializationThreshold,
                    minKeywords,
                    maxKeywords,
                    Set.copyOf(ambiguousWords));
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StorageConfig {
        private String directory = ".feedback-insights";
        private String sentimentFile = "sentiments.json";

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public String getSentimentFile() {
            return sentimentFile;
        }

        public void setSentimentFile(String sentimentFile) {
            this.sentimentFile = sentimentFile;
        }

        public Path directoryPath() {
            return Path.of(directory);
        }

        public Path sentimentPath() {
            return directoryPath().resolve(sentimentFile);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RecommendationConfig {
        private double lowScoreThreshold = 3.0;
        private int sectionLinesPerInsight = 2;
        private Map<String, String> keywordTriggers = defaultTriggers();
        private Map<String, List<String>> sections = defaultSections();

        public double getLowScoreThreshold() {
            return lowScoreThreshold;
        }

        public void setLowScoreThreshold(double lowScoreThreshold) {
            this.lowScoreThreshold = lowScoreThreshold;
        }

        public int getSectionLinesPerInsight() {
            return sectionLinesPerInsight;
        }

        public void setSectionLinesPerInsight(int sectionLinesPerInsight) {
            this.sectionLinesPerInsight = sectionLinesPerInsight;
        }

        public Map<String, String> getKeywordTriggers() {
            return keywordTriggers;
        }

        public void setKeywordTriggers(Map<String, String> keywordTriggers) {
            this.keywordTriggers = keywordTriggers == null ? new LinkedHashMap<>() : keywordTriggers;
        }

        public Map<String, List<String>> getSections() {
            return sections;
        }

        public void setSections(Map<String, List<String>> sections) {
            this.sections = sections == null ? new LinkedHashMap<>() : sections;
        }

        private static Map<String, String> defaultTriggers() {
            Map<String, String> triggers = new LinkedHashMap<>();
            triggers.put("workload", "Address workload concerns and resource allocation");
            triggers.put("communication", "Improve communication processes and transparency");
            triggers.put("recognition", "Implement better recognition and reward systems");
            return triggers;
        }

        private static Map<String, List<String>> defaultSections() {
            Map<String, List<String>> sections = new LinkedHashMap<>();
            sections.put("Compensation & Benefits", List.of(
                    "Consider reviewing salary structures and benefits packages",
                    "Conduct market research on competitive compensation",
                    "Implement transparent pay scales and promotion criteria"));
            sections.put("Work-Life Balance", List.of(
                    "Review workload distribution and deadlines",
                    "Implement flexible working arrangements",
                    "Encourage proper use of vacation and sick leave"));
            sections.put("Culture & Values", List.of(
                    "Promote inclusive and positive culture initiatives",
                    "Ensure adequate resources and tools are available",
                    "Assess workplace safety and comfort"));
            sections.put("Career Development", List.of(
                    "Create clear career progression paths",
                    "Provide regular training and skill development opportunities",
                    "Implement mentorship programs"));
            sections.put("Management & Leadership", List.of(
                    "Improve communication channels and frequency",
                    "Provide management training and support",
                    "Create open feedback mechanisms"));
            return sections;
        }
    }
}
