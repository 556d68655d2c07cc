package com.feedbackinsights.sentiment;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Rule-based compound valence scoring in the style of VADER: lexicon valence
 * per token, adjusted for capitalisation, boosters, negation, contrastive
 * "but" and trailing punctuation, then squashed into [-1, 1].
 */
public class SentimentScorer {
    private static final double BOOST_INCREMENT = 0.293;
    private static final double BOOST_DECREMENT = -0.293;
    private static final double CAPS_INCREMENT = 0.733;
    private static final double NEGATION_SCALAR = -0.74;
    private static final double NORMALIZATION_ALPHA = 15.0;
    private static final double EXCLAMATION_WEIGHT = 0.292;
    private static final int MAX_EXCLAMATIONS = 4;
    private static final double QUESTION_WEIGHT = 0.18;
    private static final double QUESTION_CAP = 0.96;

    private static final Set<String> NEGATIONS = Set.of(
            "aint", "arent", "cannot", "cant", "couldnt", "darent", "didnt", "doesnt",
            "ain't", "aren't", "can't", "couldn't", "daren't", "didn't", "doesn't",
            "dont", "hadnt", "hasnt", "havent", "isnt", "mightnt", "mustnt", "neither",
            "don't", "hadn't", "hasn't", "haven't", "isn't", "mightn't", "mustn't",
            "neednt", "needn't", "never", "none", "nope", "nor", "not", "nothing", "nowhere",
            "oughtnt", "shant", "shouldnt", "uhuh", "wasnt", "werent",
            "oughtn't", "shan't", "shouldn't", "uh-uh", "wasn't", "weren't",
            "without", "wont", "wouldnt", "won't", "wouldn't", "rarely", "seldom", "despite");

    private static final Map<String, Double> BOOSTERS = Map.ofEntries(
            Map.entry("absolutely", BOOST_INCREMENT), Map.entry("amazingly", BOOST_INCREMENT),
            Map.entry("awfully", BOOST_INCREMENT), Map.entry("completely", BOOST_INCREMENT),
            Map.entry("considerably", BOOST_INCREMENT), Map.entry("decidedly", BOOST_INCREMENT),
            Map.entry("deeply", BOOST_INCREMENT), Map.entry("enormously", BOOST_INCREMENT),
            Map.entry("entirely", BOOST_INCREMENT), Map.entry("especially", BOOST_INCREMENT),
            Map.entry("exceptionally", BOOST_INCREMENT), Map.entry("extremely", BOOST_INCREMENT),
            Map.entry("fully", BOOST_INCREMENT), Map.entry("greatly", BOOST_INCREMENT),
            Map.entry("highly", BOOST_INCREMENT), Map.entry("hugely", BOOST_INCREMENT),
            Map.entry("incredibly", BOOST_INCREMENT), Map.entry("intensely", BOOST_INCREMENT),
            Map.entry("majorly", BOOST_INCREMENT), Map.entry("more", BOOST_INCREMENT),
            Map.entry("most", BOOST_INCREMENT), Map.entry("particularly", BOOST_INCREMENT),
            Map.entry("purely", BOOST_INCREMENT), Map.entry("quite", BOOST_INCREMENT),
            Map.entry("really", BOOST_INCREMENT), Map.entry("remarkably", BOOST_INCREMENT),
            Map.entry("so", BOOST_INCREMENT), Map.entry("substantially", BOOST_INCREMENT),
            Map.entry("thoroughly", BOOST_INCREMENT), Map.entry("totally", BOOST_INCREMENT),
            Map.entry("tremendously", BOOST_INCREMENT), Map.entry("unbelievably", BOOST_INCREMENT),
            Map.entry("unusually", BOOST_INCREMENT), Map.entry("utterly", BOOST_INCREMENT),
            Map.entry("very", BOOST_INCREMENT),
            Map.entry("almost", BOOST_DECREMENT), Map.entry("barely", BOOST_DECREMENT),
            Map.entry("hardly", BOOST_DECREMENT), Map.entry("kinda", BOOST_DECREMENT),
            Map.entry("less", BOOST_DECREMENT), Map.entry("little", BOOST_DECREMENT),
            Map.entry("marginally", BOOST_DECREMENT), Map.entry("occasionally", BOOST_DECREMENT),
            Map.entry("partly", BOOST_DECREMENT), Map.entry("scarcely", BOOST_DECREMENT),
            Map.entry("slightly", BOOST_DECREMENT), Map.entry("somewhat", BOOST_DECREMENT),
            Map.entry("sorta", BOOST_DECREMENT));

    private final SentimentLexicon lexicon;

    public SentimentScorer() {
        this(new SentimentLexicon());
    }

    public SentimentScorer(SentimentLexicon lexicon) {
        this.lexicon = lexicon;
    }

    public SentimentResult analyze(String text) {
        if (text == null || text.isBlank()) {
            return SentimentResult.empty();
        }
        List<String> words = words(text);
        if (words.isEmpty()) {
            return SentimentResult.empty();
        }
        boolean capsDifferential = hasCapsDifferential(words);

        List<Double> sentiments = new ArrayList<>(words.size());
        for (int i = 0; i < words.size(); i++) {
            String lower = lower(words.get(i));
            if (BOOSTERS.containsKey(lower)) {
                sentiments.add(0.0);
                continue;
            }
            if ("kind".equals(lower) && i < words.size() - 1 && "of".equals(lower(words.get(i + 1)))) {
                sentiments.add(0.0);
                continue;
            }
            sentiments.add(valenceAt(words, i, capsDifferential));
        }
        applyButRule(words, sentiments);
        return score(sentiments, text);
    }

    private double valenceAt(List<String> words, int i, boolean capsDifferential) {
        String item = words.get(i);
        String lower = lower(item);
        if (!lexicon.contains(lower)) {
            return 0.0;
        }
        double valence = lexicon.valence(lower);

        if ("no".equals(lower) && i < words.size() - 1 && lexicon.contains(words.get(i + 1))) {
            valence = 0.0;
        }
        if ((i > 0 && "no".equals(lower(words.get(i - 1))))
                || (i > 1 && "no".equals(lower(words.get(i - 2))))
                || (i > 2 && "no".equals(lower(words.get(i - 3)))
                        && Set.of("or", "nor").contains(lower(words.get(i - 1))))) {
            valence = lexicon.valence(lower) * NEGATION_SCALAR;
        }

        if (capsDifferential && isUpper(item)) {
            valence += valence > 0 ? CAPS_INCREMENT : -CAPS_INCREMENT;
        }

        for (int distance = 1; distance <= 3; distance++) {
            if (i < distance) {
                break;
            }
            String preceding = words.get(i - distance);
            if (lexicon.contains(preceding)) {
                continue;
            }
            double scalar = boosterScalar(preceding, valence, capsDifferential);
            if (distance == 2) {
                scalar *= 0.95;
            } else if (distance == 3) {
                scalar *= 0.9;
            }
            valence += scalar;
            valence = negationAdjusted(valence, words, distance, i);
        }
        return leastAdjusted(valence, words, i);
    }

    private double boosterScalar(String word, double valence, boolean capsDifferential) {
        Double boost = BOOSTERS.get(lower(word));
        if (boost == null) {
            return 0.0;
        }
        double scalar = valence < 0 ? -boost : boost;
        if (capsDifferential && isUpper(word)) {
            scalar += valence > 0 ? CAPS_INCREMENT : -CAPS_INCREMENT;
        }
        return scalar;
    }

    private double negationAdjusted(double valence, List<String> words, int distance, int i) {
        String first = lower(words.get(i - distance));
        if (distance == 1) {
            return isNegation(first) ? valence * NEGATION_SCALAR : valence;
        }
        String previous = lower(words.get(i - 1));
        String middle = distance == 3 ? lower(words.get(i - 2)) : previous;
        if ("never".equals(first) && (isSoOrThis(middle) || isSoOrThis(previous))) {
            return valence * 1.25;
        }
        if ("without".equals(first) && ("doubt".equals(middle) || "doubt".equals(previous))) {
            return valence;
        }
        return isNegation(first) ? valence * NEGATION_SCALAR : valence;
    }

    private double leastAdjusted(double valence, List<String> words, int i) {
        if (i > 1 && !lexicon.contains(words.get(i - 1)) && "least".equals(lower(words.get(i - 1)))) {
            String beforeLeast = lower(words.get(i - 2));
            if (!"at".equals(beforeLeast) && !"very".equals(beforeLeast)) {
                return valence * NEGATION_SCALAR;
            }
        } else if (i > 0 && !lexicon.contains(words.get(i - 1)) && "least".equals(lower(words.get(i - 1)))) {
            return valence * NEGATION_SCALAR;
        }
        return valence;
    }

    private void applyButRule(List<String> words, List<Double> sentiments) {
        int butIndex = -1;
        for (int i = 0; i < words.size(); i++) {
            if ("but".equals(lower(words.get(i)))) {
                butIndex = i;
                break;
            }
        }
        if (butIndex < 0) {
            return;
        }
        for (int i = 0; i < sentiments.size(); i++) {
            if (i < butIndex) {
                sentiments.set(i, sentiments.get(i) * 0.5);
            } else if (i > butIndex) {
                sentiments.set(i, sentiments.get(i) * 1.5);
            }
        }
    }

    private SentimentResult score(List<Double> sentiments, String text) {
        double sum = 0.0;
        for (double sentiment : sentiments) {
            sum += sentiment;
        }
        double punctuation = punctuationEmphasis(text);
        if (sum > 0) {
            sum += punctuation;
        } else if (sum < 0) {
            sum -= punctuation;
        }
        double compound = sum / Math.sqrt(sum * sum + NORMALIZATION_ALPHA);
        compound = Math.max(-1.0, Math.min(1.0, compound));

        double positiveSum = 0.0;
        double negativeSum = 0.0;
        int neutralCount = 0;
        for (double sentiment : sentiments) {
            if (sentiment > 0) {
                positiveSum += sentiment + 1;
            } else if (sentiment < 0) {
                negativeSum += sentiment - 1;
            } else {
                neutralCount++;
            }
        }
        if (positiveSum > Math.abs(negativeSum)) {
            positiveSum += punctuation;
        } else if (positiveSum < Math.abs(negativeSum)) {
            negativeSum -= punctuation;
        }
        double total = positiveSum + Math.abs(negativeSum) + neutralCount;
        if (total == 0.0) {
            return SentimentResult.empty();
        }
        double pos = round(Math.abs(positiveSum / total), 3);
        double neg = round(Math.abs(negativeSum / total), 3);
        double neu = round(Math.abs(neutralCount / total), 3);
        return SentimentResult.fromScores(round(compound, 4), pos, neu, neg);
    }

    private double punctuationEmphasis(String text) {
        long exclamations = text.chars().filter(ch -> ch == '!').count();
        double amplifier = Math.min(exclamations, MAX_EXCLAMATIONS) * EXCLAMATION_WEIGHT;
        long questions = text.chars().filter(ch -> ch == '?').count();
        if (questions > 1) {
            amplifier += questions <= 3 ? questions * QUESTION_WEIGHT : QUESTION_CAP;
        }
        return amplifier;
    }

    private static List<String> words(String text) {
        List<String> words = new ArrayList<>();
        for (String raw : text.strip().split("\\s+")) {
            String stripped = stripPunctuation(raw);
            String word = stripped.length() <= 2 ? raw : stripped;
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words;
    }

    private static String stripPunctuation(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && isPunctuation(token.charAt(start))) {
            start++;
        }
        while (end > start && isPunctuation(token.charAt(end - 1))) {
            end--;
        }
        return token.substring(start, end);
    }

    private static boolean isPunctuation(char ch) {
        return ch < 128 && !Character.isLetterOrDigit(ch) && !Character.isWhitespace(ch);
    }

    private static boolean hasCapsDifferential(List<String> words) {
        long upper = words.stream().filter(SentimentScorer::isUpper).count();
        long differential = words.size() - upper;
        return differential > 0 && differential < words.size();
    }

    private static boolean isUpper(String word) {
        boolean hasLetter = false;
        for (int i = 0; i < word.length(); i++) {
            char ch = word.charAt(i);
            if (Character.isLowerCase(ch)) {
                return false;
            }
            if (Character.isUpperCase(ch)) {
                hasLetter = true;
            }
        }
        return hasLetter;
    }

    private static boolean isNegation(String lowerWord) {
        return NEGATIONS.contains(lowerWord) || lowerWord.contains("n't");
    }

    private static boolean isSoOrThis(String lowerWord) {
        return "so".equals(lowerWord) || "this".equals(lowerWord);
    }

    private static String lower(String word) {
        return word.toLowerCase(Locale.ROOT);
    }

    private static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }
}
