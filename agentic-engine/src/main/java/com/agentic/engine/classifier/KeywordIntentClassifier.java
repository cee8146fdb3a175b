package com.agentic.engine.classifier;

import com.agentic.core.model.ExecutionContext;
import com.agentic.core.model.IntentType;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Lexical classifier: scores each intent by the number of its keywords found in the text.
 */
public class KeywordIntentClassifier implements IntentClassifier {

    private static final Map<IntentType, List<String>> DEFAULT_KEYWORDS = defaultKeywords();

    private final Map<IntentType, List<String>> keywords;
    private final IntentType fallback;

    public KeywordIntentClassifier() {
        this(IntentType.CODE_GENERATION);
    }

    public KeywordIntentClassifier(IntentType fallback) {
        this(DEFAULT_KEYWORDS, fallback);
    }

    public KeywordIntentClassifier(Map<IntentType, List<String>> keywords, IntentType fallback) {
        this.keywords = new LinkedHashMap<>(keywords);
        this.fallback = fallback;
    }

    @Override
    public IntentType classify(String text, ExecutionContext context) {
        return score(text).bestGuess().orElse(fallback);
    }

    /**
     * Score every intent against the text.
     */
    public Scores score(String text) {
        String normalized = text == null ? "" : text.toLowerCase(Locale.ROOT);
        Map<IntentType, Integer> scores = new EnumMap<>(IntentType.class);
        for (Map.Entry<IntentType, List<String>> entry : keywords.entrySet()) {
            int hits = 0;
            for (String keyword : entry.getValue()) {
                if (normalized.contains(keyword)) {
                    hits++;
                }
            }
            if (hits > 0) {
                scores.put(entry.getKey(), hits);
            }
        }
        return new Scores(scores);
    }

    /**
     * Keyword hit counts per intent. Intents without hits are absent.
     */
    public record Scores(Map<IntentType, Integer> hits) {

        /**
         * The top-scoring intent, if any intent scored. Ties resolve to declaration order.
         */
        public Optional<IntentType> bestGuess() {
            IntentType best = null;
            int bestScore = 0;
            for (IntentType intent : IntentType.values()) {
                int score = hits.getOrDefault(intent, 0);
                if (score > bestScore) {
                    best = intent;
                    bestScore = score;
                }
            }
            return Optional.ofNullable(best);
        }

        /**
         * Conclusive when exactly one intent holds the top score.
         */
        public boolean isConclusive() {
            int top = hits.values().stream().mapToInt(Integer::intValue).max().orElse(0);
            if (top == 0) {
                return false;
            }
            return hits.values().stream().filter(score -> score == top).count() == 1;
        }
    }

    private static Map<IntentType, List<String>> defaultKeywords() {
        Map<IntentType, List<String>> map = new EnumMap<>(IntentType.class);
        map.put(IntentType.CODE_GENERATION, List.of(
            "create a function", "write code", "implement", "generate", "create a class", "build an api", "endpoint"));
        map.put(IntentType.CODE_REVIEW, List.of(
            "review", "code review", "critique", "look over"));
        map.put(IntentType.REFACTORING, List.of(
            "refactor", "clean up", "restructure", "simplify", "extract method"));
        map.put(IntentType.INFRASTRUCTURE_SETUP, List.of(
            "dockerfile", "kubernetes", "terraform", "provision", "infrastructure", "helm chart", "docker-compose"));
        map.put(IntentType.TESTING, List.of(
            "write tests", "unit test", "test coverage", "integration test", "tests for", "test suite"));
        map.put(IntentType.DEPLOYMENT, List.of(
            "deploy", "release", "rollout", "roll out", "ship it", "to production"));
        map.put(IntentType.DOCUMENTATION, List.of(
            "document", "readme", "docs", "docstring", "javadoc", "api reference"));
        map.put(IntentType.DEBUGGING, List.of(
            "debug", "fix", "bug", "stack trace", "exception", "crash", "not working"));
        map.put(IntentType.SECURITY_SCAN, List.of(
            "security", "vulnerab", "cve", "audit", "secrets", "penetration"));
        map.put(IntentType.EXPLANATION, List.of(
            "explain", "what does", "how does", "why does", "walk me through"));
        map.put(IntentType.PROJECT_SETUP, List.of(
            "new project", "bootstrap", "scaffold", "set up a project", "project setup", "from scratch"));
        return map;
    }
}
