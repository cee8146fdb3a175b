package com.agentic.engine.classifier;

import com.agentic.core.model.IntentType;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class KeywordIntentClassifierTest {

    private final KeywordIntentClassifier classifier = new KeywordIntentClassifier();

    @ParameterizedTest
    @CsvSource({
        "Please refactor the billing module, REFACTORING",
        "Write tests for the parser, TESTING",
        "Create a Dockerfile and a Kubernetes manifest, INFRASTRUCTURE_SETUP",
        "Explain how the cache works, EXPLANATION",
        "Scaffold a new project for the API, PROJECT_SETUP"
    })
    @DisplayName("Unambiguous instructions classify by keyword")
    void testConclusiveKeywords(String text, IntentType expected) {
        KeywordIntentClassifier.Scores scores = classifier.score(text);

        assertThat(scores.isConclusive()).isTrue();
        assertThat(classifier.classify(text, null)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Matching ignores case")
    void testCaseInsensitive() {
        assertThat(classifier.classify("DEPLOY the service TO PRODUCTION", null)).isEqualTo(IntentType.DEPLOYMENT);
    }

    @Test
    @DisplayName("A tie is inconclusive and the best guess follows declaration order")
    void testTieResolution() {
        KeywordIntentClassifier.Scores scores = classifier.score("review and deploy");

        assertThat(scores.hits()).containsEntry(IntentType.CODE_REVIEW, 1).containsEntry(IntentType.DEPLOYMENT, 1);
        assertThat(scores.isConclusive()).isFalse();
        assertThat(scores.bestGuess()).contains(IntentType.CODE_REVIEW);
    }

    @Test
    @DisplayName("Text with no keywords falls back to the configured intent")
    void testNoHits() {
        KeywordIntentClassifier.Scores scores = classifier.score("hello there");

        assertThat(scores.hits()).isEmpty();
        assertThat(scores.isConclusive()).isFalse();
        assertThat(scores.bestGuess()).isEmpty();
        assertThat(classifier.classify("hello there", null)).isEqualTo(IntentType.CODE_GENERATION);
        assertThat(classifier.classify(null, null)).isEqualTo(IntentType.CODE_GENERATION);
    }

    @Test
    @DisplayName("Custom keyword tables replace the defaults")
    void testCustomKeywords() {
        KeywordIntentClassifier custom = new KeywordIntentClassifier(
            Map.of(IntentType.SECURITY_SCAN, List.of("owasp")), IntentType.EXPLANATION);

        assertThat(custom.classify("run an OWASP check", null)).isEqualTo(IntentType.SECURITY_SCAN);
        assertThat(custom.classify("refactor this", null)).isEqualTo(IntentType.EXPLANATION);
    }
}
