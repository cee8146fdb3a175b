package com.agentic.engine.classifier;

import com.agentic.core.model.ExecutionContext;
import com.agentic.core.model.IntentType;
import com.agentic.engine.metrics.OrchestratorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Classification chain used by the orchestrator.
 *
 * 1. Keyword scoring; a unique top score wins.
 * 2. Otherwise the language-model classifier, when configured.
 * 3. Otherwise the keyword best guess.
 * 4. Otherwise the fallback intent.
 */
public class ChainedIntentClassifier implements IntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(ChainedIntentClassifier.class);

    private final KeywordIntentClassifier keywordClassifier;
    private final LanguageModelIntentClassifier languageModelClassifier;
    private final IntentType fallback;
    private final OrchestratorMetrics metrics;

    /**
     * @param languageModelClassifier optional, may be null
     */
    public ChainedIntentClassifier(
            KeywordIntentClassifier keywordClassifier,
            LanguageModelIntentClassifier languageModelClassifier,
            IntentType fallback,
            OrchestratorMetrics metrics) {
        this.keywordClassifier = keywordClassifier;
        this.languageModelClassifier = languageModelClassifier;
        this.fallback = fallback;
        this.metrics = metrics;
    }

    @Override
    public IntentType classify(String text, ExecutionContext context) {
        KeywordIntentClassifier.Scores scores = keywordClassifier.score(text);
        if (scores.isConclusive()) {
            return record(scores.bestGuess().orElseThrow(), "keyword");
        }

        if (languageModelClassifier != null) {
            Optional<IntentType> suggested = languageModelClassifier.suggest(text, context);
            if (suggested.isPresent()) {
                return record(suggested.get(), "language_model");
            }
        }

        Optional<IntentType> guess = scores.bestGuess();
        if (guess.isPresent()) {
            return record(guess.get(), "keyword_guess");
        }
        return record(fallback, "fallback");
    }

    private IntentType record(IntentType intent, String source) {
        log.debug("Classified intent {} via {}", intent.value(), source);
        metrics.intentClassified(intent, source);
        return intent;
    }
}
