package com.example.CostNavigator.extraction;

import com.example.CostNavigator.util.RequestBudget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Inference first, grammar second. A failing collaborator is never visible to the
 * caller: the grammar's draft is returned instead. When inference succeeds, fields
 * it could not supply are filled in from the grammar.
 */
public class FallbackParameterExtractor implements ParameterExtractor {

    private static final Logger log = LoggerFactory.getLogger(FallbackParameterExtractor.class);

    private final ParameterExtractor primary;
    private final ParameterExtractor fallback;

    public FallbackParameterExtractor(ParameterExtractor primary, ParameterExtractor fallback) {
        this.primary = primary;
        this.fallback = fallback;
    }

    @Override
    public ExtractionResult extract(String question, RequestBudget budget) {
        ExtractionResult inferred;
        try {
            inferred = primary.extract(question, budget);
        } catch (RuntimeException ex) {
            log.warn("Inference extraction unavailable, using pattern grammar: {}", ex.getMessage());
            QuerySpecDraft draft = fallback.extract(question, budget).draft();
            return new ExtractionResult(draft, ExtractionOrigin.FALLBACK);
        }

        QuerySpecDraft grammar = fallback.extract(question, budget).draft();
        QuerySpecDraft merged = inferred.draft().fillFrom(grammar);
        ExtractionOrigin origin = merged.equals(inferred.draft())
                ? inferred.origin()
                : ExtractionOrigin.INFERENCE_WITH_FALLBACK;
        return new ExtractionResult(merged, origin);
    }
}
