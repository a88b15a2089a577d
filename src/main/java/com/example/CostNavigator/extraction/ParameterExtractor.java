package com.example.CostNavigator.extraction;

import com.example.CostNavigator.util.RequestBudget;

/**
 * Turns a free-text question into a validated {@link QuerySpecDraft}.
 * Implementations must return a draft that has already been through
 * {@link DraftValidator}; fields that fail validation are absent.
 */
public interface ParameterExtractor {

    ExtractionResult extract(String question, RequestBudget budget);
}
