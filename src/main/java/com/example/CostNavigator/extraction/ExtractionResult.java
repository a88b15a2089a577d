package com.example.CostNavigator.extraction;

public record ExtractionResult(QuerySpecDraft draft, ExtractionOrigin origin) {
}
