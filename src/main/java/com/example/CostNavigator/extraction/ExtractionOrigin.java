package com.example.CostNavigator.extraction;

/**
 * Which strategy produced a draft. Logged and echoed for diagnostics, never ranked on.
 */
public enum ExtractionOrigin {
    PATTERN,
    INFERENCE,
    INFERENCE_WITH_FALLBACK,
    FALLBACK
}
