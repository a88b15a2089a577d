package com.example.CostNavigator.model;

import java.util.Locale;
import java.util.Optional;

public enum RankingIntent {
    CHEAPEST,
    BEST_RATED,
    TOP_N,
    AVERAGE_COST,
    DEFAULT;

    /**
     * Map a loosely written label ("best rated", "best-rated", "TOP_N", ...) onto the
     * vocabulary. Unknown labels yield empty rather than a guess.
     */
    public static Optional<RankingIntent> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalized = label.trim()
                .replace('-', '_')
                .replace(' ', '_')
                .toUpperCase(Locale.ROOT);
        if ("TOP".equals(normalized) || "NEAREST".equals(normalized) || "CLOSEST".equals(normalized)) {
            return Optional.of(TOP_N);
        }
        if ("AVERAGE".equals(normalized) || "COMPARE_COSTS".equals(normalized)) {
            return Optional.of(AVERAGE_COST);
        }
        try {
            return Optional.of(RankingIntent.valueOf(normalized));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
