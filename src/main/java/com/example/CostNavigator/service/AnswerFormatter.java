package com.example.CostNavigator.service;

import com.example.CostNavigator.model.CostSummary;
import com.example.CostNavigator.model.RankingIntent;
import com.example.CostNavigator.search.Candidate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * One-line, human readable summary that accompanies natural-language answers.
 */
@Component
public class AnswerFormatter {

    static final String NO_RESULTS = "No matching hospitals found within the radius.";
    static final String NO_AVERAGE = "No matching hospitals found to compute an average.";

    public String format(RankingIntent intent, List<Candidate> ranked, CostSummary summary) {
        if (intent == RankingIntent.AVERAGE_COST) {
            if (summary == null) {
                return NO_AVERAGE;
            }
            return "Average covered charges: " + dollars(summary.averageCoveredCharges())
                    + " across " + summary.hospitalCount() + " hospitals.";
        }
        if (ranked.isEmpty()) {
            return NO_RESULTS;
        }
        return switch (intent) {
            case BEST_RATED -> ranked.stream()
                    .map(c -> c.offering().name() + " (rating: "
                            + (c.rating() != null ? c.rating() : "N/A") + ")")
                    .collect(Collectors.joining("; "));
            case TOP_N, DEFAULT -> ranked.stream()
                    .map(c -> String.format(Locale.US, "%s (%.1f km)", c.offering().name(), c.distanceKm()))
                    .collect(Collectors.joining("; "));
            default -> cheapest(ranked.get(0));
        };
    }

    private static String cheapest(Candidate best) {
        if (best.averageCoveredCharges() == null) {
            return "Based on data, " + best.offering().name() + " is the closest match; no charges were reported.";
        }
        return "Based on data, " + best.offering().name() + " at "
                + dollars(best.averageCoveredCharges()) + " average covered charges.";
    }

    static String dollars(BigDecimal amount) {
        return String.format(Locale.US, "$%,.0f", amount);
    }
}
