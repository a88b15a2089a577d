package com.example.CostNavigator.ranking;

import com.example.CostNavigator.model.CostSummary;
import com.example.CostNavigator.model.RankingIntent;
import com.example.CostNavigator.search.Candidate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Orders candidates for an intent. Every ordering ends in provider id and DRG
 * definition so the result is a total order and repeatable for the same data.
 * The limit is applied only after the full candidate set has been sorted.
 */
@Component
public class ResultRanker {

    private static final Comparator<Candidate> BY_COST = Comparator.comparing(
            Candidate::averageCoveredCharges, Comparator.nullsLast(Comparator.naturalOrder()));

    private static final Comparator<Candidate> BY_DISTANCE = Comparator.comparingDouble(Candidate::distanceKm);

    private static final Comparator<Candidate> BY_RATING_DESC = Comparator.comparing(
            Candidate::rating, Comparator.nullsLast(Comparator.<Integer>reverseOrder()));

    private static final Comparator<Candidate> BY_IDENTITY = Comparator
            .comparing(Candidate::providerId)
            .thenComparing(c -> c.offering().msDrgDefinition());

    static final Comparator<Candidate> CHEAPEST = BY_COST.thenComparing(BY_DISTANCE).thenComparing(BY_IDENTITY);

    static final Comparator<Candidate> BEST_RATED = BY_RATING_DESC
            .thenComparing(BY_COST)
            .thenComparing(BY_DISTANCE)
            .thenComparing(BY_IDENTITY);

    static final Comparator<Candidate> NEAREST = BY_DISTANCE.thenComparing(BY_COST).thenComparing(BY_IDENTITY);

    public List<Candidate> rank(List<Candidate> candidates, RankingIntent intent, int limit) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        List<Candidate> sorted = candidates.stream()
                .sorted(comparatorFor(intent))
                .toList();
        if (intent == RankingIntent.BEST_RATED) {
            // one row per hospital when several DRGs matched
            Set<String> seen = new HashSet<>();
            sorted = sorted.stream()
                    .filter(c -> seen.add(c.providerId()))
                    .toList();
        }
        return sorted.stream().limit(limit).toList();
    }

    /**
     * Average covered charges across every candidate that reports one.
     */
    public Optional<CostSummary> summarize(List<Candidate> candidates) {
        List<Candidate> priced = candidates.stream()
                .filter(c -> c.averageCoveredCharges() != null)
                .toList();
        if (priced.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal total = priced.stream()
                .map(Candidate::averageCoveredCharges)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal average = total.divide(BigDecimal.valueOf(priced.size()), 2, RoundingMode.HALF_UP);
        int hospitals = (int) priced.stream().map(Candidate::providerId).distinct().count();
        return Optional.of(new CostSummary(average, hospitals));
    }

    static Comparator<Candidate> comparatorFor(RankingIntent intent) {
        return switch (intent) {
            case CHEAPEST -> CHEAPEST;
            case BEST_RATED -> BEST_RATED;
            case TOP_N, DEFAULT, AVERAGE_COST -> NEAREST;
        };
    }
}
