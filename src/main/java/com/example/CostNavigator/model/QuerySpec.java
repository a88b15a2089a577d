package com.example.CostNavigator.model;

import com.example.CostNavigator.geo.GeoPoint;

import java.util.Objects;

/**
 * Fully validated query. Instances are only created by the intent guard, after
 * every field has been range-checked or mapped onto a closed vocabulary.
 */
public record QuerySpec(
        ProcedureMatch procedureMatch,
        String postalCode,
        GeoPoint origin,
        double radiusKm,
        RankingIntent rankingIntent,
        int limit
) {
    public QuerySpec {
        Objects.requireNonNull(procedureMatch, "procedureMatch");
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(rankingIntent, "rankingIntent");
        if (!(radiusKm > 0.0) || Double.isInfinite(radiusKm)) {
            throw new IllegalArgumentException("radiusKm must be positive: " + radiusKm);
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
    }
}
