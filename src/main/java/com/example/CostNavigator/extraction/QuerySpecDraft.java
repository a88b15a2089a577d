package com.example.CostNavigator.extraction;

import com.example.CostNavigator.model.RankingIntent;

/**
 * Candidate query fields as extracted from a request. Any field may be absent, and
 * none of them are trusted until {@link DraftValidator} has passed over the draft.
 *
 * @param procedureCode  3-digit MS-DRG code
 * @param procedureText  free-text procedure fragment, used when no code is known
 * @param postalCode     ZIP code the radius is centered on
 * @param radiusKm       radius, already converted to kilometers
 * @param rankingIntent  requested ordering
 * @param limit          requested number of results
 */
public record QuerySpecDraft(
        String procedureCode,
        String procedureText,
        String postalCode,
        Double radiusKm,
        RankingIntent rankingIntent,
        Integer limit
) {
    public static QuerySpecDraft empty() {
        return new QuerySpecDraft(null, null, null, null, null, null);
    }

    public boolean hasProcedure() {
        return procedureCode != null || procedureText != null;
    }

    public boolean hasLocation() {
        return postalCode != null;
    }

    /**
     * Fill absent fields from {@code other}. A procedure is taken as a unit so a
     * code from one draft never ends up next to text from another.
     */
    public QuerySpecDraft fillFrom(QuerySpecDraft other) {
        if (other == null) {
            return this;
        }
        boolean takeProcedure = !hasProcedure();
        return new QuerySpecDraft(
                takeProcedure ? other.procedureCode : procedureCode,
                takeProcedure ? other.procedureText : procedureText,
                postalCode != null ? postalCode : other.postalCode,
                radiusKm != null ? radiusKm : other.radiusKm,
                rankingIntent != null ? rankingIntent : other.rankingIntent,
                limit != null ? limit : other.limit
        );
    }
}
