package com.example.CostNavigator.guard;

import com.example.CostNavigator.config.NavigatorProperties;
import com.example.CostNavigator.exception.InvalidInputException;
import com.example.CostNavigator.extraction.QuerySpecDraft;
import com.example.CostNavigator.geo.GeoPoint;
import com.example.CostNavigator.geo.Geocoder;
import com.example.CostNavigator.model.ProcedureMatch;
import com.example.CostNavigator.model.QuerySpec;
import com.example.CostNavigator.model.RankingIntent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Decides whether a validated draft is a question this service answers and, if so,
 * promotes it to a {@link QuerySpec} with defaults and clamps applied.
 */
@Component
@RequiredArgsConstructor
public class IntentGuard {

    public static final String OUT_OF_SCOPE_MESSAGE =
            "I can only help with hospital pricing and quality information. "
                    + "Please ask about medical procedures, costs, or hospital ratings near a ZIP code.";

    private final NavigatorProperties properties;
    private final Geocoder geocoder;

    /**
     * Free-text variant: a question with no DRG code and no hospital, procedure, price or
     * rating vocabulary is out of scope whatever else was extracted from it.
     */
    public GuardDecision classify(String question, QuerySpecDraft draft) {
        if (draft.procedureCode() == null && !DomainVocabulary.mentionsDomain(question)) {
            return new GuardDecision.OutOfScope(OUT_OF_SCOPE_MESSAGE);
        }
        return classify(draft);
    }

    /**
     * @throws InvalidInputException when the request is in scope but incomplete
     * @throws com.example.CostNavigator.exception.UnknownLocationException when the ZIP code is not known
     */
    public GuardDecision classify(QuerySpecDraft draft) {
        if (!draft.hasProcedure() && !draft.hasLocation()) {
            return new GuardDecision.OutOfScope(OUT_OF_SCOPE_MESSAGE);
        }
        if (!draft.hasLocation()) {
            throw new InvalidInputException("zip", "Please include a 5-digit ZIP code in your question.");
        }
        if (!draft.hasProcedure()) {
            throw new InvalidInputException("drg",
                    "Please name a procedure, either a 3-digit DRG code or a description such as 'knee replacement'.");
        }

        GeoPoint origin = geocoder.locate(draft.postalCode());
        ProcedureMatch match = draft.procedureCode() != null
                ? ProcedureMatch.exactCode(draft.procedureCode())
                : ProcedureMatch.fuzzyText(draft.procedureText());

        return new GuardDecision.InScope(new QuerySpec(
                match,
                draft.postalCode(),
                origin,
                resolveRadius(draft.radiusKm()),
                resolveIntent(draft.rankingIntent()),
                resolveLimit(draft.limit())
        ));
    }

    double resolveRadius(Double requested) {
        NavigatorProperties.Search search = properties.getSearch();
        if (requested == null) {
            return search.getDefaultRadiusKm();
        }
        return Math.min(search.getMaxRadiusKm(), Math.max(search.getMinRadiusKm(), requested));
    }

    int resolveLimit(Integer requested) {
        NavigatorProperties.Search search = properties.getSearch();
        if (requested == null) {
            return search.getDefaultLimit();
        }
        return Math.min(search.getMaxLimit(), Math.max(1, requested));
    }

    static RankingIntent resolveIntent(RankingIntent requested) {
        return requested == null ? RankingIntent.CHEAPEST : requested;
    }
}
