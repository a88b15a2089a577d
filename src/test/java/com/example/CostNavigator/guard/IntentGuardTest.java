package com.example.CostNavigator.guard;

import com.example.CostNavigator.config.NavigatorProperties;
import com.example.CostNavigator.exception.InvalidInputException;
import com.example.CostNavigator.exception.UnknownLocationException;
import com.example.CostNavigator.extraction.QuerySpecDraft;
import com.example.CostNavigator.geo.GeoPoint;
import com.example.CostNavigator.geo.Geocoder;
import com.example.CostNavigator.model.QuerySpec;
import com.example.CostNavigator.model.RankingIntent;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertFalse;

class IntentGuardTest {

    private static final GeoPoint MANHATTAN = new GeoPoint(40.7484, -73.9967);

    private final Geocoder geocoder = zip -> "10001".equals(zip) ? Optional.of(MANHATTAN) : Optional.empty();
    private final IntentGuard guard = new IntentGuard(new NavigatorProperties(), geocoder);

    @Test
    void nothingRecognizedIsOutOfScope() {
        GuardDecision decision = guard.classify(QuerySpecDraft.empty());

        GuardDecision.OutOfScope outOfScope = assertInstanceOf(GuardDecision.OutOfScope.class, decision);
        assertEquals(IntentGuard.OUT_OF_SCOPE_MESSAGE, outOfScope.message());
    }

    @Test
    void questionWithoutDomainWordsIsOutOfScope() {
        GuardDecision decision = guard.classify("Where is the cheapest gas near 10001?",
                new QuerySpecDraft(null, "gas", "10001", null, RankingIntent.CHEAPEST, null));

        assertInstanceOf(GuardDecision.OutOfScope.class, decision);
    }

    @Test
    void weatherAtAZipIsOutOfScopeNotIncomplete() {
        GuardDecision decision = guard.classify("What's the weather in 10001?",
                new QuerySpecDraft(null, null, "10001", null, null, null));

        assertInstanceOf(GuardDecision.OutOfScope.class, decision);
    }

    @Test
    void bareCodeCountsAsDomainSignal() {
        QuerySpec spec = assertInstanceOf(GuardDecision.InScope.class, guard.classify("cheapest 470 near 10001",
                new QuerySpecDraft("470", null, "10001", null, RankingIntent.CHEAPEST, null))).spec();

        assertEquals("470", spec.procedureMatch().code());
    }

    @Test
    void domainQuestionStillNeedsAZip() {
        InvalidInputException ex = assertThrows(InvalidInputException.class,
                () -> guard.classify("cheapest knee replacement",
                        new QuerySpecDraft(null, "knee replacement", null, null, RankingIntent.CHEAPEST, null)));

        assertEquals("zip", ex.getField());
    }

    @Test
    void defaultsAreApplied() {
        QuerySpec spec = inScope(new QuerySpecDraft("470", null, "10001", null, null, null));

        assertEquals("470", spec.procedureMatch().code());
        assertEquals(MANHATTAN, spec.origin());
        assertEquals(40.0, spec.radiusKm());
        assertEquals(10, spec.limit());
        assertEquals(RankingIntent.CHEAPEST, spec.rankingIntent());
    }

    @Test
    void explicitDefaultIntentIsKept() {
        QuerySpec spec = inScope(new QuerySpecDraft("470", null, "10001", null, RankingIntent.DEFAULT, null));

        assertEquals(RankingIntent.DEFAULT, spec.rankingIntent());
    }

    @Test
    void radiusAndLimitAreClamped() {
        assertEquals(1.0, inScope(new QuerySpecDraft("470", null, "10001", 0.0, null, 0)).radiusKm());
        assertEquals(1.0, inScope(new QuerySpecDraft("470", null, "10001", -5.0, null, null)).radiusKm());

        QuerySpec wide = inScope(new QuerySpecDraft("470", null, "10001", 9_000.0, null, 500));
        assertEquals(500.0, wide.radiusKm());
        assertEquals(50, wide.limit());

        assertEquals(1, inScope(new QuerySpecDraft("470", null, "10001", null, null, -3)).limit());
    }

    @Test
    void textProcedureBecomesFuzzyMatch() {
        QuerySpec spec = inScope(new QuerySpecDraft(null, "knee replacement", "10001", null, null, null));

        assertFalse(spec.procedureMatch().isExactCode());
        assertEquals("knee replacement", spec.procedureMatch().text());
    }

    @Test
    void procedureWithoutZipAsksForZip() {
        InvalidInputException ex = assertThrows(InvalidInputException.class,
                () -> guard.classify(new QuerySpecDraft("470", null, null, null, null, null)));

        assertEquals("zip", ex.getField());
    }

    @Test
    void zipWithoutProcedureAsksForProcedure() {
        InvalidInputException ex = assertThrows(InvalidInputException.class,
                () -> guard.classify(new QuerySpecDraft(null, null, "10001", null, RankingIntent.TOP_N, null)));

        assertEquals("drg", ex.getField());
    }

    @Test
    void unknownZipIsReported() {
        UnknownLocationException ex = assertThrows(UnknownLocationException.class,
                () -> guard.classify(new QuerySpecDraft("470", null, "00000", null, null, null)));

        assertEquals("00000", ex.getPostalCode());
    }

    private QuerySpec inScope(QuerySpecDraft draft) {
        return assertInstanceOf(GuardDecision.InScope.class, guard.classify(draft)).spec();
    }
}
