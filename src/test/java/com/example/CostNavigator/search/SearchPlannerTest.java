package com.example.CostNavigator.search;

import com.example.CostNavigator.exception.StorageUnavailableException;
import com.example.CostNavigator.geo.BoundingBox;
import com.example.CostNavigator.geo.GeoPoint;
import com.example.CostNavigator.model.ProcedureMatch;
import com.example.CostNavigator.model.QuerySpec;
import com.example.CostNavigator.model.RankingIntent;
import com.example.CostNavigator.repository.OfferingSearchRepository;
import com.example.CostNavigator.util.RequestBudget;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SearchPlannerTest {

    private static final GeoPoint ORIGIN = new GeoPoint(40.7484, -73.9967);
    private static final String KNEE = "470 - MAJOR HIP AND KNEE JOINT REPLACEMENT OR REATTACHMENT OF LOWER EXTREMITY W/O MCC";
    private static final String HEART = "291 - HEART FAILURE AND SHOCK WITH MCC";

    @Mock
    private OfferingSearchRepository repository;

    private SearchPlanner planner;
    private RequestBudget budget;

    @BeforeEach
    void setUp() {
        planner = new SearchPlanner(repository, new FuzzyTextMatcher());
        budget = RequestBudget.start(Duration.ofSeconds(10));
    }

    @Test
    void codeSearchPassesCodeAndDropsRowsOutsideRadius() {
        // the box corner is ~47 km away, inside the box but outside a 40 km radius
        when(repository.findInBox(any(BoundingBox.class), eq("470"), anyInt())).thenReturn(List.of(
                row("P1", KNEE, 0.020684, 0.0),
                row("P2", KNEE, 0.30, 0.40)));

        CandidateSet result = planner.plan(spec(ProcedureMatch.exactCode("470"), 40.0), budget);

        assertEquals(2, result.coarseMatches());
        assertEquals(1, result.candidates().size());
        assertEquals("P1", result.candidates().get(0).providerId());
        assertEquals(2.3, result.candidates().get(0).distanceKm(), 0.01);
    }

    @Test
    void boxIsSizedFromRadiusAndTimeoutFromBudget() {
        when(repository.findInBox(any(BoundingBox.class), eq("470"), anyInt())).thenReturn(List.of());

        planner.plan(spec(ProcedureMatch.exactCode("470"), 40.0), budget);

        ArgumentCaptor<BoundingBox> box = ArgumentCaptor.forClass(BoundingBox.class);
        ArgumentCaptor<Integer> timeout = ArgumentCaptor.forClass(Integer.class);
        verify(repository).findInBox(box.capture(), eq("470"), timeout.capture());
        assertEquals(0.3597, box.getValue().maxLatitude() - ORIGIN.latitude(), 1e-4);
        assertTrue(timeout.getValue() >= 1 && timeout.getValue() <= 10);
    }

    @Test
    void textSearchFiltersByDefinition() {
        when(repository.findInBox(any(BoundingBox.class), isNull(), anyInt())).thenReturn(List.of(
                row("P1", KNEE, 0.01, 0.0),
                row("P1", HEART, 0.01, 0.0)));

        CandidateSet result = planner.plan(spec(ProcedureMatch.fuzzyText("heart failure"), 40.0), budget);

        assertEquals(1, result.candidates().size());
        assertEquals(HEART, result.candidates().get(0).offering().msDrgDefinition());
    }

    @Test
    void storageFailureIsRetryable() {
        when(repository.findInBox(any(BoundingBox.class), eq("470"), anyInt()))
                .thenThrow(new QueryTimeoutException("statement timeout"));

        StorageUnavailableException ex = assertThrows(StorageUnavailableException.class,
                () -> planner.plan(spec(ProcedureMatch.exactCode("470"), 40.0), budget));

        assertTrue(ex.retryable());
        assertEquals("storage_unavailable", ex.code());
    }

    private static QuerySpec spec(ProcedureMatch match, double radiusKm) {
        return new QuerySpec(match, "10001", ORIGIN, radiusKm, RankingIntent.CHEAPEST, 10);
    }

    private static OfferingRow row(String providerId, String drg, double dLat, double dLon) {
        return new OfferingRow(providerId, "Hospital " + providerId, "New York", "NY", "10001",
                ORIGIN.latitude() + dLat, ORIGIN.longitude() + dLon, drg,
                new BigDecimal("50000.00"), new BigDecimal("15000.00"), new BigDecimal("12000.00"), null);
    }
}
