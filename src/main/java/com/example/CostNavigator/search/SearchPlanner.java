package com.example.CostNavigator.search;

import com.example.CostNavigator.exception.StorageUnavailableException;
import com.example.CostNavigator.geo.BoundingBox;
import com.example.CostNavigator.geo.GeoMath;
import com.example.CostNavigator.model.ProcedureMatch;
import com.example.CostNavigator.model.QuerySpec;
import com.example.CostNavigator.repository.OfferingSearchRepository;
import com.example.CostNavigator.util.RequestBudget;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Two-phase candidate search:
 * 1. Coarse: bounding box around the origin (plus exact DRG code when given), in SQL.
 * 2. Fuzzy text match for text queries, then exact haversine distance against the radius.
 *
 * The box only narrows; the radius contract is enforced by step 2 alone.
 */
@Service
@RequiredArgsConstructor
public class SearchPlanner {

    private static final Logger log = LoggerFactory.getLogger(SearchPlanner.class);

    private final OfferingSearchRepository offeringSearchRepository;
    private final FuzzyTextMatcher fuzzyTextMatcher;

    public CandidateSet plan(QuerySpec spec, RequestBudget budget) {
        BoundingBox box = BoundingBox.around(spec.origin(), spec.radiusKm());
        ProcedureMatch match = spec.procedureMatch();

        List<OfferingRow> coarse;
        try {
            coarse = offeringSearchRepository.findInBox(box, match.code(), budget.remainingSecondsCeil());
        } catch (DataAccessException ex) {
            throw new StorageUnavailableException("Provider data is temporarily unavailable", ex);
        }

        List<Candidate> candidates = coarse.stream()
                .filter(row -> match.isExactCode() || fuzzyTextMatcher.matches(match.text(), row.msDrgDefinition()))
                .map(row -> new Candidate(row, GeoMath.haversineKm(spec.origin(), row.location())))
                .filter(candidate -> candidate.distanceKm() <= spec.radiusKm())
                .toList();

        log.debug("Search {} around {} within {} km: {} coarse rows, {} candidates",
                match, spec.postalCode(), spec.radiusKm(), coarse.size(), candidates.size());
        return new CandidateSet(candidates, coarse.size());
    }
}
