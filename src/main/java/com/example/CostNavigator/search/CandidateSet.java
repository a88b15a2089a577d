package com.example.CostNavigator.search;

import java.util.List;

/**
 * @param candidates    offerings inside the radius, in storage order
 * @param coarseMatches rows returned by the bounding-box pre-filter
 */
public record CandidateSet(List<Candidate> candidates, int coarseMatches) {

    public CandidateSet {
        candidates = List.copyOf(candidates);
    }
}
