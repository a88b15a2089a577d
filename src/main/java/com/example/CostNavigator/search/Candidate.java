package com.example.CostNavigator.search;

import java.math.BigDecimal;

/**
 * An offering that passed the exact distance check, with that distance attached.
 */
public record Candidate(OfferingRow offering, double distanceKm) {

    public String providerId() {
        return offering.providerId();
    }

    public BigDecimal averageCoveredCharges() {
        return offering.averageCoveredCharges();
    }

    public Integer rating() {
        return offering.rating();
    }
}
