package com.example.CostNavigator.search;

import com.example.CostNavigator.geo.GeoPoint;

import java.math.BigDecimal;

/**
 * One (provider, procedure) pair as read from storage, with the provider's rating
 * when it has one.
 */
public record OfferingRow(
        String providerId,
        String name,
        String city,
        String state,
        String zipCode,
        double latitude,
        double longitude,
        String msDrgDefinition,
        BigDecimal averageCoveredCharges,
        BigDecimal averageTotalPayments,
        BigDecimal averageMedicarePayments,
        Integer rating
) {
    public GeoPoint location() {
        return new GeoPoint(latitude, longitude);
    }
}
