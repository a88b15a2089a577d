package com.example.CostNavigator.model;

import java.math.BigDecimal;

public record ProviderResult(
        String providerId,
        String name,
        String city,
        String state,
        String zipCode,
        String msDrgDefinition,
        BigDecimal averageCoveredCharges,
        BigDecimal averageTotalPayments,
        BigDecimal averageMedicarePayments,
        Integer rating,
        double distanceKm
) {
}
