package com.example.CostNavigator.model;

import java.math.BigDecimal;

/**
 * Average covered charges across every in-radius hospital that reported one.
 */
public record CostSummary(BigDecimal averageCoveredCharges, int hospitalCount) {
}
