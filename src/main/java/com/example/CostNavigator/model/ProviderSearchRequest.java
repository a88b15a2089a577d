package com.example.CostNavigator.model;

/**
 * Structured query-string search.
 *
 * @param drg       3-digit MS-DRG code, or text to match against the DRG definition
 * @param zip       5-digit base ZIP code
 * @param radiusKm  optional search radius in kilometers
 * @param limit     optional result limit
 * @param sort      optional ranking label (cheapest, best_rated, top_n, default)
 */
public record ProviderSearchRequest(
        String drg,
        String zip,
        Double radiusKm,
        Integer limit,
        String sort
) {
}
