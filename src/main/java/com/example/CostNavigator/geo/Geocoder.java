package com.example.CostNavigator.geo;

import com.example.CostNavigator.exception.UnknownLocationException;

import java.util.Optional;

/**
 * Resolves postal codes to coordinates. Implementations never touch the network.
 */
public interface Geocoder {

    Optional<GeoPoint> resolve(String postalCode);

    /**
     * Like {@link #resolve(String)} but fails with {@link UnknownLocationException}
     * when the code is not in the dataset.
     */
    default GeoPoint locate(String postalCode) {
        return resolve(postalCode).orElseThrow(() -> new UnknownLocationException(postalCode));
    }
}
