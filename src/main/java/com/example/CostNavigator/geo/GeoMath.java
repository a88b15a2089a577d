package com.example.CostNavigator.geo;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class GeoMath {

    /** Mean Earth radius in kilometers. */
    public static final double EARTH_RADIUS_KM = 6371.0;

    public static final double KM_PER_MILE = 1.609344;

    private GeoMath() {
    }

    /**
     * Great-circle distance in kilometers using the haversine formula.
     */
    public static double haversineKm(GeoPoint from, GeoPoint to) {
        double lat1 = Math.toRadians(from.latitude());
        double lat2 = Math.toRadians(to.latitude());
        double dLat = lat2 - lat1;
        double dLon = Math.toRadians(to.longitude() - from.longitude());

        double a = Math.pow(Math.sin(dLat / 2.0), 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.pow(Math.sin(dLon / 2.0), 2);
        double c = 2.0 * Math.atan2(Math.sqrt(a), Math.sqrt(1.0 - a));
        return EARTH_RADIUS_KM * c;
    }

    public static double milesToKm(double miles) {
        return miles * KM_PER_MILE;
    }

    /** One decimal place, half-up, for display. */
    public static double roundForDisplay(double km) {
        return BigDecimal.valueOf(km).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }
}
