package com.example.CostNavigator.geo;

/**
 * Latitude/longitude rectangle that contains every point within a radius of a center.
 * When the longitude band would wrap the antimeridian or the box touches a pole,
 * {@link #longitudeBounded()} is false and only the latitude band applies.
 */
public record BoundingBox(
        double minLatitude,
        double maxLatitude,
        double minLongitude,
        double maxLongitude,
        boolean longitudeBounded
) {

    public static BoundingBox around(GeoPoint center, double radiusKm) {
        double latDelta = Math.toDegrees(radiusKm / GeoMath.EARTH_RADIUS_KM);
        double minLat = center.latitude() - latDelta;
        double maxLat = center.latitude() + latDelta;

        if (minLat <= -90.0 || maxLat >= 90.0) {
            return new BoundingBox(Math.max(minLat, -90.0), Math.min(maxLat, 90.0), -180.0, 180.0, false);
        }

        // Widest longitude span is reached at the latitude closest to a pole.
        double lonDelta = Math.toDegrees(Math.asin(
                Math.min(1.0, Math.sin(radiusKm / GeoMath.EARTH_RADIUS_KM) / Math.cos(Math.toRadians(center.latitude())))));
        double minLon = center.longitude() - lonDelta;
        double maxLon = center.longitude() + lonDelta;
        if (minLon < -180.0 || maxLon > 180.0) {
            return new BoundingBox(minLat, maxLat, -180.0, 180.0, false);
        }
        return new BoundingBox(minLat, maxLat, minLon, maxLon, true);
    }
}
