package com.photoraces.util;

import java.util.List;

import com.photoraces.zones.LatLng;

public final class GeoValidator {

    private GeoValidator() {
    }

    public static boolean isValidLatitude(double lat) {
        return Double.isFinite(lat) && lat >= -90 && lat <= 90;
    }

    public static boolean isValidLongitude(double lng) {
        return Double.isFinite(lng) && lng >= -180 && lng <= 180;
    }

    public static boolean isValidCoordinate(double lat, double lng) {
        return isValidLatitude(lat) && isValidLongitude(lng);
    }

    /**
     * Throws {@link IllegalArgumentException} naming the first point whose coordinates are out of range.
     */
    public static void requireValidPoints(List<? extends LatLng> points) {
        for (int i = 0; i < points.size(); i++) {
            LatLng p = points.get(i);
            if (p == null) {
                throw new IllegalArgumentException("pois[" + i + "] is null");
            }
            if (!isValidCoordinate(p.getLat(), p.getLng())) {
                throw new IllegalArgumentException(String.format(
                        "pois[%d] has invalid coordinates (%s, %s)", i, p.getLat(), p.getLng()));
            }
        }
    }
}
