package com.photoraces.zones;

import java.util.List;

import org.locationtech.jts.geom.Envelope;

/**
 * {@link ViewportCalculator} for 256px Web Mercator tiles, the projection every slippy map SDK uses.
 */
public class WebMercatorViewport implements ViewportCalculator {

    public static final int TILE_SIZE = 256;
    public static final int MAX_ZOOM = 18;
    public static final int PADDING_PIXELS = 40;

    private static final double MAX_MERCATOR_LAT = 85.0511287798;

    @Override
    public Bounds calculateBounds(List<? extends LatLng> points) {
        if (points.isEmpty()) {
            return new Bounds(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY,
                    Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
        }
        // x = lng, y = lat
        Envelope envelope = new Envelope();
        for (LatLng p : points) {
            envelope.expandToInclude(p.getLng(), p.getLat());
        }
        return new Bounds(envelope.getMaxY(), envelope.getMinY(), envelope.getMaxX(), envelope.getMinX());
    }

    @Override
    public Coordinate calculateCenter(Bounds bounds) {
        return new Coordinate((bounds.getNorth() + bounds.getSouth()) / 2, (bounds.getEast() + bounds.getWest()) / 2);
    }

    @Override
    public double calculateZoom(Bounds bounds, MapSize mapSize) {
        double lngFraction = bounds.lngSpan() / 360d;
        double latFraction = Math.abs(worldY(bounds.getSouth()) - worldY(bounds.getNorth()));
        double width = Math.max(1, mapSize.getWidth() - 2 * PADDING_PIXELS);
        double height = Math.max(1, mapSize.getHeight() - 2 * PADDING_PIXELS);

        double zoom = Math.min(fitZoom(width, lngFraction), fitZoom(height, latFraction));
        if (Double.isNaN(zoom)) {
            return zoom;
        }
        return Math.max(0, Math.min(MAX_ZOOM, Math.floor(zoom)));
    }

    private static double fitZoom(double pixels, double worldFraction) {
        if (worldFraction == 0) {
            return Double.POSITIVE_INFINITY;
        }
        return Math.log(pixels / (TILE_SIZE * worldFraction)) / Math.log(2);
    }

    /**
     * Latitude to Mercator y, 0 at the top of the world and 1 at the bottom.
     */
    static double worldY(double lat) {
        double clamped = Math.max(-MAX_MERCATOR_LAT, Math.min(MAX_MERCATOR_LAT, lat));
        double sin = Math.sin(Math.toRadians(clamped));
        return 0.5 - 0.25 * Math.log((1 + sin) / (1 - sin)) / Math.PI;
    }
}
