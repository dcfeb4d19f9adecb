package com.photoraces.zones;

/**
 * Anything with a latitude and longitude in degrees. Zone planning reads only these two values;
 * the rest of an implementing object is left alone.
 */
public interface LatLng {

    double getLat();

    double getLng();
}
