package com.conveyal.otpdriver.util;

import org.locationtech.jts.geom.GeometryFactory;

/**
 * Shared geometry factory and the validation of latitude and longitude values received from users.
 */
public class GeometryUtils {

    public static final GeometryFactory geometryFactory = new GeometryFactory();

    public static void checkLon (double longitude) {
        if (!Double.isFinite(longitude) || Math.abs(longitude) > 180) {
            throw new IllegalArgumentException("Longitude is not a finite number with absolute value below 180.");
        }
    }

    public static void checkLat (double latitude) {
        // Longitude is allowed to range from -180 to 180, latitude only from -90 to 90.
        if (!Double.isFinite(latitude) || Math.abs(latitude) > 90) {
            throw new IllegalArgumentException("Latitude is not a finite number with absolute value below 90.");
        }
    }

}
