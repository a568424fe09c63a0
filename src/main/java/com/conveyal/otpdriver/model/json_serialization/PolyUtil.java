package com.conveyal.otpdriver.model.json_serialization;

import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.List;

/**
 * Decoder for the Google encoded polyline format used by OTP for leg geometries. Each value is a signed delta from
 * the previous one, scaled by 1e5, zig-zag encoded and written in 5-bit chunks offset by 63 into printable ASCII.
 * Latitude comes before longitude in each pair.
 */
public abstract class PolyUtil {

    private static final double PRECISION = 1e5;

    /** @return the decoded points as JTS coordinates, with x the longitude and y the latitude. */
    public static Coordinate[] decode (String encoded) {
        List<Coordinate> coordinates = new ArrayList<>();
        int index = 0;
        int lat = 0;
        int lon = 0;
        while (index < encoded.length()) {
            int[] result = decodeValue(encoded, index);
            lat += result[0];
            index = result[1];
            result = decodeValue(encoded, index);
            lon += result[0];
            index = result[1];
            coordinates.add(new Coordinate(lon / PRECISION, lat / PRECISION));
        }
        return coordinates.toArray(new Coordinate[0]);
    }

    /** @return the decoded value and the index of the character following it. */
    private static int[] decodeValue (String encoded, int index) {
        int shift = 0;
        int result = 0;
        int b;
        do {
            if (index >= encoded.length()) {
                throw new IllegalArgumentException("Truncated encoded polyline: " + encoded);
            }
            b = encoded.charAt(index++) - 63;
            result |= (b & 0x1f) << shift;
            shift += 5;
        } while (b >= 0x20);
        int value = ((result & 1) != 0) ? ~(result >> 1) : (result >> 1);
        return new int[] { value, index };
    }

}
