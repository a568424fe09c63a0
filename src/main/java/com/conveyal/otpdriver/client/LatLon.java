package com.conveyal.otpdriver.client;

import com.conveyal.otpdriver.util.GeometryUtils;

import java.util.Locale;

/** A WGS84 location as OTP expects it in fromPlace and toPlace: latitude first. */
public class LatLon {

    public final double lat;
    public final double lon;

    public LatLon (double lat, double lon) {
        GeometryUtils.checkLat(lat);
        GeometryUtils.checkLon(lon);
        this.lat = lat;
        this.lon = lon;
    }

    /** Parse "lat,lon" as typed on the command line. */
    public static LatLon parse (String latCommaLon) {
        String[] parts = latCommaLon.split(",");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Expected a location as lat,lon but got: " + latCommaLon);
        }
        return new LatLon(Double.parseDouble(parts[0].trim()), Double.parseDouble(parts[1].trim()));
    }

    /** The place parameter, e.g. "51.50722,-0.12750". Locale.ROOT keeps the decimal separator a dot. */
    public String toParameter () {
        return String.format(Locale.ROOT, "%.6f,%.6f", lat, lon);
    }

    @Override
    public String toString () {
        return toParameter();
    }

}
