package com.conveyal.otpdriver.client;

import com.conveyal.otpdriver.OtpDriverException;

import java.net.URI;

/**
 * A search of the OTP geocoder, which matches names of transit stops, stop clusters and street corners.
 */
public class GeocodeRequest {

    public String query;

    /** Match the query as a prefix, as when a user is still typing. */
    public boolean autocomplete = false;

    public boolean stops = true;

    public boolean clusters = false;

    public boolean corners = true;

    public GeocodeRequest () { }

    public GeocodeRequest (String query) {
        this.query = query;
    }

    public URI toUri (OtpConnection connection) {
        if (query == null || query.trim().isEmpty()) {
            throw OtpDriverException.badRequest("A geocoder query is required.");
        }
        if (!stops && !clusters && !corners) {
            throw OtpDriverException.badRequest("At least one of stops, clusters and corners must be searched.");
        }
        return OtpConnection.build(connection.endpoint("geocode")
                .addParameter("query", query.trim())
                .addParameter("autocomplete", Boolean.toString(autocomplete))
                .addParameter("stops", Boolean.toString(stops))
                .addParameter("clusters", Boolean.toString(clusters))
                .addParameter("corners", Boolean.toString(corners)));
    }

}
