package com.conveyal.otpdriver.client;

import com.conveyal.otpdriver.OtpDriverException;
import org.apache.http.client.utils.URIBuilder;

import java.net.URI;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A request for travel time isochrones around one origin. OTP returns one (multi)polygon per cutoff.
 */
public class IsochroneRequest {

    public String fromId;

    public LatLon from;

    public Set<TransportMode> modes = EnumSet.of(TransportMode.TRANSIT, TransportMode.WALK);

    public ZonedDateTime dateTime;

    public boolean arriveBy = false;

    public double maxWalkDistance = PlanRequest.DEFAULT_MAX_WALK_DISTANCE;

    /** Travel time cutoffs in seconds, by default every ten minutes up to an hour. */
    public List<Integer> cutoffSeconds = defaultCutoffs();

    public RoutingOptions routingOptions;

    public IsochroneRequest () { }

    public IsochroneRequest (String fromId, LatLon from) {
        this.fromId = fromId;
        this.from = from;
    }

    private static List<Integer> defaultCutoffs () {
        List<Integer> cutoffs = new ArrayList<>();
        for (int seconds = 600; seconds <= 3600; seconds += 600) {
            cutoffs.add(seconds);
        }
        return cutoffs;
    }

    public void validate () {
        if (from == null) {
            throw OtpDriverException.badRequest("An origin is required.");
        }
        if (modes == null || modes.isEmpty()) {
            throw OtpDriverException.badRequest("At least one mode must be given.");
        }
        if (cutoffSeconds == null || cutoffSeconds.isEmpty()) {
            throw OtpDriverException.badRequest("At least one cutoff is required.");
        }
        for (int cutoff : cutoffSeconds) {
            if (cutoff <= 0) {
                throw OtpDriverException.badRequest("Cutoffs must be positive numbers of seconds, got " + cutoff);
            }
        }
        if (maxWalkDistance < 0) {
            throw OtpDriverException.badRequest("maxWalkDistance must not be negative.");
        }
    }

    public URI toUri (OtpConnection connection, ZonedDateTime now) {
        validate();
        ZonedDateTime when = dateTime == null ? now : dateTime;
        URIBuilder builder = connection.endpoint("isochrone")
                .addParameter("fromPlace", from.toParameter())
                .addParameter("mode", TransportMode.toParameter(modes))
                .addParameter("date", OtpDateTime.date(when))
                .addParameter("time", OtpDateTime.time(when))
                .addParameter("arriveBy", Boolean.toString(arriveBy))
                .addParameter("maxWalkDistance", Double.toString(maxWalkDistance));
        // OTP reads one cutoffSec parameter per isochrone.
        for (int cutoff : cutoffSeconds) {
            builder.addParameter("cutoffSec", Integer.toString(cutoff));
        }
        if (routingOptions != null) {
            routingOptions.addTo(builder);
        }
        return OtpConnection.build(builder);
    }

}
