package com.conveyal.otpdriver.client;

import com.conveyal.otpdriver.OtpDriverException;
import org.apache.http.client.utils.URIBuilder;

import java.net.URI;
import java.time.ZonedDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * One origin-destination pair to be sent to the OTP planner endpoint, with the options of the search.
 * The ids are not sent to OTP, they are copied onto every result row so rows can be joined back to the input.
 */
public class PlanRequest {

    public static final double DEFAULT_MAX_WALK_DISTANCE = 1000;

    public static final int DEFAULT_NUM_ITINERARIES = 3;

    public String fromId;

    public LatLon from;

    public String toId;

    public LatLon to;

    public Set<TransportMode> modes = EnumSet.of(TransportMode.CAR);

    /** Departure time, or arrival time if arriveBy is true. Null means now. */
    public ZonedDateTime dateTime;

    public boolean arriveBy = false;

    /** In meters. OTP may exceed it if softWalkLimiting is enabled. */
    public double maxWalkDistance = DEFAULT_MAX_WALK_DISTANCE;

    public int numItineraries = DEFAULT_NUM_ITINERARIES;

    public RoutingOptions routingOptions;

    public PlanRequest () { }

    public PlanRequest (String fromId, LatLon from, String toId, LatLon to) {
        this.fromId = fromId;
        this.from = from;
        this.toId = toId;
        this.to = to;
    }

    public void validate () {
        if (from == null || to == null) {
            throw OtpDriverException.badRequest("Both an origin and a destination are required.");
        }
        if (modes == null || modes.isEmpty()) {
            throw OtpDriverException.badRequest("At least one mode must be given.");
        }
        if (maxWalkDistance < 0) {
            throw OtpDriverException.badRequest("maxWalkDistance must not be negative.");
        }
        if (numItineraries < 1) {
            throw OtpDriverException.badRequest("numItineraries must be at least 1.");
        }
    }

    /**
     * @param now the date and time used when none is set on the request, already in the time zone of the router.
     */
    public URI toUri (OtpConnection connection, ZonedDateTime now) {
        validate();
        ZonedDateTime when = dateTime == null ? now : dateTime;
        URIBuilder builder = connection.endpoint("plan")
                .addParameter("fromPlace", from.toParameter())
                .addParameter("toPlace", to.toParameter())
                .addParameter("mode", TransportMode.toParameter(modes))
                .addParameter("date", OtpDateTime.date(when))
                .addParameter("time", OtpDateTime.time(when))
                .addParameter("arriveBy", Boolean.toString(arriveBy))
                .addParameter("maxWalkDistance", Double.toString(maxWalkDistance))
                .addParameter("numItineraries", Integer.toString(numItineraries));
        if (routingOptions != null) {
            routingOptions.addTo(builder);
        }
        return OtpConnection.build(builder);
    }

    @Override
    public String toString () {
        return String.format("%s (%s) to %s (%s)", fromId, from, toId, to);
    }

}
