package com.conveyal.otpdriver.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** A part of an itinerary using a single mode, or a single transit vehicle. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Leg {

    public Long startTime;

    public Long endTime;

    /** In meters. */
    public double distance;

    /** In seconds. */
    public double duration;

    public String mode;

    public boolean transitLeg;

    public String route;

    public String routeShortName;

    public String routeLongName;

    public String routeId;

    public String tripId;

    public String agencyName;

    public String headsign;

    public Place from;

    public Place to;

    public LegGeometry legGeometry;

    /** The short route name if there is one, as shown on vehicles, otherwise whatever OTP reports as the route. */
    public String routeLabel () {
        if (routeShortName != null && !routeShortName.isEmpty()) return routeShortName;
        if (route != null && !route.isEmpty()) return route;
        return routeLongName;
    }

}
