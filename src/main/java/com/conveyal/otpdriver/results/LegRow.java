package com.conveyal.otpdriver.results;

import org.locationtech.jts.geom.LineString;

import java.time.ZonedDateTime;

/**
 * One leg of one itinerary, with the itinerary it belongs to repeated on every row. This is the flat table form of a
 * trip plan, where the geometry column holds the path of the leg.
 */
public class LegRow {

    public String fromId;
    public String toId;

    // Itinerary columns
    public int itinerary;
    /** Seconds. */
    public long duration;
    public ZonedDateTime startTime;
    public ZonedDateTime endTime;
    public long walkTime;
    public long transitTime;
    public long waitingTime;
    /** Meters. */
    public double walkDistance;
    public int transfers;

    // Leg columns
    public int leg;
    public String mode;
    public String route;
    public String agencyName;
    /** Meters. */
    public double distance;
    public double legDuration;
    public ZonedDateTime legStartTime;
    public ZonedDateTime legEndTime;
    public String fromPlace;
    public String fromStopId;
    public String toPlace;
    public String toStopId;
    public LineString geometry;

}
