package com.conveyal.otpdriver.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/** One complete trip, made of legs each using a single mode. Times are in seconds, instants in epoch milliseconds. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Itinerary {

    public long duration;

    public Long startTime;

    public Long endTime;

    public long walkTime;

    public long transitTime;

    public long waitingTime;

    /** In meters. */
    public double walkDistance;

    public boolean walkLimitExceeded;

    public double elevationLost;

    public double elevationGained;

    public int transfers;

    public boolean tooSloped;

    public List<Leg> legs = new ArrayList<>();

}
