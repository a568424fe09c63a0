package com.conveyal.otpdriver.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/** A set of ways to get from point A to point B at time T. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TripPlan {

    /** The time and date of travel, milliseconds since the epoch. */
    public Long date;

    public Place from;

    public Place to;

    public List<Itinerary> itineraries = new ArrayList<>();

}
