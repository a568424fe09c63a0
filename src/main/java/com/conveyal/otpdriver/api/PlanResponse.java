package com.conveyal.otpdriver.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * The response of the OTP 1.x planner endpoint, pared down to the parts we turn into result rows.
 * Exactly one of plan and error is usually present, but OTP may send both when it found no itinerary.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlanResponse {

    /** A dictionary of the parameters provided in the request that triggered this response. */
    public Map<String, String> requestParameters;

    public TripPlan plan;

    public PlannerError error;

    public boolean hasItineraries () {
        return plan != null && plan.itineraries != null && !plan.itineraries.isEmpty();
    }

}
