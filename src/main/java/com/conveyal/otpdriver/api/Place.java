package com.conveyal.otpdriver.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** The start or end of a leg or trip plan. Stop fields are only set when the place is a transit stop. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Place {

    public String name;

    public double lat;

    public double lon;

    public String stopId;

    public String stopCode;

    public String vertexType;

}
