package com.conveyal.otpdriver.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** A match of the OTP geocoder. Note the longitude field is named lng here, unlike everywhere else in OTP. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GeocodeResult {

    public String id;

    public String description;

    public double lat;

    public double lng;

}
