package com.conveyal.otpdriver.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Why OTP could not plan a trip, e.g. id 404 with message PATH_NOT_FOUND. The msg field holds the English text.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlannerError {

    public int id;

    public String msg;

    public String message;

    public List<String> missing;

    public boolean noPath;

    public String describe () {
        if (msg != null && !msg.isEmpty()) return msg;
        if (message != null && !message.isEmpty()) return message;
        return "OTP error " + id;
    }

}
