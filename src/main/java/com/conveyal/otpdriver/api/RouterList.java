package com.conveyal.otpdriver.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/** The response of /otp/routers, describing every router loaded by the OTP instance. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RouterList {

    public List<RouterInfo> routerInfo = new ArrayList<>();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RouterInfo {

        public String routerId;

        /** Milliseconds since the epoch. */
        public Long buildTime;

        public Long transitServiceStarts;

        public Long transitServiceEnds;

        public List<String> transitModes;

        public double centerLatitude;

        public double centerLongitude;

    }

}
