package com.conveyal.otpdriver.results;

import org.locationtech.jts.geom.Geometry;

/** The area reachable from one origin within one travel time cutoff. */
public class IsochroneBand {

    public final String fromId;

    /** The travel time cutoff in seconds. */
    public final int time;

    public final Geometry geometry;

    public IsochroneBand (String fromId, int time, Geometry geometry) {
        this.fromId = fromId;
        this.time = time;
        this.geometry = geometry;
    }

}
