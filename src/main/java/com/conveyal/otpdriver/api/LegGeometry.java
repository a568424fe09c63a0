package com.conveyal.otpdriver.api;

import com.conveyal.otpdriver.model.json_serialization.LineStringDeserializer;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.locationtech.jts.geom.LineString;

@JsonIgnoreProperties(ignoreUnknown = true)
public class LegGeometry {

    /** Polyline encoded geometry */
    @JsonDeserialize(using = LineStringDeserializer.class)
    public LineString points;

    /** Number of points in the encoded geometry */
    public int length;

}
