package com.conveyal.otpdriver.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class GeoJsonFeatureCollection {

    public String type = "FeatureCollection";

    public List<GeoJsonFeature> features = new ArrayList<>();

}
