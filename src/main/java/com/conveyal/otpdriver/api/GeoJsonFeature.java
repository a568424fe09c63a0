package com.conveyal.otpdriver.api;

import com.conveyal.otpdriver.model.json_serialization.GeometryDeserializer;
import com.conveyal.otpdriver.model.json_serialization.GeometrySerializer;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.locationtech.jts.geom.Geometry;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * GeoJSON Feature with a JTS geometry. Read from the isochrone endpoint and written when exporting results.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GeoJsonFeature {

    public Map<String, Object> properties = new LinkedHashMap<>();

    @JsonSerialize(using = GeometrySerializer.class)
    @JsonDeserialize(using = GeometryDeserializer.class)
    public Geometry geometry;

    public GeoJsonFeature () { }

    public GeoJsonFeature (Geometry geometry) {
        this.geometry = geometry;
    }

    public String getType () {
        return "Feature";
    }

    public void addProperty (String propertyName, Object propertyValue) {
        properties.put(propertyName, propertyValue);
    }

}
