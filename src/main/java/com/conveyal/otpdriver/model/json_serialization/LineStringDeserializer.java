package com.conveyal.otpdriver.model.json_serialization;

import com.conveyal.otpdriver.util.GeometryUtils;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LineString;

import java.io.IOException;

/**
 * A Jackson deserializer reading Google encoded polylines into LineStrings.
 */
public class LineStringDeserializer extends JsonDeserializer<LineString> {

    @Override
    public LineString deserialize (JsonParser jsonParser, DeserializationContext deserializationContext)
            throws IOException {
        Coordinate[] coordinates;
        try {
            coordinates = PolyUtil.decode(jsonParser.getText());
        } catch (IllegalArgumentException e) {
            throw deserializationContext.weirdStringException(jsonParser.getText(), LineString.class, e.getMessage());
        }
        // A LineString needs zero or at least two points. OTP occasionally encodes a single point for very short legs.
        if (coordinates.length == 1) {
            coordinates = new Coordinate[] { coordinates[0], coordinates[0].copy() };
        }
        return GeometryUtils.geometryFactory.createLineString(coordinates);
    }

}
