package com.conveyal.otpdriver.model.json_serialization;

import com.conveyal.otpdriver.util.GeometryUtils;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;

import java.io.IOException;

/**
 * Reads a GeoJSON geometry object, such as an isochrone MultiPolygon, into a JTS Geometry.
 */
public class GeometryDeserializer extends JsonDeserializer<Geometry> {

    @Override
    public Geometry deserialize (JsonParser jsonParser, DeserializationContext deserializationContext)
            throws IOException {
        JsonNode node = jsonParser.readValueAsTree();
        try {
            return new GeoJsonReader(GeometryUtils.geometryFactory).read(node.toString());
        } catch (ParseException e) {
            throw deserializationContext.instantiationException(Geometry.class, e);
        }
    }

}
