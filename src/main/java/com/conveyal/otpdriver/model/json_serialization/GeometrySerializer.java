package com.conveyal.otpdriver.model.json_serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.geojson.GeoJsonWriter;

import java.io.IOException;

/**
 * Writes a JTS Geometry as a GeoJSON geometry object. Coordinates are WGS84 so no CRS member is written.
 */
public class GeometrySerializer extends JsonSerializer<Geometry> {

    @Override
    public void serialize (Geometry geometry, JsonGenerator jsonGenerator, SerializerProvider serializerProvider)
            throws IOException {
        GeoJsonWriter writer = new GeoJsonWriter();
        writer.setEncodeCRS(false);
        jsonGenerator.writeRawValue(writer.write(geometry));
    }

}
