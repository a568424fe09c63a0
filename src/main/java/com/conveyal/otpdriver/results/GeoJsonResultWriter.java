package com.conveyal.otpdriver.results;

import com.conveyal.otpdriver.api.GeoJsonFeature;
import com.conveyal.otpdriver.api.GeoJsonFeatureCollection;
import com.conveyal.otpdriver.util.JsonUtilities;

import java.io.IOException;
import java.io.Writer;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Writes result rows as a GeoJSON FeatureCollection, one feature per row with the other columns as properties.
 * Rows without a geometry are written with a null geometry, as GeoJSON allows.
 */
public class GeoJsonResultWriter {

    public void writeLegRows (List<LegRow> rows, Writer out) throws IOException {
        GeoJsonFeatureCollection collection = new GeoJsonFeatureCollection();
        for (LegRow row : rows) {
            GeoJsonFeature feature = new GeoJsonFeature(row.geometry);
            feature.addProperty("fromId", row.fromId);
            feature.addProperty("toId", row.toId);
            feature.addProperty("itinerary", row.itinerary);
            feature.addProperty("duration", row.duration);
            feature.addProperty("startTime", time(row.startTime));
            feature.addProperty("endTime", time(row.endTime));
            feature.addProperty("walkTime", row.walkTime);
            feature.addProperty("transitTime", row.transitTime);
            feature.addProperty("waitingTime", row.waitingTime);
            feature.addProperty("walkDistance", row.walkDistance);
            feature.addProperty("transfers", row.transfers);
            feature.addProperty("leg", row.leg);
            feature.addProperty("mode", row.mode);
            feature.addProperty("route", row.route);
            feature.addProperty("agencyName", row.agencyName);
            feature.addProperty("distance", row.distance);
            feature.addProperty("legDuration", row.legDuration);
            feature.addProperty("legStartTime", time(row.legStartTime));
            feature.addProperty("legEndTime", time(row.legEndTime));
            feature.addProperty("fromPlace", row.fromPlace);
            feature.addProperty("fromStopId", row.fromStopId);
            feature.addProperty("toPlace", row.toPlace);
            feature.addProperty("toStopId", row.toStopId);
            collection.features.add(feature);
        }
        JsonUtilities.lenientObjectMapper.writeValue(out, collection);
    }

    public void writeIsochroneBands (List<IsochroneBand> bands, Writer out) throws IOException {
        GeoJsonFeatureCollection collection = new GeoJsonFeatureCollection();
        for (IsochroneBand band : bands) {
            GeoJsonFeature feature = new GeoJsonFeature(band.geometry);
            feature.addProperty("fromId", band.fromId);
            feature.addProperty("time", band.time);
            collection.features.add(feature);
        }
        JsonUtilities.lenientObjectMapper.writeValue(out, collection);
    }

    private static String time (ZonedDateTime dateTime) {
        return dateTime == null ? null : dateTime.toOffsetDateTime().toString();
    }

}
