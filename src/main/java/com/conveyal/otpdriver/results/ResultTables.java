package com.conveyal.otpdriver.results;

import com.conveyal.otpdriver.api.GeoJsonFeature;
import com.conveyal.otpdriver.api.GeoJsonFeatureCollection;
import com.conveyal.otpdriver.api.Itinerary;
import com.conveyal.otpdriver.api.Leg;
import com.conveyal.otpdriver.api.PlanResponse;
import com.conveyal.otpdriver.client.OtpDateTime;
import com.conveyal.otpdriver.util.GeometryUtils;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Flattens the nested responses of OTP into lists of rows.
 */
public abstract class ResultTables {

    private static final Logger LOG = LoggerFactory.getLogger(ResultTables.class);

    /**
     * One row per leg of every itinerary in the response, in the order OTP returned them. Itineraries and legs are
     * numbered from 1.
     */
    public static List<LegRow> legRows (String fromId, String toId, PlanResponse response, ZoneId zoneId) {
        List<LegRow> rows = new ArrayList<>();
        if (!response.hasItineraries()) return rows;
        int itineraryIndex = 0;
        for (Itinerary itinerary : response.plan.itineraries) {
            itineraryIndex++;
            if (itinerary == null || itinerary.legs == null) {
                LOG.debug("Itinerary {} from {} to {} has no legs.", itineraryIndex, fromId, toId);
                continue;
            }
            int legIndex = 0;
            for (Leg leg : itinerary.legs) {
                legIndex++;
                if (leg == null) continue;
                LegRow row = new LegRow();
                row.fromId = fromId;
                row.toId = toId;
                row.itinerary = itineraryIndex;
                row.duration = itinerary.duration;
                row.startTime = OtpDateTime.fromEpochMillis(itinerary.startTime, zoneId);
                row.endTime = OtpDateTime.fromEpochMillis(itinerary.endTime, zoneId);
                row.walkTime = itinerary.walkTime;
                row.transitTime = itinerary.transitTime;
                row.waitingTime = itinerary.waitingTime;
                row.walkDistance = itinerary.walkDistance;
                row.transfers = itinerary.transfers;
                row.leg = legIndex;
                row.mode = leg.mode;
                row.route = leg.routeLabel();
                row.agencyName = leg.agencyName;
                row.distance = leg.distance;
                row.legDuration = leg.duration;
                row.legStartTime = OtpDateTime.fromEpochMillis(leg.startTime, zoneId);
                row.legEndTime = OtpDateTime.fromEpochMillis(leg.endTime, zoneId);
                if (leg.from != null) {
                    row.fromPlace = leg.from.name;
                    row.fromStopId = leg.from.stopId;
                }
                if (leg.to != null) {
                    row.toPlace = leg.to.name;
                    row.toStopId = leg.to.stopId;
                }
                if (leg.legGeometry != null) {
                    row.geometry = leg.legGeometry.points;
                } else {
                    LOG.debug("Leg {} of itinerary {} from {} to {} has no geometry.", legIndex, itineraryIndex,
                            fromId, toId);
                }
                rows.add(row);
            }
        }
        return rows;
    }

    /** One band per feature of an isochrone FeatureCollection, using its "time" property as the cutoff. */
    public static List<IsochroneBand> isochroneBands (String fromId, GeoJsonFeatureCollection collection) {
        List<IsochroneBand> bands = new ArrayList<>();
        if (collection == null || collection.features == null) return bands;
        for (GeoJsonFeature feature : collection.features) {
            Object time = feature == null || feature.properties == null ? null : feature.properties.get("time");
            if (!(time instanceof Number)) {
                LOG.warn("Skipping isochrone feature without a numeric time property from origin {}.", fromId);
                continue;
            }
            Geometry geometry = feature.geometry == null
                    ? GeometryUtils.geometryFactory.createMultiPolygon()
                    : feature.geometry;
            bands.add(new IsochroneBand(fromId, ((Number) time).intValue(), geometry));
        }
        return bands;
    }

}
