package com.conveyal.otpdriver.results;

import com.conveyal.otpdriver.api.GeoJsonFeature;
import com.conveyal.otpdriver.api.GeoJsonFeatureCollection;
import com.conveyal.otpdriver.api.Itinerary;
import com.conveyal.otpdriver.api.Leg;
import com.conveyal.otpdriver.api.PlanResponse;
import com.conveyal.otpdriver.api.TripPlan;
import com.conveyal.otpdriver.util.GeometryUtils;
import com.conveyal.otpdriver.util.JsonUtilities;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ResultTablesTest {

    private static final ZoneId LONDON = ZoneId.of("Europe/London");

    private static Leg leg (String mode) {
        Leg leg = new Leg();
        leg.mode = mode;
        leg.startTime = 1792395000000L;
        leg.endTime = 1792395300000L;
        return leg;
    }

    @Test
    public void testLegsOfEveryItineraryAreNumbered () {
        Itinerary first = new Itinerary();
        first.duration = 900;
        first.startTime = 1792395000000L;
        first.legs.add(leg("WALK"));
        first.legs.add(leg("RAIL"));
        Itinerary second = new Itinerary();
        second.duration = 1200;
        second.legs.add(leg("BICYCLE"));
        PlanResponse response = new PlanResponse();
        response.plan = new TripPlan();
        response.plan.itineraries.add(first);
        response.plan.itineraries.add(second);

        List<LegRow> rows = ResultTables.legRows("o", "d", response, LONDON);
        assertEquals(3, rows.size());
        assertEquals(1, rows.get(1).itinerary);
        assertEquals(2, rows.get(1).leg);
        assertEquals("RAIL", rows.get(1).mode);
        assertEquals(2, rows.get(2).itinerary);
        assertEquals(1, rows.get(2).leg);
        assertEquals(1200, rows.get(2).duration);
        // 07:30 UTC is 08:30 in London summer time.
        assertEquals(8, rows.get(0).startTime.getHour());
        assertEquals(LONDON, rows.get(0).startTime.getZone());
        assertNull(rows.get(2).startTime);
        assertNull(rows.get(0).geometry);
    }

    @Test
    public void testNoItinerariesGivesNoRows () {
        assertTrue(ResultTables.legRows("o", "d", new PlanResponse(), LONDON).isEmpty());
    }

    @Test
    public void testNullLegsAreSkipped () throws JsonProcessingException {
        PlanResponse response = JsonUtilities.lenientObjectMapper.readValue(
                "{\"plan\": {\"itineraries\": [{\"duration\": 60, \"legs\": null}, null,"
                        + " {\"duration\": 90, \"legs\": [null, {\"mode\": \"WALK\"}]}]}}",
                PlanResponse.class);
        List<LegRow> rows = ResultTables.legRows("o", "d", response, LONDON);
        assertEquals(1, rows.size());
        assertEquals(3, rows.get(0).itinerary);
        assertEquals(2, rows.get(0).leg);
        assertEquals("WALK", rows.get(0).mode);
    }

    @Test
    public void testFeatureWithNullPropertiesIsSkipped () throws JsonProcessingException {
        GeoJsonFeatureCollection collection = JsonUtilities.lenientObjectMapper.readValue(
                "{\"type\": \"FeatureCollection\", \"features\": ["
                        + "{\"type\": \"Feature\", \"geometry\": null, \"properties\": null},"
                        + "{\"type\": \"Feature\", \"geometry\": null, \"properties\": {\"time\": 900}}]}",
                GeoJsonFeatureCollection.class);
        List<IsochroneBand> bands = ResultTables.isochroneBands("origin", collection);
        assertEquals(1, bands.size());
        assertEquals(900, bands.get(0).time);
    }

    @Test
    public void testIsochroneBands () {
        GeoJsonFeatureCollection collection = new GeoJsonFeatureCollection();
        GeoJsonFeature tenMinutes = new GeoJsonFeature(GeometryUtils.geometryFactory.createPoint(new Coordinate(0, 0)));
        tenMinutes.addProperty("time", 600);
        GeoJsonFeature untimed = new GeoJsonFeature(null);
        GeoJsonFeature twentyMinutes = new GeoJsonFeature(null);
        twentyMinutes.addProperty("time", 1200.0);
        collection.features.add(tenMinutes);
        collection.features.add(untimed);
        collection.features.add(twentyMinutes);

        List<IsochroneBand> bands = ResultTables.isochroneBands("origin", collection);
        assertEquals(2, bands.size());
        assertEquals(600, bands.get(0).time);
        assertEquals(1200, bands.get(1).time);
        assertTrue(bands.get(1).geometry.isEmpty());
        assertEquals("origin", bands.get(1).fromId);
    }

}
