package com.conveyal.otpdriver.client;

import com.conveyal.otpdriver.OtpDriverException;
import org.apache.http.NameValuePair;
import org.apache.http.client.utils.URLEncodedUtils;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Checks the query strings sent to the planner, isochrone and geocoder endpoints. */
public class RequestUriTest {

    private static final OtpConnection CONNECTION = OtpConnection.localhost(8080, "london");

    private static final ZonedDateTime MONDAY_MORNING =
            ZonedDateTime.of(2026, 10, 19, 8, 30, 0, 0, ZoneId.of("Europe/London"));

    private static List<String> values (URI uri, String name) {
        return URLEncodedUtils.parse(uri, StandardCharsets.UTF_8).stream()
                .filter(pair -> pair.getName().equals(name))
                .map(NameValuePair::getValue)
                .collect(Collectors.toList());
    }

    private static String value (URI uri, String name) {
        List<String> values = values(uri, name);
        assertEquals(1, values.size(), name);
        return values.get(0);
    }

    @Test
    public void testPlanUri () {
        PlanRequest request = new PlanRequest("a", new LatLon(51.5074, -0.1278), "b", new LatLon(51.53, -0.1238));
        request.modes = EnumSet.of(TransportMode.TRANSIT);
        request.arriveBy = true;
        URI uri = request.toUri(CONNECTION, MONDAY_MORNING);
        assertEquals("/otp/routers/london/plan", uri.getPath());
        assertEquals("51.507400,-0.127800", value(uri, "fromPlace"));
        assertEquals("51.530000,-0.123800", value(uri, "toPlace"));
        assertEquals("WALK,TRANSIT", value(uri, "mode"));
        assertEquals("10-19-2026", value(uri, "date"));
        assertEquals("08:30am", value(uri, "time"));
        assertEquals("true", value(uri, "arriveBy"));
        assertEquals("1000.0", value(uri, "maxWalkDistance"));
        assertEquals("3", value(uri, "numItineraries"));
        assertTrue(values(uri, "walkReluctance").isEmpty());
    }

    @Test
    public void testPlanUriWithExplicitTimeAndOptions () {
        PlanRequest request = new PlanRequest("a", new LatLon(51.5074, -0.1278), "b", new LatLon(51.53, -0.1238));
        request.dateTime = MONDAY_MORNING.withHour(13).withMinute(5);
        request.routingOptions = new RoutingOptions();
        request.routingOptions.walkReluctance = 5.0;
        URI uri = request.toUri(CONNECTION, MONDAY_MORNING);
        assertEquals("01:05pm", value(uri, "time"));
        assertEquals("CAR", value(uri, "mode"));
        assertEquals("5.0", value(uri, "walkReluctance"));
    }

    @Test
    public void testInvalidPlanRequests () {
        PlanRequest noDestination = new PlanRequest("a", new LatLon(51.5, -0.12), "b", null);
        assertThrows(OtpDriverException.class, () -> noDestination.toUri(CONNECTION, MONDAY_MORNING));
        PlanRequest noItineraries = new PlanRequest("a", new LatLon(51.5, -0.12), "b", new LatLon(51.6, -0.1));
        noItineraries.numItineraries = 0;
        assertThrows(OtpDriverException.class, noItineraries::validate);
        assertThrows(IllegalArgumentException.class, () -> new LatLon(91, 0));
        assertThrows(IllegalArgumentException.class, () -> LatLon.parse("51.5"));
    }

    @Test
    public void testIsochroneUriRepeatsCutoffs () {
        IsochroneRequest request = new IsochroneRequest("origin", new LatLon(51.5, -0.12));
        URI uri = request.toUri(CONNECTION, MONDAY_MORNING);
        assertEquals("/otp/routers/london/isochrone", uri.getPath());
        assertEquals(Arrays.asList("600", "1200", "1800", "2400", "3000", "3600"), values(uri, "cutoffSec"));
        assertEquals("WALK,TRANSIT", value(uri, "mode"));

        request.cutoffSeconds = Arrays.asList(900, -1);
        assertThrows(OtpDriverException.class, () -> request.toUri(CONNECTION, MONDAY_MORNING));
    }

    @Test
    public void testGeocodeUri () {
        GeocodeRequest request = new GeocodeRequest(" King's Cross ");
        request.autocomplete = true;
        URI uri = request.toUri(CONNECTION);
        assertEquals("/otp/routers/london/geocode", uri.getPath());
        assertEquals("King's Cross", value(uri, "query"));
        assertEquals("true", value(uri, "autocomplete"));
        assertEquals("true", value(uri, "stops"));
        assertEquals("false", value(uri, "clusters"));
        assertEquals("true", value(uri, "corners"));

        request.stops = false;
        request.corners = false;
        assertThrows(OtpDriverException.class, () -> request.toUri(CONNECTION));
        assertThrows(OtpDriverException.class, () -> new GeocodeRequest("  ").toUri(CONNECTION));
    }

}
