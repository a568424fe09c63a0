package com.conveyal.otpdriver.client;

import com.conveyal.otpdriver.OtpDriverConfig;
import com.conveyal.otpdriver.OtpDriverException;
import com.conveyal.otpdriver.api.GeocodeResult;
import com.conveyal.otpdriver.api.RouterList;
import com.conveyal.otpdriver.results.IsochroneBand;
import com.conveyal.otpdriver.results.LegRow;
import com.conveyal.otpdriver.results.PlanResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class OtpClientTest {

    private StubOtpServer otp;
    private OtpHttpClient httpClient;
    private OtpClient client;

    @BeforeEach
    public void startStub () throws IOException {
        otp = new StubOtpServer().withDefaultRouter();
        Properties properties = new Properties();
        properties.setProperty("port", Integer.toString(otp.port()));
        properties.setProperty("timezone", "UTC");
        properties.setProperty("http-timeout-seconds", "5");
        properties.setProperty("plan-threads", "2");
        OtpDriverConfig config = OtpDriverConfig.fromProperties(properties);
        httpClient = new OtpHttpClient(config);
        client = new OtpClient(config, OtpConnection.fromConfig(config), httpClient);
    }

    @AfterEach
    public void stopStub () throws IOException {
        httpClient.close();
        otp.close();
    }

    private static PlanRequest request (String fromId) {
        return new PlanRequest(fromId, new LatLon(38.5, -120.2), "dest", new LatLon(43.252, -126.453));
    }

    @Test
    public void testPlan () {
        otp.answerWithResource("/otp/routers/default/plan", "plan.json");
        PlanResult result = client.plan(request("origin"));
        assertTrue(result.isSuccess());
        assertNull(result.error);
        assertEquals(2, result.rows.size());

        LegRow walk = result.rows.get(0);
        assertEquals("origin", walk.fromId);
        assertEquals("dest", walk.toId);
        assertEquals(1, walk.itinerary);
        assertEquals(1, walk.leg);
        assertEquals("WALK", walk.mode);
        assertEquals(1500, walk.duration);
        assertEquals(ZonedDateTime.of(2026, 10, 19, 7, 30, 0, 0, ZoneOffset.UTC).toInstant(),
                walk.startTime.toInstant());
        assertEquals("High Street", walk.toPlace);
        assertEquals("1:1001", walk.toStopId);
        // A single encoded point becomes a degenerate two point line.
        assertEquals(2, walk.geometry.getNumPoints());

        LegRow bus = result.rows.get(1);
        assertEquals(2, bus.leg);
        assertEquals("BUS", bus.mode);
        assertEquals("X1", bus.route);
        assertEquals("Example Transit", bus.agencyName);
        assertEquals(3, bus.geometry.getNumPoints());
        assertEquals(-126.453, bus.geometry.getCoordinateN(2).x, 1e-9);
        assertEquals(43.252, bus.geometry.getCoordinateN(2).y, 1e-9);
    }

    @Test
    public void testNoPathIsAFailedResult () {
        otp.answerWithResource("/otp/routers/default/plan", "plan-no-path.json");
        PlanResult result = client.plan(request("origin"));
        assertFalse(result.isSuccess());
        assertTrue(result.error.startsWith("No trip found"), result.error);
        assertTrue(result.rows.isEmpty());
    }

    @Test
    public void testHttpErrorIsThrown () {
        otp.answer("/otp/routers/default/plan", 500, "{\"message\":\"boom\"}");
        OtpDriverException e = assertThrows(OtpDriverException.class, () -> client.plan(request("origin")));
        assertEquals(OtpDriverException.Type.HTTP, e.type);
        assertEquals(500, e.httpCode);
    }

    @Test
    public void testMalformedJsonIsThrown () {
        otp.answer("/otp/routers/default/plan", 200, "{\"plan\": [");
        OtpDriverException e = assertThrows(OtpDriverException.class, () -> client.plan(request("origin")));
        assertEquals(OtpDriverException.Type.JSON_PARSING, e.type);
    }

    @Test
    public void testPlanManyKeepsOrderAndFailures () {
        otp.answerWithResource("/otp/routers/default/plan", "plan.json");
        PlanRequest invalid = request("broken");
        invalid.numItineraries = 0;
        List<PlanResult> results = client.planMany(Arrays.asList(request("first"), invalid, request("third")));
        assertEquals(3, results.size());
        assertEquals("first", results.get(0).request.fromId);
        assertTrue(results.get(0).isSuccess());
        assertFalse(results.get(1).isSuccess());
        assertEquals("third", results.get(2).rows.get(0).fromId);
        // The invalid request is refused before anything is sent.
        assertEquals(2, otp.requests.stream().filter(uri -> uri.getPath().endsWith("/plan")).count());
    }

    @Test
    public void testPlanManyKeepsGoingAfterUnexpectedError () {
        otp.answerWithResource("/otp/routers/default/plan", "plan.json");
        PlanRequest broken = request("broken");
        broken.modes = new HashSet<>(Collections.singleton(null));
        List<PlanResult> results = client.planMany(Arrays.asList(broken, request("second")));
        assertEquals(2, results.size());
        assertFalse(results.get(0).isSuccess());
        assertTrue(results.get(0).error.startsWith("NullPointerException"), results.get(0).error);
        assertTrue(results.get(1).isSuccess());
    }

    @Test
    public void testIsochroneMany () {
        otp.answerWithResource("/otp/routers/default/isochrone", "isochrone.json");
        List<IsochroneBand> bands = client.isochroneMany(Arrays.asList(
                new IsochroneRequest("a", new LatLon(51.5, -0.12)),
                new IsochroneRequest("b", new LatLon(51.51, -0.13))));
        assertEquals(4, bands.size());
        assertEquals("a", bands.get(0).fromId);
        assertEquals(600, bands.get(0).time);
        assertEquals(1200, bands.get(1).time);
        assertEquals("MultiPolygon", bands.get(1).geometry.getGeometryType());
        assertEquals("b", bands.get(3).fromId);
    }

    @Test
    public void testGeocode () {
        otp.answerWithResource("/otp/routers/default/geocode", "geocode.json");
        List<GeocodeResult> results = client.geocode(new GeocodeRequest("cross"));
        assertEquals(2, results.size());
        assertEquals("1:KGX", results.get(0).id);
        assertEquals(-0.1238, results.get(0).lng, 1e-9);
    }

    @Test
    public void testRouters () {
        otp.answerWithResource("/otp/routers", "routers.json");
        List<RouterList.RouterInfo> routers = client.routers();
        assertEquals(1, routers.size());
        assertEquals("default", routers.get(0).routerId);
        assertEquals(Arrays.asList("BUS", "RAIL"), routers.get(0).transitModes);
    }

}
