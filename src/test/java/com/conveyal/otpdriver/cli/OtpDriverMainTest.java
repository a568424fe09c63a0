package com.conveyal.otpdriver.cli;

import com.conveyal.otpdriver.api.GeoJsonFeatureCollection;
import com.conveyal.otpdriver.client.StubOtpServer;
import com.conveyal.otpdriver.setup.FakeCommandRunner;
import com.conveyal.otpdriver.setup.OperatingSystem;
import com.conveyal.otpdriver.setup.OtpStopper;
import com.conveyal.otpdriver.util.JsonUtilities;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.conveyal.otpdriver.cli.OtpDriverMain.EXIT_FAILURE;
import static com.conveyal.otpdriver.cli.OtpDriverMain.EXIT_SUCCESS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class OtpDriverMainTest {

    @TempDir
    File tempDir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();

    private final FakeCommandRunner runner = new FakeCommandRunner(command -> FakeCommandRunner.output(0,
            "  PID TTY          TIME CMD",
            " 4242 pts/0    00:03:10 java"));

    private OtpDriverMain main (String stdin) {
        return main(stdin, OperatingSystem.LINUX);
    }

    private OtpDriverMain main (String stdin, OperatingSystem operatingSystem) {
        return new OtpDriverMain(new PrintStream(stdout, true), new ByteArrayInputStream(
                stdin.getBytes(StandardCharsets.UTF_8)), runner, operatingSystem);
    }

    private String stdout () {
        return new String(stdout.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    public void testHelpAndBadCommandLines () {
        assertEquals(EXIT_SUCCESS, main("").run("plan", "--help"));
        assertTrue(stdout().contains("usage: otp-driver"), stdout());
        assertEquals(EXIT_FAILURE, main("").run());
        assertEquals(EXIT_FAILURE, main("").run("fly", "--port", "8080"));
        assertEquals(EXIT_FAILURE, main("").run("plan", "--frobnicate"));
        assertEquals(EXIT_FAILURE, main("").run("plan", "stray-argument"));
        assertEquals(EXIT_FAILURE, main("").run("plan", "--port", "not-a-port", "--from", "1,1", "--to", "2,2"));
    }

    @Test
    public void testStopAsksBeforeKilling () {
        assertEquals(EXIT_SUCCESS, main("n\n").run("stop"));
        assertTrue(runner.commands.isEmpty());
        assertEquals(EXIT_SUCCESS, main("y\n").run("stop"));
        assertEquals(Arrays.asList(OtpStopper.LIST_PROCESSES, OtpStopper.KILL_ALL_UNIX), runner.commands);
    }

    @Test
    public void testStopListOnly () {
        assertEquals(EXIT_SUCCESS, main("").run("stop", "--listOnly"));
        assertEquals(Collections.singletonList(OtpStopper.LIST_PROCESSES), runner.commands);
    }

    @Test
    public void testStopListOnlyOnWindows () {
        assertEquals(EXIT_SUCCESS, main("", OperatingSystem.WINDOWS).run("stop", "--listOnly"));
        assertEquals(Collections.singletonList(OtpStopper.LIST_PROCESSES_WINDOWS), runner.commands);
    }

    @Test
    public void testStopOnWindowsAsksBeforeKilling () {
        assertEquals(EXIT_SUCCESS, main("n\n", OperatingSystem.WINDOWS).run("stop"));
        assertTrue(runner.commands.isEmpty());
        assertEquals(EXIT_SUCCESS, main("yes\n", OperatingSystem.WINDOWS).run("stop"));
        assertEquals(Arrays.asList(OtpStopper.LIST_PROCESSES_WINDOWS, OtpStopper.KILL_ALL_WINDOWS),
                runner.commands);
    }

    @Test
    public void testBuildFailsChecksWithoutJar () {
        assertEquals(EXIT_FAILURE, main("").run("build", "--jar", new File(tempDir, "otp.jar").getPath(),
                "--dir", tempDir.getPath()));
        assertTrue(runner.commands.isEmpty());
    }

    @Test
    public void testPlanToCsvFile () throws IOException {
        try (StubOtpServer otp = new StubOtpServer().withDefaultRouter()) {
            otp.answerWithResource("/otp/routers/default/plan", "plan.json");
            File output = new File(tempDir, "trips.csv");
            int status = main("").run("plan", "--port", Integer.toString(otp.port()), "--from", "38.5,-120.2",
                    "--to", "43.252,-126.453", "--mode", "transit", "--dateTime", "2026-10-19T08:30",
                    "-O", "walkReluctance=3", "-o", output.getPath());
            assertEquals(EXIT_SUCCESS, status);
            List<String> lines = Files.readAllLines(output.toPath(), StandardCharsets.UTF_8);
            assertEquals(3, lines.size());
            assertTrue(lines.get(0).startsWith("fromId,toId,itinerary"), lines.get(0));
            String query = otp.requests.get(otp.requests.size() - 1).getQuery();
            assertTrue(query.contains("mode=WALK,TRANSIT"), query);
            assertTrue(query.contains("date=10-19-2026"), query);
            assertTrue(query.contains("time=08:30am"), query);
            assertTrue(query.contains("walkReluctance=3.0"), query);
        }
    }

    @Test
    public void testPlanPairsWhereEveryTripFails () throws IOException {
        File pairs = new File(tempDir, "pairs.csv");
        Files.write(pairs.toPath(), Arrays.asList(
                "fromId,fromLat,fromLon,toId,toLat,toLon",
                "a,38.5,-120.2,b,43.252,-126.453",
                "c,38.6,-120.3,d,43.1,-126.4"), StandardCharsets.UTF_8);
        try (StubOtpServer otp = new StubOtpServer().withDefaultRouter()) {
            otp.answerWithResource("/otp/routers/default/plan", "plan-no-path.json");
            File output = new File(tempDir, "trips.csv");
            int status = main("").run("plan", "--port", Integer.toString(otp.port()), "--pairs", pairs.getPath(),
                    "-o", output.getPath());
            assertEquals(EXIT_FAILURE, status);
            assertEquals(1, Files.readAllLines(output.toPath(), StandardCharsets.UTF_8).size());
            List<String> errors = Files.readAllLines(new File(tempDir, "trips-errors.csv").toPath(),
                    StandardCharsets.UTF_8);
            assertEquals(3, errors.size());
            assertTrue(errors.get(1).startsWith("a,b,"), errors.get(1));
        }
    }

    @Test
    public void testPlanNeedsRunningRouter () throws IOException {
        try (StubOtpServer otp = new StubOtpServer()) {
            assertEquals(EXIT_FAILURE, main("").run("plan", "--port", Integer.toString(otp.port()),
                    "--from", "38.5,-120.2", "--to", "43.252,-126.453"));
            assertTrue(otp.requests.stream().noneMatch(uri -> uri.getPath().endsWith("/plan")));
        }
    }

    @Test
    public void testIsochroneToGeoJson () throws IOException {
        try (StubOtpServer otp = new StubOtpServer().withDefaultRouter()) {
            otp.answerWithResource("/otp/routers/default/isochrone", "isochrone.json");
            File output = new File(tempDir, "isochrones.geojson");
            int status = main("").run("isochrone", "--port", Integer.toString(otp.port()),
                    "--from", "51.5,-0.12", "--cutoffs", "600, 1200", "-o", output.getPath());
            assertEquals(EXIT_SUCCESS, status);
            String query = otp.requests.get(otp.requests.size() - 1).getQuery();
            assertTrue(query.contains("cutoffSec=600&cutoffSec=1200"), query);
            GeoJsonFeatureCollection collection =
                    JsonUtilities.lenientObjectMapper.readValue(output, GeoJsonFeatureCollection.class);
            assertEquals(2, collection.features.size());
            assertEquals("from", collection.features.get(0).properties.get("fromId"));
        }
    }

    @Test
    public void testGeocodeToStdout () throws IOException {
        try (StubOtpServer otp = new StubOtpServer().withDefaultRouter()) {
            otp.answerWithResource("/otp/routers/default/geocode", "geocode.json");
            int status = main("").run("geocode", "--port", Integer.toString(otp.port()), "--query", "cross",
                    "--types", "stops,clusters");
            assertEquals(EXIT_SUCCESS, status);
            assertTrue(stdout().startsWith("id,description,lat,lon"), stdout());
            assertTrue(stdout().contains("1:KGX,stop King's Cross,51.5308,-0.1238"), stdout());
            String query = otp.requests.get(otp.requests.size() - 1).getQuery();
            assertTrue(query.contains("clusters=true"), query);
            assertTrue(query.contains("corners=false"), query);
        }
    }

    @Test
    public void testCheckListsRouters () throws IOException {
        try (StubOtpServer otp = new StubOtpServer().withDefaultRouter()) {
            otp.answerWithResource("/otp/routers", "routers.json");
            assertEquals(EXIT_SUCCESS, main("").run("check", "--port", Integer.toString(otp.port())));
            assertEquals("default", stdout().trim());
        }
    }

}
