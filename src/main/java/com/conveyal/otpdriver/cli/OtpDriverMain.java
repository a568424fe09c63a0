package com.conveyal.otpdriver.cli;

import com.conveyal.otpdriver.OtpDriverConfig;
import com.conveyal.otpdriver.OtpDriverException;
import com.conveyal.otpdriver.api.GeocodeResult;
import com.conveyal.otpdriver.api.RouterList;
import com.conveyal.otpdriver.client.GeocodeRequest;
import com.conveyal.otpdriver.client.IsochroneRequest;
import com.conveyal.otpdriver.client.LatLon;
import com.conveyal.otpdriver.client.OtpClient;
import com.conveyal.otpdriver.client.OtpConnection;
import com.conveyal.otpdriver.client.OtpHttpClient;
import com.conveyal.otpdriver.client.PlanRequest;
import com.conveyal.otpdriver.client.RoutingOptions;
import com.conveyal.otpdriver.results.CsvResultWriter;
import com.conveyal.otpdriver.results.GeoJsonResultWriter;
import com.conveyal.otpdriver.results.IsochroneBand;
import com.conveyal.otpdriver.results.LegRow;
import com.conveyal.otpdriver.results.PlanResult;
import com.conveyal.otpdriver.setup.BrowserLauncher;
import com.conveyal.otpdriver.setup.CommandRunner;
import com.conveyal.otpdriver.setup.GraphBuildResult;
import com.conveyal.otpdriver.setup.GraphBuilder;
import com.conveyal.otpdriver.setup.LocalCommandRunner;
import com.conveyal.otpdriver.setup.OperatingSystem;
import com.conveyal.otpdriver.setup.OtpLauncher;
import com.conveyal.otpdriver.setup.OtpServer;
import com.conveyal.otpdriver.setup.OtpStopper;
import com.conveyal.otpdriver.setup.SetupChecks;
import com.conveyal.otpdriver.setup.Sleeper;
import com.conveyal.otpdriver.util.ExceptionUtils;
import com.csvreader.CsvWriter;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Main entry point of the otp-driver command line tool.
 * The first argument is the command, the remaining ones are options of that command. Exits with status 0 on success
 * and 1 on any failure, which is logged.
 */
public class OtpDriverMain {

    private static final Logger LOG = LoggerFactory.getLogger(OtpDriverMain.class);

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_FAILURE = 1;

    private final PrintStream out;
    private final InputStream in;
    private final CommandRunner commandRunner;
    private final OperatingSystem operatingSystem;

    public OtpDriverMain (PrintStream out, InputStream in, CommandRunner commandRunner,
                          OperatingSystem operatingSystem) {
        this.out = out;
        this.in = in;
        this.commandRunner = commandRunner;
        this.operatingSystem = operatingSystem;
    }

    public static void main (String... args) {
        OtpDriverMain main = new OtpDriverMain(System.out, System.in, new LocalCommandRunner(),
                OperatingSystem.current());
        System.exit(main.run(args));
    }

    /** Run one command, returning the process exit status rather than exiting so this can be called from tests. */
    public int run (String... args) {
        if (args.length == 0) {
            CommandLineOpts.printHelp(new PrintWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8)));
            return EXIT_FAILURE;
        }
        // Pull argument 0 off as the sub-command, then pass the remaining args on to that subcommand.
        String command = args[0];
        String[] commandArguments = Arrays.copyOfRange(args, 1, args.length);
        try {
            CommandLineOpts opts = new CommandLineOpts(commandArguments);
            if (opts.help()) {
                CommandLineOpts.printHelp(new PrintWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8)));
                return EXIT_SUCCESS;
            }
            if ("stop".equals(command)) {
                // Stopping needs no configuration, so a broken configuration file does not prevent it.
                return stop(opts);
            }
            OtpDriverConfig config = OtpDriverConfig.load(opts.configFile(), opts.configOverrides());
            switch (command) {
                case "build":
                    return build(config);
                case "setup":
                    return setup(config);
                case "check":
                    return check(config);
                case "plan":
                    return plan(config, opts);
                case "isochrone":
                    return isochrone(config, opts);
                case "geocode":
                    return geocode(config, opts);
                default:
                    LOG.error("Unknown command {}", command);
                    CommandLineOpts.printHelp(new PrintWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8)));
                    return EXIT_FAILURE;
            }
        } catch (ParseException e) {
            LOG.error("Invalid command line: {}", e.getMessage());
            return EXIT_FAILURE;
        } catch (OtpDriverException e) {
            LOG.error("{} error: {}", e.type, e.getMessage());
            if (e.getCause() != null) {
                LOG.debug(ExceptionUtils.stackTraceString(e));
            }
            return EXIT_FAILURE;
        } catch (Throwable throwable) {
            LOG.error("An error occurred: {}", ExceptionUtils.stackTraceString(throwable));
            return EXIT_FAILURE;
        }
    }

    private int build (OtpDriverConfig config) {
        GraphBuilder graphBuilder = new GraphBuilder(config, new SetupChecks(config, commandRunner), commandRunner);
        GraphBuildResult result = graphBuilder.buildGraph();
        return result.success ? EXIT_SUCCESS : EXIT_FAILURE;
    }

    private int setup (OtpDriverConfig config) throws IOException {
        try (OtpHttpClient httpClient = new OtpHttpClient(config)) {
            OtpLauncher launcher = new OtpLauncher(config, new SetupChecks(config, commandRunner), commandRunner,
                    httpClient, Sleeper.THREAD_SLEEP, new BrowserLauncher.DesktopBrowserLauncher(), operatingSystem);
            OtpServer server = launcher.setup();
            // The OTP process outlives this command, it is stopped with the stop command.
            if (!server.ready) {
                LOG.info("OTP keeps loading in the background, check {} later with the check command.",
                        server.connection);
            }
            return EXIT_SUCCESS;
        }
    }

    private int stop (CommandLineOpts opts) throws IOException {
        boolean killAll = !opts.flag(CommandLineOpts.LIST_ONLY_OPT);
        if (killAll && !opts.flag(CommandLineOpts.YES_OPT) && !confirmKillAll()) {
            LOG.info("Not stopping anything.");
            return EXIT_SUCCESS;
        }
        new OtpStopper(commandRunner, operatingSystem).stop(killAll);
        return EXIT_SUCCESS;
    }

    private boolean confirmKillAll () throws IOException {
        out.println("This will kill all running Java instances, not only OTP. Continue? [y/N]");
        out.flush();
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String answer = reader.readLine();
        return answer != null && (answer.trim().equalsIgnoreCase("y") || answer.trim().equalsIgnoreCase("yes"));
    }

    private int check (OtpDriverConfig config) throws IOException {
        try (OtpHttpClient httpClient = new OtpHttpClient(config)) {
            OtpClient client = new OtpClient(config, OtpConnection.fromConfig(config).check(httpClient), httpClient);
            for (RouterList.RouterInfo routerInfo : client.routers()) {
                out.println(routerInfo.routerId);
            }
            out.flush();
            return EXIT_SUCCESS;
        }
    }

    private int plan (OtpDriverConfig config, CommandLineOpts opts) throws IOException {
        List<PlanRequest> requests = planRequests(opts);
        RoutingOptions routingOptions = opts.routingOptions();
        for (PlanRequest request : requests) {
            request.modes = opts.modes(request.modes);
            request.dateTime = opts.dateTime(config.timeZone());
            request.arriveBy = opts.flag(CommandLineOpts.ARRIVE_BY_OPT);
            if (opts.doubleValue(CommandLineOpts.MAX_WALK_OPT) != null) {
                request.maxWalkDistance = opts.doubleValue(CommandLineOpts.MAX_WALK_OPT);
            }
            if (opts.intValue(CommandLineOpts.NUM_ITINERARIES_OPT) != null) {
                request.numItineraries = opts.intValue(CommandLineOpts.NUM_ITINERARIES_OPT);
            }
            request.routingOptions = routingOptions;
            request.validate();
        }
        List<PlanResult> results;
        try (OtpHttpClient httpClient = new OtpHttpClient(config)) {
            OtpClient client = new OtpClient(config, OtpConnection.fromConfig(config).check(httpClient), httpClient);
            results = client.planMany(requests);
        }
        List<LegRow> rows = new ArrayList<>();
        List<PlanResult> failures = new ArrayList<>();
        for (PlanResult result : results) {
            rows.addAll(result.rows);
            if (!result.isSuccess()) failures.add(result);
        }
        File outputFile = opts.file(CommandLineOpts.OUTPUT_OPT);
        try (Writer writer = openOutput(outputFile)) {
            if (isGeoJson(outputFile)) {
                new GeoJsonResultWriter().writeLegRows(rows, writer);
            } else {
                new CsvResultWriter().writeLegRows(rows, writer);
            }
        }
        LOG.info("{} of {} trips planned, {} legs written.", results.size() - failures.size(), results.size(),
                rows.size());
        if (!failures.isEmpty()) {
            for (PlanResult failure : failures) {
                LOG.warn("No trip {}: {}", failure.request, failure.error);
            }
            if (outputFile != null) {
                File errorFile = errorFile(outputFile);
                try (Writer writer = Files.newBufferedWriter(errorFile.toPath(), StandardCharsets.UTF_8)) {
                    new CsvResultWriter().writeErrors(failures, writer);
                }
                LOG.warn("Failed requests written to {}", errorFile);
            }
        }
        return failures.size() == results.size() ? EXIT_FAILURE : EXIT_SUCCESS;
    }

    private static List<PlanRequest> planRequests (CommandLineOpts opts) throws IOException {
        File pairsFile = opts.file(CommandLineOpts.PAIRS_OPT);
        LatLon from = opts.location(CommandLineOpts.FROM_OPT);
        LatLon to = opts.location(CommandLineOpts.TO_OPT);
        if (pairsFile != null) {
            if (from != null || to != null) {
                throw OtpDriverException.badRequest("Give either --pairs or --from and --to, not both.");
            }
            List<PlanRequest> requests = LocationFiles.readPairs(pairsFile);
            if (requests.isEmpty()) {
                throw OtpDriverException.badRequest("No origin-destination pairs in " + pairsFile);
            }
            return requests;
        }
        if (from == null || to == null) {
            throw OtpDriverException.badRequest("Give --from and --to, or a --pairs file.");
        }
        List<PlanRequest> requests = new ArrayList<>();
        requests.add(new PlanRequest("from", from, "to", to));
        return requests;
    }

    private int isochrone (OtpDriverConfig config, CommandLineOpts opts) throws IOException {
        List<IsochroneRequest> requests;
        File originsFile = opts.file(CommandLineOpts.ORIGINS_OPT);
        LatLon from = opts.location(CommandLineOpts.FROM_OPT);
        if (originsFile != null) {
            if (from != null) {
                throw OtpDriverException.badRequest("Give either --origins or --from, not both.");
            }
            requests = LocationFiles.readOrigins(originsFile);
        } else if (from != null) {
            requests = new ArrayList<>();
            requests.add(new IsochroneRequest("from", from));
        } else {
            throw OtpDriverException.badRequest("Give --from or an --origins file.");
        }
        RoutingOptions routingOptions = opts.routingOptions();
        for (IsochroneRequest request : requests) {
            request.modes = opts.modes(request.modes);
            request.dateTime = opts.dateTime(config.timeZone());
            request.arriveBy = opts.flag(CommandLineOpts.ARRIVE_BY_OPT);
            if (opts.doubleValue(CommandLineOpts.MAX_WALK_OPT) != null) {
                request.maxWalkDistance = opts.doubleValue(CommandLineOpts.MAX_WALK_OPT);
            }
            if (opts.flag(CommandLineOpts.CUTOFFS_OPT)) {
                request.cutoffSeconds = opts.intList(CommandLineOpts.CUTOFFS_OPT);
            }
            request.routingOptions = routingOptions;
            request.validate();
        }
        List<IsochroneBand> bands;
        try (OtpHttpClient httpClient = new OtpHttpClient(config)) {
            OtpClient client = new OtpClient(config, OtpConnection.fromConfig(config).check(httpClient), httpClient);
            bands = client.isochroneMany(requests);
        }
        File outputFile = opts.file(CommandLineOpts.OUTPUT_OPT);
        try (Writer writer = openOutput(outputFile)) {
            if (isGeoJson(outputFile)) {
                new GeoJsonResultWriter().writeIsochroneBands(bands, writer);
            } else {
                new CsvResultWriter().writeIsochroneBands(bands, writer);
            }
        }
        LOG.info("{} isochrones written for {} origins.", bands.size(), requests.size());
        return EXIT_SUCCESS;
    }

    private int geocode (OtpDriverConfig config, CommandLineOpts opts) throws IOException {
        GeocodeRequest request = new GeocodeRequest(opts.string(CommandLineOpts.QUERY_OPT));
        request.autocomplete = opts.flag(CommandLineOpts.AUTOCOMPLETE_OPT);
        if (opts.flag(CommandLineOpts.TYPES_OPT)) {
            List<String> types = opts.parseCSVList(CommandLineOpts.TYPES_OPT).stream()
                    .map(String::toLowerCase)
                    .collect(Collectors.toList());
            for (String type : types) {
                if (!Arrays.asList("stops", "clusters", "corners").contains(type)) {
                    throw OtpDriverException.badRequest("Unrecognized geocoder result type " + type);
                }
            }
            request.stops = types.contains("stops");
            request.clusters = types.contains("clusters");
            request.corners = types.contains("corners");
        }
        List<GeocodeResult> results;
        try (OtpHttpClient httpClient = new OtpHttpClient(config)) {
            OtpClient client = new OtpClient(config, OtpConnection.fromConfig(config).check(httpClient), httpClient);
            results = client.geocode(request);
        }
        try (Writer writer = openOutput(opts.file(CommandLineOpts.OUTPUT_OPT))) {
            CsvWriter csvWriter = new CsvWriter(writer, CsvResultWriter.CSV_DELIMITER);
            csvWriter.writeRecord(new String[] { "id", "description", "lat", "lon" });
            for (GeocodeResult result : results) {
                csvWriter.writeRecord(new String[] {
                        result.id, result.description, Double.toString(result.lat), Double.toString(result.lng)
                });
            }
            csvWriter.flush();
        }
        LOG.info("{} geocoder matches for '{}'.", results.size(), request.query);
        return EXIT_SUCCESS;
    }

    /** A writer on the given file, or on the standard output if it is null. Closing the latter only flushes it. */
    private Writer openOutput (File outputFile) throws IOException {
        if (outputFile == null) {
            return new OutputStreamWriter(out, StandardCharsets.UTF_8) {
                @Override
                public void close () throws IOException {
                    flush();
                }
            };
        }
        File parent = outputFile.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.isDirectory()) {
            throw OtpDriverException.badRequest("Output directory does not exist: " + parent);
        }
        return Files.newBufferedWriter(outputFile.toPath(), StandardCharsets.UTF_8);
    }

    static boolean isGeoJson (File outputFile) {
        if (outputFile == null) return false;
        String extension = FilenameUtils.getExtension(outputFile.getName());
        return "geojson".equalsIgnoreCase(extension) || "json".equalsIgnoreCase(extension);
    }

    /** Failed requests of trips.csv go to trips-errors.csv. */
    static File errorFile (File outputFile) {
        String baseName = FilenameUtils.getBaseName(outputFile.getName());
        return new File(outputFile.getAbsoluteFile().getParentFile(), baseName + "-errors.csv");
    }

}
