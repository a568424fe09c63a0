package com.conveyal.otpdriver.cli;

import com.conveyal.otpdriver.OtpDriverConfig;
import com.conveyal.otpdriver.OtpDriverException;
import com.conveyal.otpdriver.client.LatLon;
import com.conveyal.otpdriver.client.RoutingOptions;
import com.conveyal.otpdriver.client.TransportMode;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.File;
import java.io.PrintWriter;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Options of the otp-driver command line tool. All commands share one set of options; those naming a configuration
 * key override the value loaded from the configuration file.
 */
public class CommandLineOpts {

    private static final boolean OPTION_UNKNOWN_THEN_FAIL = false;

    protected final CommandLine cmd;

    /* Options overriding configuration keys */
    static final String CONFIG_OPT = "c";
    static final String JAR_OPT = "jar";
    static final String DIR_OPT = "dir";
    static final String ROUTER_OPT = "router";
    static final String MEMORY_OPT = "memory";
    static final String HOSTNAME_OPT = "hostname";
    static final String PORT_OPT = "port";
    static final String SECURE_PORT_OPT = "securePort";
    static final String URL_OPT = "url";
    static final String SSL_OPT = "ssl";
    static final String ANALYST_OPT = "analyst";
    static final String NO_WAIT_OPT = "noWait";
    static final String NO_BROWSER_OPT = "noBrowser";
    static final String SKIP_JAVA_CHECK_OPT = "skipJavaCheck";
    static final String THREADS_OPT = "threads";
    static final String TIMEZONE_OPT = "timezone";

    /* Request options */
    static final String FROM_OPT = "from";
    static final String TO_OPT = "to";
    static final String PAIRS_OPT = "pairs";
    static final String ORIGINS_OPT = "origins";
    static final String MODE_OPT = "mode";
    static final String DATE_TIME_OPT = "dateTime";
    static final String ARRIVE_BY_OPT = "arriveBy";
    static final String MAX_WALK_OPT = "maxWalkDistance";
    static final String NUM_ITINERARIES_OPT = "numItineraries";
    static final String CUTOFFS_OPT = "cutoffs";
    static final String ROUTING_OPTION_OPT = "O";
    static final String QUERY_OPT = "query";
    static final String AUTOCOMPLETE_OPT = "autocomplete";
    static final String TYPES_OPT = "types";
    static final String OUTPUT_OPT = "o";

    /* Stop options */
    static final String YES_OPT = "y";
    static final String LIST_ONLY_OPT = "listOnly";

    static final String HELP_OPT = "h";

    /** Command line option names, by the configuration key they override. */
    private static final Map<String, String> CONFIG_KEYS_BY_OPTION = new LinkedHashMap<>();

    static {
        CONFIG_KEYS_BY_OPTION.put(JAR_OPT, "jar");
        CONFIG_KEYS_BY_OPTION.put(DIR_OPT, "base-dir");
        CONFIG_KEYS_BY_OPTION.put(ROUTER_OPT, "router");
        CONFIG_KEYS_BY_OPTION.put(MEMORY_OPT, "memory-gb");
        CONFIG_KEYS_BY_OPTION.put(HOSTNAME_OPT, "hostname");
        CONFIG_KEYS_BY_OPTION.put(PORT_OPT, "port");
        CONFIG_KEYS_BY_OPTION.put(SECURE_PORT_OPT, "secure-port");
        CONFIG_KEYS_BY_OPTION.put(URL_OPT, "url");
        CONFIG_KEYS_BY_OPTION.put(THREADS_OPT, "plan-threads");
        CONFIG_KEYS_BY_OPTION.put(TIMEZONE_OPT, "timezone");
    }

    CommandLineOpts (String[] args) throws ParseException {
        CommandLineParser cmdParser = new DefaultParser();
        cmd = cmdParser.parse(options(), args, OPTION_UNKNOWN_THEN_FAIL);
        if (!cmd.getArgList().isEmpty()) {
            throw new ParseException("Unexpected argument(s): " + cmd.getArgList());
        }
    }

    static Options options () {
        Options options = new Options();
        options.addOption(CONFIG_OPT, "config", true, "Configuration properties file. Defaults to "
                + OtpDriverConfig.DEFAULT_CONFIG_FILE + " if it exists.");
        options.addOption(null, JAR_OPT, true, "Path to the OTP jar file.");
        options.addOption(null, DIR_OPT, true, "Directory containing graphs/<router>/.");
        options.addOption(null, ROUTER_OPT, true, "Router name.");
        options.addOption(null, MEMORY_OPT, true, "Memory given to OTP, in GB.");
        options.addOption(null, HOSTNAME_OPT, true, "Host of a running OTP.");
        options.addOption(null, PORT_OPT, true, "HTTP port of OTP.");
        options.addOption(null, SECURE_PORT_OPT, true, "HTTPS port of OTP.");
        options.addOption(null, URL_OPT, true, "Base URL of a running OTP, replacing hostname and port.");
        options.addOption(null, SSL_OPT, false, "Connect to OTP over HTTPS.");
        options.addOption(null, ANALYST_OPT, false, "Enable the OTP analyst features.");
        options.addOption(null, NO_WAIT_OPT, false, "Return as soon as OTP is launched.");
        options.addOption(null, NO_BROWSER_OPT, false, "Do not open a browser once OTP is ready.");
        options.addOption(null, SKIP_JAVA_CHECK_OPT, false, "Do not check that Java 8 is installed.");
        options.addOption(null, THREADS_OPT, true, "Number of concurrent requests in a batch.");
        options.addOption(null, TIMEZONE_OPT, true, "Time zone of request and result times, e.g. Europe/London.");
        options.addOption(null, FROM_OPT, true, "Origin as lat,lon.");
        options.addOption(null, TO_OPT, true, "Destination as lat,lon.");
        options.addOption(null, PAIRS_OPT, true, "CSV file with columns fromId,fromLat,fromLon,toId,toLat,toLon.");
        options.addOption(null, ORIGINS_OPT, true, "CSV file with columns id,lat,lon.");
        options.addOption(null, MODE_OPT, true, "Comma separated modes, e.g. TRANSIT,WALK.");
        options.addOption(null, DATE_TIME_OPT, true, "Local date and time of travel, e.g. 2026-10-19T08:30.");
        options.addOption(null, ARRIVE_BY_OPT, false, "The date and time are the latest arrival.");
        options.addOption(null, MAX_WALK_OPT, true, "Maximum walk distance in meters.");
        options.addOption(null, NUM_ITINERARIES_OPT, true, "Number of itineraries per trip.");
        options.addOption(null, CUTOFFS_OPT, true, "Comma separated isochrone cutoffs in seconds.");
        options.addOption(ROUTING_OPTION_OPT, "option", true, "Routing option as name=value, may be repeated.");
        options.addOption(null, QUERY_OPT, true, "Geocoder query.");
        options.addOption(null, AUTOCOMPLETE_OPT, false, "Match the geocoder query as a prefix.");
        options.addOption(null, TYPES_OPT, true, "Comma separated geocoder result types: stops,clusters,corners.");
        options.addOption(OUTPUT_OPT, "output", true, "Output file, .csv or .geojson. Defaults to CSV on stdout.");
        options.addOption(YES_OPT, "yes", false, "Stop Java without asking for confirmation.");
        options.addOption(null, LIST_ONLY_OPT, false, "Only list Java processes instead of killing them.");
        options.addOption(HELP_OPT, "help", false, "Print all command line options, then exit.");
        return options;
    }

    static void printHelp (PrintWriter out) {
        HelpFormatter formatter = new HelpFormatter();
        formatter.printHelp(out, 120, "otp-driver <build|setup|stop|check|plan|isochrone|geocode> [options]",
                null, options(), 2, 4, null);
        out.flush();
    }

    boolean help () {
        return cmd.hasOption(HELP_OPT);
    }

    /** The configuration file given, or the default one if it exists in the working directory. */
    File configFile () {
        if (cmd.hasOption(CONFIG_OPT)) {
            return new File(cmd.getOptionValue(CONFIG_OPT));
        }
        File defaultFile = new File(OtpDriverConfig.DEFAULT_CONFIG_FILE);
        return defaultFile.isFile() ? defaultFile : null;
    }

    Properties configOverrides () {
        Properties overrides = new Properties();
        CONFIG_KEYS_BY_OPTION.forEach((option, key) -> {
            if (cmd.hasOption(option)) overrides.setProperty(key, cmd.getOptionValue(option));
        });
        if (cmd.hasOption(SSL_OPT)) overrides.setProperty("ssl", "true");
        if (cmd.hasOption(ANALYST_OPT)) overrides.setProperty("analyst", "true");
        if (cmd.hasOption(NO_WAIT_OPT)) overrides.setProperty("wait", "false");
        if (cmd.hasOption(NO_BROWSER_OPT)) overrides.setProperty("open-browser", "false");
        if (cmd.hasOption(SKIP_JAVA_CHECK_OPT)) overrides.setProperty("check-java-version", "false");
        return overrides;
    }

    LatLon location (String opt) {
        String value = cmd.getOptionValue(opt);
        if (value == null) return null;
        try {
            return LatLon.parse(value);
        } catch (IllegalArgumentException e) {
            throw OtpDriverException.badRequest("Option --" + opt + ": " + e.getMessage());
        }
    }

    File file (String opt) {
        return cmd.hasOption(opt) ? new File(cmd.getOptionValue(opt)) : null;
    }

    String string (String opt) {
        return cmd.getOptionValue(opt);
    }

    boolean flag (String opt) {
        return cmd.hasOption(opt);
    }

    /** The modes given, or the default if the option is absent. */
    Set<TransportMode> modes (Set<TransportMode> defaultModes) {
        if (!cmd.hasOption(MODE_OPT)) return defaultModes;
        List<TransportMode> modes = parseCSVList(MODE_OPT).stream()
                .map(TransportMode::fromString)
                .collect(Collectors.toList());
        return modes.isEmpty() ? defaultModes : EnumSet.copyOf(modes);
    }

    ZonedDateTime dateTime (ZoneId zoneId) {
        if (!cmd.hasOption(DATE_TIME_OPT)) return null;
        try {
            return LocalDateTime.parse(cmd.getOptionValue(DATE_TIME_OPT)).atZone(zoneId);
        } catch (DateTimeParseException e) {
            throw OtpDriverException.badRequest("Option --" + DATE_TIME_OPT + " is not a date and time such as "
                    + "2026-10-19T08:30: " + cmd.getOptionValue(DATE_TIME_OPT));
        }
    }

    Double doubleValue (String opt) {
        return cmd.hasOption(opt) ? parseNumber(opt, Double::valueOf) : null;
    }

    Integer intValue (String opt) {
        return cmd.hasOption(opt) ? parseNumber(opt, Integer::valueOf) : null;
    }

    List<Integer> intList (String opt) {
        try {
            return parseCSVList(opt).stream().map(Integer::valueOf).collect(Collectors.toList());
        } catch (NumberFormatException e) {
            throw OtpDriverException.badRequest("Option --" + opt + " must be a list of whole numbers.");
        }
    }

    /** Routing options given as repeated -O name=value, or null if there are none. */
    RoutingOptions routingOptions () {
        String[] values = cmd.getOptionValues(ROUTING_OPTION_OPT);
        if (values == null) return null;
        Map<String, String> params = new LinkedHashMap<>();
        for (String value : values) {
            int equals = value.indexOf('=');
            if (equals < 1) {
                throw OtpDriverException.badRequest("Routing option must be written name=value: " + value);
            }
            params.put(value.substring(0, equals).trim(), value.substring(equals + 1).trim());
        }
        return RoutingOptions.fromParameters(params);
    }

    List<String> parseCSVList (String opt) {
        return cmd.hasOption(opt)
                ? Arrays.asList(cmd.getOptionValue(opt).split("\\s*,\\s*"))
                : Collections.emptyList();
    }

    private <T> T parseNumber (String opt, Function<String, T> parser) {
        try {
            return parser.apply(cmd.getOptionValue(opt).trim());
        } catch (NumberFormatException e) {
            throw OtpDriverException.badRequest("Option --" + opt + " is not a number: " + cmd.getOptionValue(opt));
        }
    }

}
