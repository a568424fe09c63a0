package com.conveyal.otpdriver.setup;

import com.conveyal.otpdriver.OtpDriverException;
import com.conveyal.otpdriver.client.OtpConnection;
import com.conveyal.otpdriver.client.OtpHttpClient;
import org.apache.commons.io.input.ReversedLinesFileReader;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Launches an OTP server on this machine for a previously built graph, and optionally waits until it answers HTTP
 * requests. Loading a large graph takes minutes, so readiness is polled a bounded number of times. Once polling gives
 * up, control is returned to the caller while OTP carries on loading in the background.
 */
public class OtpLauncher {

    private static final Logger LOG = LoggerFactory.getLogger(OtpLauncher.class);

    /** Written in the router directory, next to Graph.obj. */
    public static final String LOG_FILE_NAME = "otp-server.log";

    private static final int LOG_TAIL_LINES = 20;

    public interface Config {
        String javaCommand ();
        File otpJar ();
        File baseDirectory ();
        String router ();
        int memoryGb ();
        boolean analyst ();
        int port ();
        int securePort ();
        boolean waitForServer ();
        int startupDelaySeconds ();
        int pollIntervalSeconds ();
        int pollAttempts ();
        boolean openBrowser ();
    }

    private final Config config;
    private final SetupChecks checks;
    private final CommandRunner commandRunner;
    private final OtpHttpClient httpClient;
    private final Sleeper sleeper;
    private final BrowserLauncher browserLauncher;
    private final OperatingSystem operatingSystem;

    public OtpLauncher (Config config, SetupChecks checks, CommandRunner commandRunner, OtpHttpClient httpClient,
                        Sleeper sleeper, BrowserLauncher browserLauncher, OperatingSystem operatingSystem) {
        this.config = config;
        this.checks = checks;
        this.commandRunner = commandRunner;
        this.httpClient = httpClient;
        this.sleeper = sleeper;
        this.browserLauncher = browserLauncher;
        this.operatingSystem = operatingSystem;
    }

    public OtpServer setup () {
        if (!operatingSystem.supportsLaunch()) {
            throw OtpDriverException.launch("You're on an unknown OS, launching OTP is not yet supported.");
        }
        checks.check(config.otpJar(), config.baseDirectory(), config.router(), true);
        OtpCommand command = OtpCommand.server(config.javaCommand(), config.memoryGb(), config.otpJar(),
                config.baseDirectory(), config.router(), config.port(), config.securePort(), config.analyst());
        File logFile = new File(OtpCommand.routerDirectory(config.baseDirectory(), config.router()), LOG_FILE_NAME);
        LOG.info("Running {}", command);
        Process process;
        try {
            process = commandRunner.start(command.arguments, logFile);
        } catch (IOException e) {
            throw new OtpDriverException(OtpDriverException.Type.LAUNCH, "Failed to start OTP: " + e.getMessage(),
                    -1, e);
        }
        if (!process.isAlive()) {
            throw exitedWhileLoading(process, logFile);
        }
        LOG.info("OTP is loading and may take a while to be useable, its output goes to {}", logFile);
        OtpConnection connection = OtpConnection.localhost(config.port(), config.router());
        boolean ready = false;
        if (config.waitForServer()) {
            try {
                ready = awaitReady(process, connection, logFile);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while waiting for OTP, it keeps loading in the background.");
            }
        }
        return new OtpServer(process, connection, logFile, ready);
    }

    /**
     * Wait for the startup delay, then probe the router up to pollAttempts times with pollInterval between probes.
     * @return true as soon as the router answers, false if it never did.
     */
    boolean awaitReady (Process process, OtpConnection connection, File logFile) throws InterruptedException {
        sleeper.sleepSeconds(config.startupDelaySeconds());
        for (int attempt = 1; attempt <= config.pollAttempts(); attempt++) {
            if (!process.isAlive()) {
                throw exitedWhileLoading(process, logFile);
            }
            LOG.debug("Readiness probe {} of {}", attempt, config.pollAttempts());
            if (connection.isRouterAvailable(httpClient)) {
                LOG.info("OTP is ready to use Go to localhost:{} in your browser to view the OTP", connection.port);
                if (config.openBrowser()) {
                    browserLauncher.open(URI.create(connection.baseUrl()));
                }
                return true;
            }
            if (attempt < config.pollAttempts()) {
                sleeper.sleepSeconds(config.pollIntervalSeconds());
            }
        }
        LOG.warn("OTP is taking an unusually long time to load, returning control while it keeps loading.");
        return false;
    }

    private static OtpDriverException exitedWhileLoading (Process process, File logFile) {
        List<String> tail = tail(logFile, LOG_TAIL_LINES);
        String message = tail.stream()
                .filter(line -> StringUtils.containsIgnoreCase(line, "ERROR"))
                .findFirst()
                .orElse("OTP exited with code " + process.exitValue() + ". " + String.join("\n", tail));
        return OtpDriverException.launch("Failed to start OTP with message: " + message);
    }

    /** The last lines of the OTP log, oldest first, or nothing if the log cannot be read. */
    static List<String> tail (File logFile, int nLines) {
        if (!logFile.isFile()) return Collections.emptyList();
        try (ReversedLinesFileReader reader = new ReversedLinesFileReader(logFile, StandardCharsets.UTF_8)) {
            List<String> lines = new ArrayList<>(reader.readLines(nLines));
            Collections.reverse(lines);
            return lines;
        } catch (IOException e) {
            LOG.warn("Could not read OTP log {}: {}", logFile, e.getMessage());
            return Collections.emptyList();
        }
    }

}
