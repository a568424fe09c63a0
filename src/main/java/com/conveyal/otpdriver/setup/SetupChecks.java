package com.conveyal.otpdriver.setup;

import com.conveyal.otpdriver.OtpDriverException;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;

/**
 * Checks run before building a graph or launching OTP. Each one stops the operation with an exception, since OTP
 * itself tends to fail minutes into a build with a much less helpful message.
 */
public class SetupChecks {

    private static final Logger LOG = LoggerFactory.getLogger(SetupChecks.class);

    public static final String GRAPH_FILE_NAME = "Graph.obj";

    public interface Config {
        String javaCommand ();
        boolean checkJavaVersion ();
    }

    private final Config config;
    private final CommandRunner commandRunner;

    public SetupChecks (Config config, CommandRunner commandRunner) {
        this.config = config;
        this.commandRunner = commandRunner;
    }

    /**
     * @param requireGraph whether graphs/{router}/Graph.obj must already exist, i.e. whether we are about to serve a
     *                     graph rather than build one.
     */
    public void check (File otpJar, File baseDir, String router, boolean requireGraph) {
        if (otpJar == null || !otpJar.isFile()) {
            throw OtpDriverException.check("OTP jar file does not exist: " + otpJar);
        }
        if (!"jar".equalsIgnoreCase(FilenameUtils.getExtension(otpJar.getName()))) {
            throw OtpDriverException.check("OTP file must have extension .jar: " + otpJar);
        }
        if (baseDir == null || !baseDir.isDirectory()) {
            throw OtpDriverException.check("Directory does not exist: " + baseDir);
        }
        File routerDir = OtpCommand.routerDirectory(baseDir, router);
        if (!routerDir.isDirectory()) {
            throw OtpDriverException.check("Router directory does not exist: " + routerDir);
        }
        if (config.checkJavaVersion()) {
            checkJavaVersion();
        } else {
            LOG.warn("Skipping the Java version check.");
        }
        if (requireGraph) {
            File graph = new File(routerDir, GRAPH_FILE_NAME);
            if (!graph.isFile()) {
                throw OtpDriverException.check("Graph file does not exist, build the graph first: " + graph);
            }
        }
    }

    /** OTP 1.x requires Java 8. Run java -version and inspect the first line it prints. */
    public JavaVersion checkJavaVersion () {
        CommandOutput output;
        try {
            output = commandRunner.run(OtpCommand.javaVersion(config.javaCommand()).arguments);
        } catch (IOException e) {
            LOG.warn("Unable to run {}: {}", config.javaCommand(), e.getMessage());
            throw OtpDriverException.javaVersion("Unable to detect a version of Java.");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw OtpDriverException.javaVersion("Interrupted while detecting the version of Java.");
        }
        JavaVersion version = JavaVersion.parse(output.firstLine());
        if (version == null || !version.isSupportedByOtp()) {
            LOG.warn("Java reported: {}", output.firstLine());
            throw OtpDriverException.javaVersion("OTP requires Java version 8.");
        }
        LOG.debug("Found Java version {}", version);
        return version;
    }

}
