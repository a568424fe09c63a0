package com.conveyal.otpdriver.setup;

import com.conveyal.otpdriver.OtpDriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;

/**
 * Builds an OTP graph from the OSM, GTFS and elevation files in graphs/{router}/ by running OTP with --build and
 * waiting for it to finish. Graph building is done entirely by OTP, this class only assembles the command and judges
 * the outcome from the exit code and output.
 */
public class GraphBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(GraphBuilder.class);

    /**
     * OTP fails fast on bad input with a short report containing ERROR. A successful build prints many lines, some of
     * which may mention errors in the input data, so a long log is not treated as failure even if it contains ERROR.
     */
    public static final int SHORT_LOG_LINES = 10;

    public interface Config {
        String javaCommand ();
        File otpJar ();
        File baseDirectory ();
        String router ();
        int memoryGb ();
        boolean analyst ();
    }

    private final Config config;
    private final SetupChecks checks;
    private final CommandRunner commandRunner;

    public GraphBuilder (Config config, SetupChecks checks, CommandRunner commandRunner) {
        this.config = config;
        this.checks = checks;
        this.commandRunner = commandRunner;
    }

    public GraphBuildResult buildGraph () {
        checks.check(config.otpJar(), config.baseDirectory(), config.router(), false);
        LOG.info("Basic checks completed, building graph, this may take a few minutes");
        OtpCommand command = OtpCommand.buildGraph(config.javaCommand(), config.memoryGb(), config.otpJar(),
                config.baseDirectory(), config.router(), config.analyst());
        LOG.info("Running {}", command);
        CommandOutput output;
        try {
            output = commandRunner.run(command.arguments);
        } catch (IOException e) {
            throw new OtpDriverException(OtpDriverException.Type.BUILD, "Could not start OTP to build the graph.", -1, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OtpDriverException(OtpDriverException.Type.BUILD, "Interrupted while building the graph.", -1, e);
        }
        boolean success = !looksLikeFailure(output);
        if (success) {
            LOG.info("Graph built");
        } else {
            LOG.error("Failed to build graph with message:\n{}", output);
        }
        return new GraphBuildResult(command, output, success);
    }

    static boolean looksLikeFailure (CommandOutput output) {
        if (output.exitCode != 0) return true;
        return output.anyLineContainsIgnoreCase("ERROR") && output.lines.size() < SHORT_LOG_LINES;
    }

}
