package com.conveyal.otpdriver.setup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs commands as child processes of this JVM. No shell is involved, so paths containing spaces need no quoting.
 */
public class LocalCommandRunner implements CommandRunner {

    private static final Logger LOG = LoggerFactory.getLogger(LocalCommandRunner.class);

    @Override
    public CommandOutput run (List<String> command) throws IOException, InterruptedException {
        LOG.debug("Running {}", command);
        ProcessBuilder processBuilder = new ProcessBuilder(command);
        processBuilder.redirectErrorStream(true);
        Process process = processBuilder.start();
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                LOG.debug("> {}", line);
                lines.add(line);
            }
        } catch (IOException e) {
            process.destroyForcibly();
            throw e;
        }
        int exitCode = process.waitFor();
        return new CommandOutput(lines, exitCode);
    }

    @Override
    public Process start (List<String> command, File logFile) throws IOException {
        LOG.debug("Starting {}, output goes to {}", command, logFile);
        ProcessBuilder processBuilder = new ProcessBuilder(command);
        processBuilder.redirectErrorStream(true);
        processBuilder.redirectOutput(ProcessBuilder.Redirect.appendTo(logFile));
        return processBuilder.start();
    }

}
