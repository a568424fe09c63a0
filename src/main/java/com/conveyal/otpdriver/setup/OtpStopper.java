package com.conveyal.otpdriver.setup;

import com.conveyal.otpdriver.OtpDriverException;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Stops OTP instances that were started outside this JVM, e.g. by an earlier run of the command line tool, by killing
 * Java processes with the tools of the operating system. OTP does not identify itself in the process list, so this
 * cannot tell OTP apart from other Java programs: it lists them, and kills them all only when asked to. Use
 * OtpServer.stop() to stop a server launched by this JVM.
 */
public class OtpStopper {

    private static final Logger LOG = LoggerFactory.getLogger(OtpStopper.class);

    public static final List<String> LIST_PROCESSES = ImmutableList.of("ps", "-A");
    public static final List<String> KILL_ALL_UNIX = ImmutableList.of("pkill", "-9", "java");
    public static final List<String> LIST_PROCESSES_WINDOWS =
            ImmutableList.of("tasklist", "/FI", "IMAGENAME eq java.exe");
    public static final List<String> KILL_ALL_WINDOWS = ImmutableList.of("Taskkill", "/IM", "java.exe", "/F");

    private final CommandRunner commandRunner;
    private final OperatingSystem operatingSystem;

    public OtpStopper (CommandRunner commandRunner, OperatingSystem operatingSystem) {
        this.commandRunner = commandRunner;
        this.operatingSystem = operatingSystem;
    }

    /**
     * @param killAll whether to kill every Java process found rather than only list them.
     * @return the Java processes found.
     */
    public List<String> stop (boolean killAll) {
        try {
            switch (operatingSystem) {
                case LINUX:
                case MAC:
                    return stop(killAll, LIST_PROCESSES, KILL_ALL_UNIX, "kill -9 PID");
                case WINDOWS:
                    return stop(killAll, LIST_PROCESSES_WINDOWS, KILL_ALL_WINDOWS, "Taskkill /PID PID /F");
                default:
                    LOG.warn("You're on an unknown OS, stopping OTP is not yet supported.");
                    return ImmutableList.of();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw OtpDriverException.launch("Interrupted while stopping OTP.");
        }
    }

    private List<String> stop (boolean killAll, List<String> listCommand, List<String> killCommand,
                               String manualKill) throws InterruptedException {
        List<String> javaProcesses = listJavaProcesses(listCommand);
        LOG.info("The following Java instances have been found:\n{}", String.join("\n", javaProcesses));
        if (killAll) {
            run(killCommand);
            LOG.info("Killed all Java instances.");
        } else {
            LOG.info("Kill the instances manually, e.g. with:\n{}\nwhere PID is the id of the Java instance",
                    manualKill);
        }
        return javaProcesses;
    }

    /** Lines of the process list mentioning java, equivalent to ps -A | grep java. */
    List<String> listJavaProcesses (List<String> listCommand) throws InterruptedException {
        return run(listCommand).lines.stream()
                .filter(line -> line.contains("java"))
                .collect(Collectors.toList());
    }

    private CommandOutput run (List<String> command) throws InterruptedException {
        try {
            CommandOutput output = commandRunner.run(command);
            // pkill exits with 1 when nothing matched, which is not a failure for our purposes.
            if (output.exitCode > 1) {
                LOG.warn("{} exited with code {}: {}", String.join(" ", command), output.exitCode, output);
            }
            return output;
        } catch (IOException e) {
            throw new OtpDriverException(OtpDriverException.Type.LAUNCH,
                    "Could not run " + String.join(" ", command) + ": " + e.getMessage(), -1, e);
        }
    }

}
