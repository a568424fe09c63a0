package com.conveyal.otpdriver.setup;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Runs operating system commands. The setup components only ever talk to the operating system through this
 * interface, so the commands they assemble can be inspected without starting any Java process.
 */
public interface CommandRunner {

    /** Run the command to completion, capturing standard output and standard error merged into one list of lines. */
    CommandOutput run (List<String> command) throws IOException, InterruptedException;

    /** Start the command without waiting for it, sending both of its output streams to the given file. */
    Process start (List<String> command, File logFile) throws IOException;

}
