package com.conveyal.otpdriver.setup;

import java.util.List;

/** What happened when OTP was asked to build a graph: everything it printed, and whether that looks like success. */
public class GraphBuildResult {

    public final OtpCommand command;
    public final List<String> log;
    public final int exitCode;
    public final boolean success;

    public GraphBuildResult (OtpCommand command, CommandOutput output, boolean success) {
        this.command = command;
        this.log = output.lines;
        this.exitCode = output.exitCode;
        this.success = success;
    }

}
