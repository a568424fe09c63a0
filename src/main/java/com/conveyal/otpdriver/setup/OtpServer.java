package com.conveyal.otpdriver.setup;

import com.conveyal.otpdriver.client.OtpConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.concurrent.TimeUnit;

/**
 * An OTP server process started by the OtpLauncher. Unlike the OtpStopper, which kills every Java process on the
 * machine, this stops only the process it refers to.
 */
public class OtpServer {

    private static final Logger LOG = LoggerFactory.getLogger(OtpServer.class);

    private static final int STOP_TIMEOUT_SECONDS = 10;

    public final Process process;

    public final OtpConnection connection;

    public final File logFile;

    /** Whether the router answered during readiness polling. False if we did not wait, or gave up waiting. */
    public final boolean ready;

    public OtpServer (Process process, OtpConnection connection, File logFile, boolean ready) {
        this.process = process;
        this.connection = connection;
        this.logFile = logFile;
        this.ready = ready;
    }

    public boolean isAlive () {
        return process.isAlive();
    }

    /** Ask OTP to shut down, then kill it if it has not exited within a few seconds. */
    public void stop () throws InterruptedException {
        if (!process.isAlive()) {
            LOG.info("OTP process has already exited.");
            return;
        }
        process.destroy();
        if (!process.waitFor(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            LOG.warn("OTP did not exit within {} seconds, killing it.", STOP_TIMEOUT_SECONDS);
            process.destroyForcibly();
            process.waitFor();
        }
        LOG.info("OTP serving {} stopped.", connection);
    }

}
