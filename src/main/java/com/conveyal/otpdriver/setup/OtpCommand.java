package com.conveyal.otpdriver.setup;

import com.google.common.collect.ImmutableList;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Assembles the command lines understood by the OTP 1.x shaded jar. Commands are kept as argument lists so they can
 * be handed straight to a ProcessBuilder, and rendered to a single shell-style string only for logging.
 */
public class OtpCommand {

    public final List<String> arguments;

    private OtpCommand (List<String> arguments) {
        this.arguments = ImmutableList.copyOf(arguments);
    }

    /**
     * java -Xmx{memory}G -jar {otp} --build {dir}/graphs/{router} [--analyst]
     */
    public static OtpCommand buildGraph (String javaCommand, int memoryGb, File otpJar, File baseDir, String router,
                                         boolean analyst) {
        List<String> args = javaPrefix(javaCommand, memoryGb, otpJar);
        args.add("--build");
        args.add(routerDirectory(baseDir, router).getPath());
        if (analyst) args.add("--analyst");
        return new OtpCommand(args);
    }

    /**
     * java -Xmx{memory}G -jar {otp} --router {router} --graphs {dir}/graphs --server --port {port}
     * --securePort {securePort} [--analyst]
     */
    public static OtpCommand server (String javaCommand, int memoryGb, File otpJar, File baseDir, String router,
                                     int port, int securePort, boolean analyst) {
        checkPort(port);
        checkPort(securePort);
        List<String> args = javaPrefix(javaCommand, memoryGb, otpJar);
        args.add("--router");
        args.add(checkRouter(router));
        args.add("--graphs");
        args.add(graphsDirectory(baseDir).getPath());
        args.add("--server");
        args.add("--port");
        args.add(Integer.toString(port));
        args.add("--securePort");
        args.add(Integer.toString(securePort));
        if (analyst) args.add("--analyst");
        return new OtpCommand(args);
    }

    /** java -version, which prints its report on standard error. */
    public static OtpCommand javaVersion (String javaCommand) {
        return new OtpCommand(ImmutableList.of(checkNotNull(javaCommand), "-version"));
    }

    public static File graphsDirectory (File baseDir) {
        return new File(checkNotNull(baseDir, "base directory"), "graphs");
    }

    public static File routerDirectory (File baseDir, String router) {
        return new File(graphsDirectory(baseDir), checkRouter(router));
    }

    private static List<String> javaPrefix (String javaCommand, int memoryGb, File otpJar) {
        checkNotNull(javaCommand, "java command");
        checkNotNull(otpJar, "OTP jar");
        // OTP is given a whole number of gigabytes.
        checkArgument(memoryGb > 0, "Memory must be a positive number of gigabytes, was %s.", memoryGb);
        List<String> args = new ArrayList<>();
        args.add(javaCommand);
        args.add("-Xmx" + memoryGb + "G");
        args.add("-jar");
        args.add(otpJar.getPath());
        return args;
    }

    private static String checkRouter (String router) {
        checkArgument(router != null && !router.isEmpty(), "Router name must not be empty.");
        return router;
    }

    private static void checkPort (int port) {
        checkArgument(port > 0 && port < 65536, "Port %s is not a valid TCP port.", port);
    }

    /**
     * Render as a single command line for display, quoting arguments that are paths or contain whitespace, e.g.
     * {@code java -Xmx2G -jar "/otp/otp.jar" --build "/data/graphs/default"}.
     */
    public String toCommandLine () {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < arguments.size(); i++) {
            String arg = arguments.get(i);
            if (i > 0) sb.append(' ');
            boolean quote = arg.contains(" ") || arg.contains(File.separator) || arg.endsWith(".jar");
            if (quote) {
                sb.append('"').append(arg).append('"');
            } else {
                sb.append(arg);
            }
        }
        return sb.toString();
    }

    @Override
    public String toString () {
        return toCommandLine();
    }

}
