package com.conveyal.otpdriver.setup;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

import java.io.File;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class OtpCommandTest {

    private final File jar = new File("otp-1.5.0-shaded.jar");
    private final File baseDir = new File("data");

    @Test
    public void testBuildGraphCommand () {
        OtpCommand command = OtpCommand.buildGraph("java", 4, jar, baseDir, "london", false);
        String routerDir = new File(new File(baseDir, "graphs"), "london").getPath();
        assertEquals(ImmutableList.of("java", "-Xmx4G", "-jar", jar.getPath(), "--build", routerDir),
                command.arguments);

        OtpCommand analyst = OtpCommand.buildGraph("java", 4, jar, baseDir, "london", true);
        assertEquals("--analyst", analyst.arguments.get(analyst.arguments.size() - 1));
    }

    @Test
    public void testServerCommand () {
        OtpCommand command = OtpCommand.server("/usr/bin/java", 2, jar, baseDir, "default", 8080, 8081, true);
        String graphsDir = new File(baseDir, "graphs").getPath();
        assertEquals(ImmutableList.of("/usr/bin/java", "-Xmx2G", "-jar", jar.getPath(), "--router", "default",
                "--graphs", graphsDir, "--server", "--port", "8080", "--securePort", "8081", "--analyst"),
                command.arguments);
    }

    @Test
    public void testCommandLineQuotesPaths () {
        OtpCommand command = OtpCommand.buildGraph("java", 2, jar, baseDir, "default", false);
        String commandLine = command.toCommandLine();
        assertTrue(commandLine.startsWith("java -Xmx2G -jar \"otp-1.5.0-shaded.jar\" --build \""), commandLine);
        assertEquals("java -version", OtpCommand.javaVersion("java").toCommandLine());
    }

    @Test
    public void testInvalidArguments () {
        assertThrows(IllegalArgumentException.class,
                () -> OtpCommand.buildGraph("java", 0, jar, baseDir, "default", false));
        assertThrows(IllegalArgumentException.class,
                () -> OtpCommand.buildGraph("java", 2, jar, baseDir, "", false));
        assertThrows(IllegalArgumentException.class,
                () -> OtpCommand.server("java", 2, jar, baseDir, "default", 70000, 8081, false));
        assertThrows(NullPointerException.class,
                () -> OtpCommand.buildGraph("java", 2, null, baseDir, "default", false));
    }

}
