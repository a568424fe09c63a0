package com.conveyal.otpdriver.client;

import com.conveyal.otpdriver.OtpDriverConfig;
import com.conveyal.otpdriver.OtpDriverException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class OtpConnectionTest {

    private static OtpHttpClient httpClient () {
        Properties properties = new Properties();
        properties.setProperty("http-timeout-seconds", "5");
        return new OtpHttpClient(OtpDriverConfig.fromProperties(properties));
    }

    @Test
    public void testUrls () {
        OtpConnection plain = new OtpConnection("otp.example.org", "london", null, 8080, false);
        assertEquals("http://otp.example.org:8080", plain.baseUrl());
        assertEquals("http://otp.example.org:8080/otp/routers", plain.routersUrl());
        assertEquals("http://otp.example.org:8080/otp/routers/london", plain.routerUrl());

        OtpConnection secure = new OtpConnection("otp.example.org", "london", null, 8443, true);
        assertEquals("https://otp.example.org:8443/otp/routers/london", secure.routerUrl());

        // A full URL replaces scheme, host and port.
        OtpConnection proxied = new OtpConnection("ignored", "london", "https://example.org/transit//", 8080, false);
        assertEquals("https://example.org/transit/otp/routers/london", proxied.routerUrl());
    }

    @Test
    public void testInvalidConnections () {
        assertThrows(IllegalArgumentException.class, () -> new OtpConnection("localhost", "", null, 8080, false));
        assertThrows(IllegalArgumentException.class, () -> new OtpConnection(null, "default", null, 8080, false));
        assertThrows(IllegalArgumentException.class, () -> new OtpConnection("localhost", "default", null, 0, false));
    }

    @Test
    public void testCheckRunningRouter () throws IOException {
        try (StubOtpServer otp = new StubOtpServer().withDefaultRouter(); OtpHttpClient httpClient = httpClient()) {
            OtpConnection connection = OtpConnection.localhost(otp.port(), "default");
            assertSame(connection, connection.check(httpClient));
            OtpConnection otherRouter = OtpConnection.localhost(otp.port(), "paris");
            assertFalse(otherRouter.isRouterAvailable(httpClient));
            OtpDriverException e = assertThrows(OtpDriverException.class, () -> otherRouter.check(httpClient));
            assertEquals(OtpDriverException.Type.CONNECTION, e.type);
            assertTrue(e.getMessage().contains("/otp/routers/paris"), e.getMessage());
        }
    }

    @Test
    public void testNothingListening () throws IOException {
        int freePort;
        try (ServerSocket socket = new ServerSocket(0)) {
            freePort = socket.getLocalPort();
        }
        try (OtpHttpClient httpClient = httpClient()) {
            assertFalse(OtpConnection.localhost(freePort, "default").isRouterAvailable(httpClient));
        }
    }

}
