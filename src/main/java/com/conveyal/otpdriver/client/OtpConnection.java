package com.conveyal.otpdriver.client;

import com.conveyal.otpdriver.OtpDriverException;
import org.apache.http.client.utils.URIBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Describes where a running OTP instance can be reached and which of its routers to address. All endpoint URLs used
 * by the client hang off the router URL, e.g. http://localhost:8080/otp/routers/default/plan.
 */
public class OtpConnection {

    private static final Logger LOG = LoggerFactory.getLogger(OtpConnection.class);

    public static final String ROUTERS_PATH = "/otp/routers";

    public interface Config {
        String hostname ();
        String router ();
        String url ();
        int port ();
        boolean ssl ();
    }

    public final String hostname;
    public final String router;
    /** If not null, replaces scheme, hostname and port, e.g. for an OTP behind a reverse proxy. */
    public final String url;
    public final int port;
    public final boolean ssl;

    public OtpConnection (String hostname, String router, String url, int port, boolean ssl) {
        checkArgument(router != null && !router.isEmpty(), "Router name must not be empty.");
        checkArgument(url != null || (hostname != null && !hostname.isEmpty()), "A hostname or URL is required.");
        checkArgument(port > 0 && port < 65536, "Port %s is not a valid TCP port.", port);
        this.hostname = hostname;
        this.router = router;
        this.url = url == null ? null : stripTrailingSlashes(url);
        this.port = port;
        this.ssl = ssl;
    }

    public static OtpConnection fromConfig (Config config) {
        return new OtpConnection(config.hostname(), config.router(), config.url(), config.port(), config.ssl());
    }

    /** The connection to an OTP just launched on this machine, which never uses SSL. */
    public static OtpConnection localhost (int port, String router) {
        return new OtpConnection("localhost", router, null, port, false);
    }

    private static String stripTrailingSlashes (String s) {
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == '/') end--;
        return s.substring(0, end);
    }

    /** e.g. http://localhost:8080, the address of the OTP web interface. */
    public String baseUrl () {
        if (url != null) return url;
        return (ssl ? "https://" : "http://") + hostname + ":" + port;
    }

    public String routersUrl () {
        return baseUrl() + ROUTERS_PATH;
    }

    public String routerUrl () {
        return routersUrl() + "/" + router;
    }

    /** Start building the URI of an endpoint of this router, such as "plan" or "isochrone". */
    public URIBuilder endpoint (String endpointName) {
        try {
            return new URIBuilder(routerUrl() + "/" + endpointName);
        } catch (URISyntaxException e) {
            throw OtpDriverException.badRequest("Malformed OTP URL " + routerUrl() + ": " + e.getMessage());
        }
    }

    public static URI build (URIBuilder builder) {
        try {
            return builder.build();
        } catch (URISyntaxException e) {
            throw OtpDriverException.badRequest("Malformed OTP request URL: " + e.getMessage());
        }
    }

    /**
     * A single probe of the router URL, true if OTP answered 200. Failure to connect at all counts as false rather
     * than an error, since this is used while OTP is still starting up.
     */
    public boolean isRouterAvailable (OtpHttpClient httpClient) {
        try {
            int status = httpClient.status(URI.create(routerUrl()));
            LOG.debug("Router {} answered HTTP {}", routerUrl(), status);
            return status == 200;
        } catch (IOException | IllegalArgumentException e) {
            LOG.debug("Router {} did not answer: {}", routerUrl(), e.getMessage());
            return false;
        }
    }

    /** Confirm that OTP is up and serves this router. */
    public OtpConnection check (OtpHttpClient httpClient) {
        if (isRouterAvailable(httpClient)) {
            LOG.info("Router {} exists", routerUrl());
            return this;
        }
        throw OtpDriverException.connection("Router " + routerUrl() + " does not exist. Check that OTP is running "
                + "and serving this router.");
    }

    @Override
    public String toString () {
        return routerUrl();
    }

}
