package com.conveyal.otpdriver;

import com.conveyal.otpdriver.client.OtpClient;
import com.conveyal.otpdriver.client.OtpConnection;
import com.conveyal.otpdriver.client.OtpHttpClient;
import com.conveyal.otpdriver.setup.GraphBuilder;
import com.conveyal.otpdriver.setup.OtpLauncher;
import com.conveyal.otpdriver.setup.SetupChecks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Collections;
import java.util.Map;
import java.util.Properties;

/** Loads config information for the OTP driver and exposes it to the setup and client components. */
public class OtpDriverConfig extends ConfigBase implements
        SetupChecks.Config,
        GraphBuilder.Config,
        OtpLauncher.Config,
        OtpConnection.Config,
        OtpHttpClient.Config,
        OtpClient.Config
{

    // CONSTANTS AND STATIC FIELDS

    private static final Logger LOG = LoggerFactory.getLogger(OtpDriverConfig.class);

    public static final String DEFAULTS_RESOURCE = "otp-driver-defaults.properties";
    public static final String DEFAULT_CONFIG_FILE = "otp-driver.properties";

    // INSTANCE FIELDS

    private final String javaCommand;
    private final File otpJar;
    private final File baseDirectory;
    private final String router;
    private final int memoryGb;
    private final boolean analyst;
    private final String hostname;
    private final int port;
    private final int securePort;
    private final boolean ssl;
    private final String url;
    private final boolean checkJavaVersion;
    private final boolean waitForServer;
    private final int startupDelaySeconds;
    private final int pollIntervalSeconds;
    private final int pollAttempts;
    private final boolean openBrowser;
    private final int httpTimeoutSeconds;
    private final int planThreads;
    private final ZoneId timeZone;

    // CONSTRUCTORS

    protected OtpDriverConfig (Properties properties, Map<String, String> environment, Properties systemProperties) {
        super(properties, environment, systemProperties);
        javaCommand = strProp("java-command");
        otpJar = fileProp("jar");
        baseDirectory = fileProp("base-dir");
        router = strProp("router");
        memoryGb = intProp("memory-gb");
        analyst = boolProp("analyst");
        hostname = strProp("hostname");
        port = intProp("port");
        securePort = intProp("secure-port");
        ssl = boolProp("ssl");
        url = optionalStrProp("url");
        checkJavaVersion = boolProp("check-java-version");
        waitForServer = boolProp("wait");
        startupDelaySeconds = intProp("startup-delay-seconds");
        pollIntervalSeconds = intProp("poll-interval-seconds");
        pollAttempts = intProp("poll-attempts");
        openBrowser = boolProp("open-browser");
        httpTimeoutSeconds = intProp("http-timeout-seconds");
        planThreads = intProp("plan-threads");
        timeZone = zoneProp("timezone");
        validate();
        throwIfErrors();
    }

    private File fileProp (String key) {
        String value = optionalStrProp(key);
        return value == null ? null : new File(value);
    }

    private ZoneId zoneProp (String key) {
        String value = optionalStrProp(key);
        if (value == null) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(value);
        } catch (DateTimeException e) {
            invalid(key, "unrecognized time zone " + value);
            return ZoneId.systemDefault();
        }
    }

    private void validate () {
        if (router != null && router.isEmpty()) invalid("router", "router name must not be empty");
        if (memoryGb < 1) invalid("memory-gb", "memory must be at least 1 GB");
        if (port < 1 || port > 65535) invalid("port", "not a valid TCP port");
        if (securePort < 1 || securePort > 65535) invalid("secure-port", "not a valid TCP port");
        if (startupDelaySeconds < 0) invalid("startup-delay-seconds", "must not be negative");
        if (pollIntervalSeconds < 0) invalid("poll-interval-seconds", "must not be negative");
        if (pollAttempts < 1) invalid("poll-attempts", "at least one attempt is required");
        if (httpTimeoutSeconds < 1) invalid("http-timeout-seconds", "must be at least one second");
        if (planThreads < 1) invalid("plan-threads", "at least one thread is required");
    }

    // INTERFACE IMPLEMENTATIONS
    // Note that one method can implement several Config interfaces at once.

    @Override public String  javaCommand()          { return javaCommand; }
    @Override public File    otpJar()               { return otpJar; }
    @Override public File    baseDirectory()        { return baseDirectory; }
    @Override public String  router()               { return router; }
    @Override public int     memoryGb()             { return memoryGb; }
    @Override public boolean analyst()              { return analyst; }
    @Override public String  hostname()             { return hostname; }
    @Override public int     port()                 { return port; }
    @Override public int     securePort()           { return securePort; }
    @Override public boolean ssl()                  { return ssl; }
    @Override public String  url()                  { return url; }
    @Override public boolean checkJavaVersion()     { return checkJavaVersion; }
    @Override public boolean waitForServer()        { return waitForServer; }
    @Override public int     startupDelaySeconds()  { return startupDelaySeconds; }
    @Override public int     pollIntervalSeconds()  { return pollIntervalSeconds; }
    @Override public int     pollAttempts()         { return pollAttempts; }
    @Override public boolean openBrowser()          { return openBrowser; }
    @Override public int     httpTimeoutSeconds()   { return httpTimeoutSeconds; }
    @Override public int     planThreads()          { return planThreads; }
    @Override public ZoneId  timeZone()             { return timeZone; }

    // STATIC FACTORY METHODS
    // Always use these to construct OtpDriverConfig objects for readability.

    /**
     * Layer the shipped defaults, the given file (if any), the process environment and the JVM system properties.
     * This is what the command line tool uses. Its options are treated like system properties, so they win over
     * everything else.
     */
    public static OtpDriverConfig load (File configFile, Properties commandLineOverrides) {
        Properties properties = propsFromResource(DEFAULTS_RESOURCE);
        if (configFile != null) {
            LOG.info("Loading configuration from {}", configFile);
            properties = propsFromFile(configFile, properties);
        }
        Properties systemProperties = new Properties();
        systemProperties.putAll(System.getProperties());
        for (String key : commandLineOverrides.stringPropertyNames()) {
            systemProperties.setProperty(OTP_PROPERTY_PREFIX + key, commandLineOverrides.getProperty(key));
        }
        return new OtpDriverConfig(properties, System.getenv(), systemProperties);
    }

    /**
     * Layer the given properties over the shipped defaults, ignoring the environment. Used when embedding the driver
     * in another program, where the caller wants full control over the options.
     */
    public static OtpDriverConfig fromProperties (Properties overrides) {
        Properties properties = propsFromResource(DEFAULTS_RESOURCE);
        properties.putAll(overrides);
        return new OtpDriverConfig(properties, Collections.emptyMap(), new Properties());
    }

}
