package com.conveyal.otpdriver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Shared functionality for loading properties containing configuration information and exposing them through the
 * Config interfaces of the setup and client components.
 *
 * Defaults are shipped in a classpath resource, so a complete list of parameters is always visible in one place.
 * A user properties file may override any of them, and environment variables and system properties override the file.
 */
public class ConfigBase {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigBase.class);

    public static final String OTP_PROPERTY_PREFIX = "otp-";

    // All access to these should be through the *Prop methods.
    private final Properties properties;

    protected final Set<String> keysWithErrors = new TreeSet<>();

    /**
     * Prepare to load config from the given properties, overriding from the supplied environment and system
     * properties. In the latter two sources keys may be in upper or lower case and use dashes, underscores, or dots
     * as separators, and must carry the "otp" prefix, e.g. OTP_MEMORY_GB=4 or java -Dotp.memory.gb=4.
     * Precedence of configuration sources is: system properties > environment variables > config file > defaults.
     */
    protected ConfigBase (Properties properties, Map<String, String> environment, Properties systemProperties) {
        this.properties = properties;
        setPropertiesFromMap(environment, "environment variable");
        setPropertiesFromMap(systemProperties, "system properties");
    }

    /** Load a properties file, layering its contents over the given defaults. */
    protected static Properties propsFromFile (File file, Properties defaults) {
        Properties properties = new Properties();
        properties.putAll(defaults);
        try (Reader propsReader = new FileReader(file)) {
            properties.load(propsReader);
            return properties;
        } catch (IOException e) {
            throw new OtpDriverException(OtpDriverException.Type.CONFIG,
                    "Could not load configuration properties from " + file, -1, e);
        }
    }

    /** Load properties from a resource on the classpath, used for the shipped defaults. */
    protected static Properties propsFromResource (String resourceName) {
        try (InputStream stream = ConfigBase.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (stream == null) {
                throw OtpDriverException.config("Missing configuration resource " + resourceName);
            }
            Properties properties = new Properties();
            properties.load(stream);
            return properties;
        } catch (IOException e) {
            throw new OtpDriverException(OtpDriverException.Type.CONFIG,
                    "Could not load configuration resource " + resourceName, -1, e);
        }
    }

    // Always use the following *Prop methods to read properties. They catch and record missing keys or parse
    // errors, allowing config loading to continue and reporting as many problems as possible at once.

    protected String strProp (String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            LOG.error("Missing configuration option {}", key);
            keysWithErrors.add(key);
            return null;
        }
        return value.trim();
    }

    /** Like strProp, but an empty value is returned as null rather than as an empty string. */
    protected String optionalStrProp (String key) {
        String value = strProp(key);
        return (value == null || value.isEmpty()) ? null : value;
    }

    protected int intProp (String key) {
        String val = strProp(key);
        if (val != null) {
            try {
                return Integer.parseInt(val);
            } catch (NumberFormatException nfe) {
                LOG.error("Value of configuration option '{}' could not be parsed as an integer: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return 0;
    }

    protected boolean boolProp (String key) {
        String val = strProp(key);
        if (val != null) {
            // Boolean.parseBoolean will return false for any string other than "true". We want to be more strict.
            if ("true".equalsIgnoreCase(val) || "yes".equalsIgnoreCase(val)) {
                return true;
            } else if ("false".equalsIgnoreCase(val) || "no".equalsIgnoreCase(val)) {
                return false;
            } else {
                LOG.error("Value of configuration option '{}' could not be parsed as a boolean: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return false;
    }

    /** Record a problem found while validating an option that was present and parsed. */
    protected void invalid (String key, String reason) {
        LOG.error("Invalid configuration option {}: {}", key, reason);
        keysWithErrors.add(key);
    }

    /** Call this after reading all properties to report every missing or malformed option in a single exception. */
    protected void throwIfErrors () {
        if (!keysWithErrors.isEmpty()) {
            throw OtpDriverException.config(
                    "Missing or invalid configuration properties: " + String.join(", ", keysWithErrors));
        }
    }

    /**
     * Overwrite configuration options with environment variables or system properties. Case and separators are
     * normalized to conform to both properties and environment variable conventions.
     */
    private void setPropertiesFromMap (Map<?, ?> map, String sourceDescription) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            // Normalize to String type, all lower case, all dash separators.
            String key = ((String) entry.getKey()).toLowerCase().replaceAll("[\\._-]", "-");
            String value = (String) entry.getValue();
            if (key.startsWith(OTP_PROPERTY_PREFIX)) {
                key = key.substring(OTP_PROPERTY_PREFIX.length());
                if (properties.getProperty(key) != null) {
                    LOG.info("Overwriting existing config key {} to '{}' from {}.", key, value, sourceDescription);
                } else {
                    LOG.info("Setting configuration key {} to '{}' from {}.", key, value, sourceDescription);
                }
                properties.setProperty(key, value);
            }
        }
    }

}
