package com.conveyal.otpdriver.setup;

import java.util.Objects;

/**
 * The major and minor version numbers reported by "java -version", in the legacy numbering where Java 8 is 1.8.
 * OTP 1.x only runs on Java 8, so these are compared as the decimal number major.minor: 1.8 is accepted while 1.7,
 * 1.9 and 11.0 are not.
 */
public class JavaVersion {

    public static final JavaVersion MINIMUM_FOR_OTP = new JavaVersion(1, 8);
    public static final JavaVersion FIRST_UNSUPPORTED_FOR_OTP = new JavaVersion(1, 9);

    public final int major;
    public final int minor;

    public JavaVersion (int major, int minor) {
        this.major = major;
        this.minor = minor;
    }

    /**
     * Parse the first line printed by "java -version", e.g. {@code java version "1.8.0_191"} or
     * {@code openjdk version "1.8.0_292"}. The version is the text between the first pair of double quotes, of which
     * only the first two dot-separated parts are kept.
     *
     * @return the parsed version, or null if the line does not contain a quoted major.minor version, as is the case
     *         for Java releases that report a bare major version such as {@code "17"}.
     */
    public static JavaVersion parse (String firstLine) {
        if (firstLine == null) return null;
        String[] quoted = firstLine.split("\"");
        if (quoted.length < 2) return null;
        String[] parts = quoted[1].split("\\.");
        if (parts.length < 2) return null;
        try {
            return new JavaVersion(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public boolean isBefore (JavaVersion other) {
        return major < other.major || (major == other.major && minor < other.minor);
    }

    public boolean isSupportedByOtp () {
        return !isBefore(MINIMUM_FOR_OTP) && isBefore(FIRST_UNSUPPORTED_FOR_OTP);
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JavaVersion that = (JavaVersion) o;
        return major == that.major && minor == that.minor;
    }

    @Override
    public int hashCode () {
        return Objects.hash(major, minor);
    }

    @Override
    public String toString () {
        return major + "." + minor;
    }

}
