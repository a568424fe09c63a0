package com.conveyal.otpdriver.setup;

import org.apache.commons.lang3.SystemUtils;

/** The operating system families for which we know how to find and stop Java processes. */
public enum OperatingSystem {

    LINUX, MAC, WINDOWS, OTHER;

    public static OperatingSystem current () {
        if (SystemUtils.IS_OS_WINDOWS) return WINDOWS;
        if (SystemUtils.IS_OS_MAC) return MAC;
        if (SystemUtils.IS_OS_LINUX) return LINUX;
        return OTHER;
    }

    /** Whether we can launch OTP here at all. Process launching does not depend on any OS specific tools. */
    public boolean supportsLaunch () {
        return this != OTHER;
    }

}
