package com.conveyal.otpdriver.client;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Date and time formats of the OTP 1.x REST API. Requests take a local date as MM-dd-yyyy and a local time such as
 * 08:30am, responses carry instants as milliseconds since the epoch.
 */
public abstract class OtpDateTime {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("MM-dd-yyyy", Locale.US);

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("hh:mma", Locale.US);

    public static String date (ZonedDateTime dateTime) {
        return DATE_FORMAT.format(dateTime);
    }

    public static String time (ZonedDateTime dateTime) {
        return TIME_FORMAT.format(dateTime).toLowerCase(Locale.ROOT);
    }

    /** Null-safe conversion of an epoch millisecond timestamp from a response. */
    public static ZonedDateTime fromEpochMillis (Long epochMillis, ZoneId zoneId) {
        if (epochMillis == null) return null;
        return Instant.ofEpochMilli(epochMillis).atZone(zoneId);
    }

}
