package com.conveyal.otpdriver.client;

import com.conveyal.otpdriver.OtpDriverException;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Modes accepted in the "mode" parameter of the OTP 1.x planner and isochrone endpoints. Qualified street modes carry
 * their qualifier after an underscore, e.g. BICYCLE_RENT for bike share and CAR_PARK for park and ride.
 */
public enum TransportMode {
    // Street modes
    WALK, BICYCLE, CAR,
    // Renting a bicycle
    BICYCLE_RENT,
    // Bike and ride
    BICYCLE_PARK,
    // Park and ride
    CAR_PARK,
    // Transit modes, TRANSIT meaning all of them
    TRANSIT, BUS, TRAM, SUBWAY, RAIL, FERRY, CABLE_CAR, GONDOLA, FUNICULAR, AIRPLANE;

    private static final Set<TransportMode> STREET_MODES =
            EnumSet.of(WALK, BICYCLE, CAR, BICYCLE_RENT, BICYCLE_PARK, CAR_PARK);

    public boolean isTransit () {
        return !STREET_MODES.contains(this);
    }

    public static TransportMode fromString (String mode) {
        try {
            return TransportMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw OtpDriverException.badRequest("Unrecognized mode " + mode);
        }
    }

    /**
     * OTP cannot reach or leave a transit stop without a street mode, so a set made only of transit modes gets WALK
     * added to it.
     */
    public static EnumSet<TransportMode> withAccessMode (Collection<TransportMode> modes) {
        if (modes.isEmpty()) {
            throw OtpDriverException.badRequest("At least one mode must be given.");
        }
        EnumSet<TransportMode> result = EnumSet.copyOf(modes);
        if (result.stream().allMatch(TransportMode::isTransit)) {
            result.add(WALK);
        }
        return result;
    }

    /** Comma-separated form used in the query string, e.g. "WALK,TRANSIT". */
    public static String toParameter (Collection<TransportMode> modes) {
        StringBuilder sb = new StringBuilder();
        for (TransportMode mode : withAccessMode(modes)) {
            if (sb.length() > 0) sb.append(',');
            sb.append(mode.name());
        }
        return sb.toString();
    }

}
