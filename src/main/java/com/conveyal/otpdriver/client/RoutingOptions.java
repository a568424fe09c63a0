package com.conveyal.otpdriver.client;

import com.conveyal.otpdriver.OtpDriverException;
import com.conveyal.otpdriver.util.JsonUtilities;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.http.client.utils.URIBuilder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Optional routing parameters passed through to the OTP 1.x planner and isochrone endpoints. Fields left null are not
 * sent, so OTP applies its own defaults (or those of the router-config.json of the router).
 */
public class RoutingOptions {

    /** Values of the optimize parameter, i.e. what the street search minimizes. */
    public enum Optimize {
        QUICK, SAFE, FLAT, GREENWAYS, TRIANGLE, TRANSFERS
    }

    /** Multiplier for the cost of walking compared to riding transit. */
    public Double walkReluctance;

    /** Multiplier for the cost of waiting compared to riding transit. */
    public Double waitReluctance;

    /** Multiplier for the cost of waiting before the first boarding. */
    public Double waitAtBeginningFactor;

    /** Penalty in seconds added to each boarding when arriving on foot. */
    public Integer walkBoardCost;

    /** Penalty in seconds added to each boarding when arriving by bicycle. */
    public Integer bikeBoardCost;

    /** Penalty in seconds added to each transfer. */
    public Integer transferPenalty;

    /** Maximum number of transfers. */
    public Integer maxTransfers;

    /** Minimum time in seconds between alighting and boarding another vehicle. */
    public Integer minTransferTime;

    /** Maximum time in seconds spent driving or cycling before boarding transit in park/bike and ride searches. */
    public Integer maxPreTransitTime;

    /** Walking speed in meters per second. */
    public Double walkSpeed;

    /** Cycling speed in meters per second. */
    public Double bikeSpeed;

    public Boolean wheelchair;

    /** Maximum slope of streets for wheelchair users. */
    public Double maxSlope;

    public Optimize optimize;

    // Weights of the three criteria of the TRIANGLE optimization, which must add up to one.
    public Double triangleSafetyFactor;
    public Double triangleSlopeFactor;
    public Double triangleTimeFactor;

    /** Maximum length in hours of the search. */
    public Double maxHours;

    /** Whether the maximum walk distance is a soft limit that can be exceeded at a cost. */
    public Boolean softWalkLimiting;

    public void validate () {
        checkNotNegative("walkReluctance", walkReluctance);
        checkNotNegative("waitReluctance", waitReluctance);
        checkNotNegative("waitAtBeginningFactor", waitAtBeginningFactor);
        checkNotNegative("walkBoardCost", walkBoardCost);
        checkNotNegative("bikeBoardCost", bikeBoardCost);
        checkNotNegative("transferPenalty", transferPenalty);
        checkNotNegative("maxTransfers", maxTransfers);
        checkNotNegative("minTransferTime", minTransferTime);
        checkNotNegative("maxPreTransitTime", maxPreTransitTime);
        checkNotNegative("maxSlope", maxSlope);
        checkNotNegative("maxHours", maxHours);
        checkPositive("walkSpeed", walkSpeed);
        checkPositive("bikeSpeed", bikeSpeed);
        boolean anyTriangleFactor = triangleSafetyFactor != null || triangleSlopeFactor != null
                || triangleTimeFactor != null;
        if (optimize == Optimize.TRIANGLE) {
            if (triangleSafetyFactor == null || triangleSlopeFactor == null || triangleTimeFactor == null) {
                throw OtpDriverException.badRequest("Optimize TRIANGLE requires all three triangle factors.");
            }
            checkNotNegative("triangleSafetyFactor", triangleSafetyFactor);
            checkNotNegative("triangleSlopeFactor", triangleSlopeFactor);
            checkNotNegative("triangleTimeFactor", triangleTimeFactor);
            double sum = triangleSafetyFactor + triangleSlopeFactor + triangleTimeFactor;
            if (Math.abs(sum - 1) > 1e-6) {
                throw OtpDriverException.badRequest("Triangle factors must add up to 1, they add up to " + sum);
            }
        } else if (anyTriangleFactor) {
            throw OtpDriverException.badRequest("Triangle factors are only allowed with optimize TRIANGLE.");
        }
    }

    private static void checkNotNegative (String name, Number value) {
        if (value != null && value.doubleValue() < 0) {
            throw OtpDriverException.badRequest(name + " must not be negative, was " + value);
        }
    }

    private static void checkPositive (String name, Number value) {
        if (value != null && value.doubleValue() <= 0) {
            throw OtpDriverException.badRequest(name + " must be positive, was " + value);
        }
    }

    /** The options that are set, by OTP query parameter name, in a stable order. */
    public Map<String, String> toParameters () {
        Map<String, String> params = new LinkedHashMap<>();
        put(params, "walkReluctance", walkReluctance);
        put(params, "waitReluctance", waitReluctance);
        put(params, "waitAtBeginningFactor", waitAtBeginningFactor);
        put(params, "walkBoardCost", walkBoardCost);
        put(params, "bikeBoardCost", bikeBoardCost);
        put(params, "transferPenalty", transferPenalty);
        put(params, "maxTransfers", maxTransfers);
        put(params, "minTransferTime", minTransferTime);
        put(params, "maxPreTransitTime", maxPreTransitTime);
        put(params, "walkSpeed", walkSpeed);
        put(params, "bikeSpeed", bikeSpeed);
        put(params, "wheelchair", wheelchair);
        put(params, "maxSlope", maxSlope);
        put(params, "optimize", optimize);
        put(params, "triangleSafetyFactor", triangleSafetyFactor);
        put(params, "triangleSlopeFactor", triangleSlopeFactor);
        put(params, "triangleTimeFactor", triangleTimeFactor);
        put(params, "maxHours", maxHours);
        put(params, "softWalkLimiting", softWalkLimiting);
        return params;
    }

    private static void put (Map<String, String> params, String name, Object value) {
        if (value != null) params.put(name, value.toString());
    }

    /**
     * Read options from OTP query parameter names and their textual values, as typed on a command line.
     * Unknown names are rejected rather than silently ignored.
     */
    public static RoutingOptions fromParameters (Map<String, String> params) {
        ObjectMapper strictMapper = JsonUtilities.lenientObjectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        try {
            RoutingOptions options = strictMapper.convertValue(params, RoutingOptions.class);
            options.validate();
            return options;
        } catch (IllegalArgumentException e) {
            throw OtpDriverException.badRequest("Invalid routing options " + params + ": " + e.getMessage());
        }
    }

    void addTo (URIBuilder builder) {
        validate();
        toParameters().forEach(builder::addParameter);
    }

}
