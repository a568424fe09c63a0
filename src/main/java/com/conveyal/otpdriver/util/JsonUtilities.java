package com.conveyal.otpdriver.util;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * The Jackson configuration shared by the OTP API client and the result writers.
 */
public abstract class JsonUtilities {

    /**
     * OTP responses carry many more fields than we model, and differ between OTP releases. Unknown fields are ignored
     * rather than failing the whole request.
     */
    public static final ObjectMapper lenientObjectMapper = new ObjectMapper();

    static {
        lenientObjectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        lenientObjectMapper.configure(SerializationFeature.INDENT_OUTPUT, true);
        // Results are often written to standard output, which must stay open.
        lenientObjectMapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
    }

}
