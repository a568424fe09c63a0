package com.conveyal.otpdriver;

import com.conveyal.otpdriver.util.ExceptionUtils;

/**
 * The single exception type thrown when driving an OTP process or talking to its API fails. The type field tells the
 * caller (usually the command line tool) which stage failed, and for HTTP failures httpCode holds the status received
 * from OTP, or -1 if no response arrived at all.
 */
public class OtpDriverException extends RuntimeException {

    public final Type type;
    public final int httpCode;
    public final String message;

    public enum Type {
        BAD_REQUEST,
        BUILD,
        CHECK,
        CONFIG,
        CONNECTION,
        HTTP,
        JAVA_VERSION,
        JSON_PARSING,
        LAUNCH,
        UNKNOWN;
    }

    public static OtpDriverException badRequest (String message) {
        return new OtpDriverException(Type.BAD_REQUEST, message);
    }

    public static OtpDriverException check (String message) {
        return new OtpDriverException(Type.CHECK, message);
    }

    public static OtpDriverException config (String message) {
        return new OtpDriverException(Type.CONFIG, message);
    }

    public static OtpDriverException connection (String message) {
        return new OtpDriverException(Type.CONNECTION, message);
    }

    public static OtpDriverException javaVersion (String message) {
        return new OtpDriverException(Type.JAVA_VERSION, message);
    }

    public static OtpDriverException launch (String message) {
        return new OtpDriverException(Type.LAUNCH, message);
    }

    public static OtpDriverException http (int httpCode, String message) {
        return new OtpDriverException(Type.HTTP, message, httpCode, null);
    }

    public static OtpDriverException http (String message, Throwable cause) {
        return new OtpDriverException(Type.HTTP, message, -1, cause);
    }

    public static OtpDriverException jsonParsing (String message, Throwable cause) {
        return new OtpDriverException(Type.JSON_PARSING, message, -1, cause);
    }

    public static OtpDriverException unknown (Throwable throwable) {
        return new OtpDriverException(Type.UNKNOWN, ExceptionUtils.shortCauseString(throwable), -1, throwable);
    }

    public OtpDriverException (Type type, String message) {
        this(type, message, -1, null);
    }

    public OtpDriverException (Type type, String message, int httpCode, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.message = message;
        this.httpCode = httpCode;
    }

    @Override
    public String getMessage () {
        return message;
    }

}
