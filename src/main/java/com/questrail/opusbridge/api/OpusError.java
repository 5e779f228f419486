package com.questrail.opusbridge.api;

/**
 * OpusError
 * -----------------------------------------------------------------------------
 * Stable enumeration of the error codes libopus reports.
 *
 * <p>The bridge passes codec codes through unchanged; this enum exists so that
 * callers and diagnostics can interpret them without depending on the raw
 * numbering. Codes the enum does not know map to {@link #UNKNOWN}.</p>
 */
public enum OpusError
{
    OK(0, "success"),
    BAD_ARG(-1, "invalid argument"),
    BUFFER_TOO_SMALL(-2, "buffer too small"),
    INTERNAL_ERROR(-3, "internal error"),
    INVALID_PACKET(-4, "corrupted stream"),
    UNIMPLEMENTED(-5, "request not implemented"),
    INVALID_STATE(-6, "invalid state"),
    ALLOC_FAIL(-7, "memory allocation failed"),
    UNKNOWN(Integer.MIN_VALUE, "unknown error");

    private final int code;
    private final String description;

    OpusError(int code, String description)
    {
        this.code = code;
        this.description = description;
    }

    public int code()
    {
        return code;
    }

    public String description()
    {
        return description;
    }

    public static OpusError fromCode(int code)
    {
        for (OpusError e : values()) {
            if (e != UNKNOWN && e.code == code) {
                return e;
            }
        }
        return UNKNOWN;
    }
}
