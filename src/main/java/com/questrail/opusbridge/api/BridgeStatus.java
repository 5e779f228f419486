package com.questrail.opusbridge.api;

/**
 * Sentinel values shared by every {@link OpusBridge} implementation.
 *
 * <p>{@link #INVALID_HANDLE} lies outside the range libopus uses for its own
 * error codes ({@code -1..-7}) so that a stale handle is never confused with a
 * codec failure.</p>
 */
public final class BridgeStatus
{
    /** Returned by create calls on failure; never a live handle. */
    public static final long NO_HANDLE = 0L;

    /** Null handle or buffer, or a buffer too short for the request. */
    public static final int PRECONDITION_FAILED = -1;

    /** A non-zero handle that is not live (destroyed, unknown, or of the other kind). */
    public static final int INVALID_HANDLE = -100;

    private BridgeStatus() {}

    /**
     * Returns true if an encode/decode result denotes failure.
     */
    public static boolean isFailure(int result)
    {
        return result < 0;
    }

    /**
     * Returns a short label for a negative result, for diagnostics.
     */
    public static String describe(int result)
    {
        if (result >= 0) {
            return "ok";
        }
        if (result == INVALID_HANDLE) {
            return "invalid handle";
        }
        return OpusError.fromCode(result).description();
    }
}
