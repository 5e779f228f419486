package com.questrail.opusbridge.codec;

/**
 * Indicates that the native Opus library could not be linked into the
 * process, so the native bridge cannot be constructed.
 */
public final class OpusLibraryUnavailableException extends RuntimeException
{
    public OpusLibraryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
