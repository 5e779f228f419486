package com.questrail.opusbridge.observability;

import com.questrail.opusbridge.api.BridgeOperation;
import com.questrail.opusbridge.api.BridgeStatus;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a call the bridge refused before any native call.
 *
 * @param status the value returned to the caller
 *               ({@link BridgeStatus#PRECONDITION_FAILED} or
 *               {@link BridgeStatus#INVALID_HANDLE})
 * @param reason human-readable description of the mismatch
 */
public record CallRejectedEvent(
    Instant timestamp,
    BridgeOperation operation,
    long handle,
    int status,
    String reason
) {
    public CallRejectedEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(reason, "reason");
    }

    public boolean isInvalidHandle() {
        return status == BridgeStatus.INVALID_HANDLE;
    }
}
