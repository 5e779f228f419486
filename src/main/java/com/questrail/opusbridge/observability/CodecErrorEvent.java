package com.questrail.opusbridge.observability;

import com.questrail.opusbridge.api.BridgeOperation;
import com.questrail.opusbridge.api.OpusError;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a negative result reported by the codec itself.
 *
 * @param errorCode   the raw code, also returned to the caller unchanged
 * @param description the codec's own wording for the code
 */
public record CodecErrorEvent(
    Instant timestamp,
    BridgeOperation operation,
    long handle,
    int errorCode,
    String description
) {
    public CodecErrorEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(description, "description");
    }

    public OpusError error() {
        return OpusError.fromCode(errorCode);
    }
}
