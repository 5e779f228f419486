package com.questrail.opusbridge.observability;

import com.questrail.opusbridge.api.BridgeOperation;

import java.time.Instant;

/**
 * Record of an operation invoked on the unimplemented bridge.
 */
public record StubCallEvent(
    Instant timestamp,
    BridgeOperation operation
) {
}
