package com.questrail.opusbridge.observability;

/**
 * Receives diagnostic events from an {@code OpusBridge}.
 * Implementations can provide logging, metrics, or test recording.
 *
 * <p>Delivery is best-effort. Bridges wrap the configured sink in a
 * {@link GuardedObservabilitySink}, so an exception thrown here is logged and
 * never changes the outcome of the bridge call that produced the event.</p>
 */
public interface OpusBridgeObservabilitySink {
    /**
     * Called when a handle is created, fails to be created, is destroyed, or
     * is reclaimed at shutdown.
     * @param event the lifecycle event
     */
    void onHandleLifecycle(HandleLifecycleEvent event);

    /**
     * Called when a call is refused before reaching the codec
     * (precondition violation or invalid handle).
     * @param event the rejection details
     */
    void onCallRejected(CallRejectedEvent event);

    /**
     * Called when the codec itself reports a negative result.
     * @param event the codec error
     */
    void onCodecError(CodecErrorEvent event);

    /**
     * Called for every operation invoked on the unimplemented bridge.
     * @param event the stub call
     */
    void onStubCall(StubCallEvent event);
}
