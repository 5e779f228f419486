package com.questrail.opusbridge.observability;

/**
 * No-op implementation of OpusBridgeObservabilitySink.
 */
public final class NullObservabilitySink implements OpusBridgeObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onHandleLifecycle(HandleLifecycleEvent event) {}

    @Override
    public void onCallRejected(CallRejectedEvent event) {}

    @Override
    public void onCodecError(CodecErrorEvent event) {}

    @Override
    public void onStubCall(StubCallEvent event) {}
}
