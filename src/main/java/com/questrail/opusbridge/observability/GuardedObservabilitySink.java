package com.questrail.opusbridge.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Decorator that keeps a misbehaving sink from failing bridge operations.
 *
 * <p>Any {@link RuntimeException} thrown by the delegate is logged at WARN and
 * the event is dropped. Errors ({@link Error}) are not intercepted.</p>
 */
public final class GuardedObservabilitySink implements OpusBridgeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(GuardedObservabilitySink.class);

    private final OpusBridgeObservabilitySink delegate;

    private GuardedObservabilitySink(OpusBridgeObservabilitySink delegate) {
        this.delegate = delegate;
    }

    /**
     * Wraps {@code sink}, unless it is already guarded or is the null sink.
     */
    public static OpusBridgeObservabilitySink guard(OpusBridgeObservabilitySink sink) {
        Objects.requireNonNull(sink, "sink");
        if (sink instanceof GuardedObservabilitySink || sink instanceof NullObservabilitySink) {
            return sink;
        }
        return new GuardedObservabilitySink(sink);
    }

    @Override
    public void onHandleLifecycle(HandleLifecycleEvent event) {
        try {
            delegate.onHandleLifecycle(event);
        } catch (RuntimeException e) {
            dropped(event, e);
        }
    }

    @Override
    public void onCallRejected(CallRejectedEvent event) {
        try {
            delegate.onCallRejected(event);
        } catch (RuntimeException e) {
            dropped(event, e);
        }
    }

    @Override
    public void onCodecError(CodecErrorEvent event) {
        try {
            delegate.onCodecError(event);
        } catch (RuntimeException e) {
            dropped(event, e);
        }
    }

    @Override
    public void onStubCall(StubCallEvent event) {
        try {
            delegate.onStubCall(event);
        } catch (RuntimeException e) {
            dropped(event, e);
        }
    }

    private void dropped(Object event, RuntimeException e) {
        log.warn("Observability sink {} failed, dropping {}", delegate.getClass().getName(), event, e);
    }
}
