package com.questrail.opusbridge.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Production implementation of OpusBridgeObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jOpusBridgeObservabilitySink implements OpusBridgeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jOpusBridgeObservabilitySink.class);

    @Override
    public void onHandleLifecycle(HandleLifecycleEvent event) {
        switch (event.action()) {
            case CREATED -> log.info("Opus {} created: handle={} ({})",
                kindName(event), event.handle(), event.detail());
            case CREATE_FAILED -> log.error("Opus {} creation failed: error={} ({})",
                kindName(event), event.errorCode(), event.detail());
            case DESTROYED -> log.info("Opus {} destroyed: handle={}",
                kindName(event), event.handle());
            case RECLAIMED -> log.warn("Opus {} leaked by caller, reclaimed at close: handle={} ({})",
                kindName(event), event.handle(), event.detail());
        }
    }

    @Override
    public void onCallRejected(CallRejectedEvent event) {
        log.warn("{} rejected: handle={} status={} ({})",
            event.operation().methodName(),
            event.handle(),
            event.status(),
            event.reason());
    }

    @Override
    public void onCodecError(CodecErrorEvent event) {
        log.error("{} failed in codec: handle={} error={} ({})",
            event.operation().methodName(),
            event.handle(),
            event.errorCode(),
            event.description());
    }

    @Override
    public void onStubCall(StubCallEvent event) {
        log.info("{} called on unimplemented Opus bridge", event.operation().methodName());
    }

    static String kindName(HandleLifecycleEvent event) {
        return event.kind().name().toLowerCase(Locale.ROOT);
    }
}
