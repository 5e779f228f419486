package com.questrail.opusbridge.internal;

import java.util.concurrent.atomic.AtomicLong;

/**
 * HandleSequence
 * =============================================================================
 * Process-wide source of handle tokens.
 *
 * <p>Every token issued in the process is distinct, whichever bridge or
 * registry asks for it. A token presented to the wrong registry, or to a
 * different bridge instance, therefore never aliases a live resource and
 * simply fails lookup.</p>
 *
 * <p>Tokens start at 1 and are never {@code 0}, the failure sentinel. A
 * destroyed token is never reissued.</p>
 */
public final class HandleSequence
{
    /** The sequence shared by all bridges in the process. */
    public static final HandleSequence GLOBAL = new HandleSequence();

    private final AtomicLong last = new AtomicLong();

    public long next()
    {
        long token = last.incrementAndGet();
        if (token <= 0) {
            throw new IllegalStateException("Handle token space exhausted");
        }
        return token;
    }
}
