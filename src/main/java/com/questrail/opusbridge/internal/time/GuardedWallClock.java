package com.questrail.opusbridge.internal.time;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;

/**
 * {@link WallClock} decorator that never throws.
 *
 * <p>A {@link RuntimeException} from the delegate is logged at WARN and
 * {@link Instant#EPOCH} is returned in place of the reading. A null reading
 * is replaced the same way.</p>
 */
public final class GuardedWallClock implements WallClock {
    private static final Logger log = LoggerFactory.getLogger(GuardedWallClock.class);

    private final WallClock delegate;

    private GuardedWallClock(WallClock delegate) {
        this.delegate = delegate;
    }

    /**
     * Wraps {@code clock}, unless it is already guarded or is the system clock.
     */
    public static WallClock guard(WallClock clock) {
        Objects.requireNonNull(clock, "clock");
        if (clock instanceof GuardedWallClock || clock instanceof SystemWallClock) {
            return clock;
        }
        return new GuardedWallClock(clock);
    }

    @Override
    public Instant now() {
        try {
            Instant now = delegate.now();
            return now != null ? now : Instant.EPOCH;
        } catch (RuntimeException e) {
            log.warn("Wall clock {} failed, stamping event with epoch", delegate.getClass().getName(), e);
            return Instant.EPOCH;
        }
    }
}
