package com.questrail.opusbridge.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Timestamp source for bridge diagnostics.
 *
 * <p>
 * Only diagnostic events are stamped with this clock. No bridge behaviour
 * depends on the time it reports, so tests may substitute a fixed clock.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
