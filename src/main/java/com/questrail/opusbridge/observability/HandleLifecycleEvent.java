package com.questrail.opusbridge.observability;

import com.questrail.opusbridge.api.HandleKind;

import java.time.Instant;
import java.util.Objects;

/**
 * Record describing a change in the life of a codec handle.
 *
 * <p>{@code handle} is {@code 0} for {@link Action#CREATE_FAILED}.
 * {@code errorCode} is the codec's error code for a failed creation and
 * {@code 0} otherwise.</p>
 */
public record HandleLifecycleEvent(
    Instant timestamp,
    HandleKind kind,
    long handle,
    Action action,
    String detail,
    int errorCode
) {
    public HandleLifecycleEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(detail, "detail");
    }

    public enum Action {
        CREATED,
        CREATE_FAILED,
        DESTROYED,
        /** Released by the bridge at shutdown because the caller never destroyed it. */
        RECLAIMED
    }

    public static HandleLifecycleEvent created(Instant timestamp, HandleKind kind, long handle, String detail) {
        return new HandleLifecycleEvent(timestamp, kind, handle, Action.CREATED, detail, 0);
    }

    public static HandleLifecycleEvent createFailed(Instant timestamp, HandleKind kind, int errorCode, String detail) {
        return new HandleLifecycleEvent(timestamp, kind, 0L, Action.CREATE_FAILED, detail, errorCode);
    }

    public static HandleLifecycleEvent destroyed(Instant timestamp, HandleKind kind, long handle) {
        return new HandleLifecycleEvent(timestamp, kind, handle, Action.DESTROYED, "", 0);
    }

    public static HandleLifecycleEvent reclaimed(Instant timestamp, HandleKind kind, long handle, String detail) {
        return new HandleLifecycleEvent(timestamp, kind, handle, Action.RECLAIMED, detail, 0);
    }
}
