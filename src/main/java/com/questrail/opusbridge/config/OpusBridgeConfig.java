package com.questrail.opusbridge.config;

import com.questrail.opusbridge.internal.time.SystemWallClock;
import com.questrail.opusbridge.internal.time.WallClock;
import com.questrail.opusbridge.observability.OpusBridgeObservabilitySink;
import com.questrail.opusbridge.observability.Slf4jOpusBridgeObservabilitySink;

import java.util.Objects;

/**
 * Aggregated configuration for an Opus bridge.
 *
 * <ul>
 *   <li><b>libraryName</b>: native library to link, {@code "opus"} by default</li>
 *   <li><b>parameterPolicy</b>: {@link ParameterPolicy#FORWARD} by default</li>
 *   <li><b>observabilitySink</b>: diagnostics target, SLF4J logging by default;
 *       pass {@code NullObservabilitySink.INSTANCE} to silence it</li>
 *   <li><b>wallClock</b>: timestamps for diagnostics</li>
 * </ul>
 */
public record OpusBridgeConfig(
    String libraryName,
    ParameterPolicy parameterPolicy,
    OpusBridgeObservabilitySink observabilitySink,
    WallClock wallClock
) {
    public static final String DEFAULT_LIBRARY_NAME = "opus";

    public OpusBridgeConfig {
        Objects.requireNonNull(libraryName, "libraryName");
        Objects.requireNonNull(parameterPolicy, "parameterPolicy");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(wallClock, "wallClock");
        if (libraryName.isBlank()) {
            throw new IllegalArgumentException("libraryName must not be blank");
        }
    }

    public static OpusBridgeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String libraryName = DEFAULT_LIBRARY_NAME;
        private ParameterPolicy parameterPolicy = ParameterPolicy.FORWARD;
        private OpusBridgeObservabilitySink observabilitySink = new Slf4jOpusBridgeObservabilitySink();
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withLibraryName(String libraryName) {
            this.libraryName = libraryName;
            return this;
        }

        public Builder withParameterPolicy(ParameterPolicy parameterPolicy) {
            this.parameterPolicy = parameterPolicy;
            return this;
        }

        public Builder withObservabilitySink(OpusBridgeObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public OpusBridgeConfig build() {
            return new OpusBridgeConfig(libraryName, parameterPolicy, observabilitySink, wallClock);
        }
    }
}
