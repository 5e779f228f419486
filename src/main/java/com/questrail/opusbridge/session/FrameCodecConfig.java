package com.questrail.opusbridge.session;

import com.questrail.opusbridge.config.OpusParameterRules;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * FrameCodecConfig
 * -----------------------------------------------------------------------------
 * Fixed stream parameters of an {@link OpusFrameCodec}.
 *
 * <p>Defaults: 16 kHz mono, 960-sample frames (60 ms), 32 kbps, complexity 8.</p>
 *
 * <p>Construction does not validate; {@link #validate()} reports the first
 * problem so that {@link OpusFrameCodec#open()} can refuse to start.</p>
 */
public record FrameCodecConfig(
    int sampleRateHz,
    int channels,
    int frameSize,
    int bitrate,
    int complexity
) {
    public static final int MIN_BITRATE = 6_000;
    public static final int MAX_BITRATE = 510_000;

    /** Accepted samples-per-channel frame sizes (10, 20, 40 and 60 ms) for each sample rate. */
    public static final Map<Integer, List<Integer>> SUPPORTED_FRAME_SIZES = Map.of(
        8000, List.of(80, 160, 320, 480),
        12000, List.of(120, 240, 480, 720),
        16000, List.of(160, 320, 640, 960),
        24000, List.of(240, 480, 960, 1440),
        48000, List.of(480, 960, 1920, 2880)
    );

    public static FrameCodecConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Samples in one interleaved frame.
     */
    public int samplesPerFrame() {
        return frameSize * channels;
    }

    public Optional<String> validate() {
        if (!OpusParameterRules.isSupportedSampleRate(sampleRateHz)) {
            return Optional.of("unsupported sample rate " + sampleRateHz + "Hz");
        }
        if (channels < OpusParameterRules.MIN_CHANNELS || channels > OpusParameterRules.MAX_CHANNELS) {
            return Optional.of("unsupported channel count " + channels);
        }
        if (!SUPPORTED_FRAME_SIZES.getOrDefault(sampleRateHz, List.of()).contains(frameSize)) {
            return Optional.of("unsupported frame size " + frameSize + " at " + sampleRateHz + "Hz");
        }
        if (bitrate < MIN_BITRATE || bitrate > MAX_BITRATE) {
            return Optional.of("bitrate " + bitrate + " outside " + MIN_BITRATE + ".." + MAX_BITRATE);
        }
        return Optional.empty();
    }

    public static final class Builder {
        private int sampleRateHz = 16000;
        private int channels = 1;
        private int frameSize = 960;
        private int bitrate = 32_000;
        private int complexity = 8;

        public Builder withSampleRate(int sampleRateHz) {
            this.sampleRateHz = sampleRateHz;
            return this;
        }

        public Builder withChannels(int channels) {
            this.channels = channels;
            return this;
        }

        public Builder withFrameSize(int frameSize) {
            this.frameSize = frameSize;
            return this;
        }

        public Builder withBitrate(int bitrate) {
            this.bitrate = bitrate;
            return this;
        }

        public Builder withComplexity(int complexity) {
            this.complexity = complexity;
            return this;
        }

        public FrameCodecConfig build() {
            return new FrameCodecConfig(sampleRateHz, channels, frameSize, bitrate, complexity);
        }
    }
}
