package com.questrail.opusbridge.config;

import java.util.List;
import java.util.Optional;

/**
 * OpusParameterRules
 * -----------------------------------------------------------------------------
 * The parameter ranges libopus documents for encoder and decoder creation.
 *
 * <p>Used by bridges running under {@link ParameterPolicy#FAIL_FAST}. Each
 * check returns the first violation found, or {@link Optional#empty()} if the
 * settings are acceptable.</p>
 */
public final class OpusParameterRules {
    private static final List<Integer> SUPPORTED_SAMPLE_RATES = List.of(8000, 12000, 16000, 24000, 48000);
    public static final int MIN_CHANNELS = 1;
    public static final int MAX_CHANNELS = 2;
    public static final int MIN_COMPLEXITY = 0;
    public static final int MAX_COMPLEXITY = 10;

    private OpusParameterRules() {}

    /**
     * Sample rates libopus accepts, ascending. The returned list is unmodifiable.
     */
    public static List<Integer> supportedSampleRates() {
        return SUPPORTED_SAMPLE_RATES;
    }

    public static boolean isSupportedSampleRate(int sampleRateHz) {
        return SUPPORTED_SAMPLE_RATES.contains(sampleRateHz);
    }

    public static Optional<String> checkEncoder(EncoderSettings settings) {
        Optional<String> common = checkCommon(settings.sampleRateHz(), settings.channels());
        if (common.isPresent()) {
            return common;
        }
        if (settings.complexity() < MIN_COMPLEXITY || settings.complexity() > MAX_COMPLEXITY) {
            return Optional.of("complexity " + settings.complexity() + " outside "
                + MIN_COMPLEXITY + ".." + MAX_COMPLEXITY);
        }
        if (settings.bitrate() <= 0) {
            return Optional.of("bitrate " + settings.bitrate() + " must be positive");
        }
        return Optional.empty();
    }

    public static Optional<String> checkDecoder(DecoderSettings settings) {
        return checkCommon(settings.sampleRateHz(), settings.channels());
    }

    private static Optional<String> checkCommon(int sampleRateHz, int channels) {
        if (!isSupportedSampleRate(sampleRateHz)) {
            return Optional.of("unsupported sample rate " + sampleRateHz + "Hz");
        }
        if (channels < MIN_CHANNELS || channels > MAX_CHANNELS) {
            return Optional.of("unsupported channel count " + channels);
        }
        return Optional.empty();
    }
}
