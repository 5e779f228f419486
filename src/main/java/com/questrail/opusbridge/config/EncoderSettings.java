package com.questrail.opusbridge.config;

/**
 * Creation parameters of one encoder, fixed for the lifetime of its handle.
 *
 * <p>No range validation happens here: under {@link ParameterPolicy#FORWARD}
 * out-of-range values must still reach the codec. Use
 * {@link OpusParameterRules#checkEncoder(EncoderSettings)} to validate.</p>
 */
public record EncoderSettings(
    int sampleRateHz,
    int channels,
    int complexity,
    int bitrate
) {
    public String describe() {
        return sampleRateHz + "Hz, " + channels + "ch, complexity " + complexity + ", bitrate " + bitrate;
    }
}
