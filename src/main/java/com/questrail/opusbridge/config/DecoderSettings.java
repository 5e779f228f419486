package com.questrail.opusbridge.config;

/**
 * Creation parameters of one decoder, fixed for the lifetime of its handle.
 */
public record DecoderSettings(
    int sampleRateHz,
    int channels
) {
    public String describe() {
        return sampleRateHz + "Hz, " + channels + "ch";
    }
}
