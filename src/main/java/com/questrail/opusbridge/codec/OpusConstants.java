package com.questrail.opusbridge.codec;

/**
 * OpusConstants
 * -----------------------------------------------------------------------------
 * Numeric values from {@code opus_defines.h} needed by the bridge.
 *
 * <p>The {@code opus_encoder_ctl} macros ({@code OPUS_SET_VBR(x)} etc.) expand
 * to a request id followed by one argument; the ids below are those request
 * ids. They are part of the libopus ABI and do not change between releases.</p>
 */
public final class OpusConstants
{
    public static final int OPUS_OK = 0;

    // Applications
    public static final int OPUS_APPLICATION_VOIP = 2048;
    public static final int OPUS_APPLICATION_AUDIO = 2049;
    public static final int OPUS_APPLICATION_RESTRICTED_LOWDELAY = 2051;

    // Signal hints
    public static final int OPUS_SIGNAL_VOICE = 3001;
    public static final int OPUS_SIGNAL_MUSIC = 3002;

    // Encoder ctl requests (setters)
    public static final int OPUS_SET_BITRATE_REQUEST = 4002;
    public static final int OPUS_SET_VBR_REQUEST = 4006;
    public static final int OPUS_SET_COMPLEXITY_REQUEST = 4010;
    public static final int OPUS_SET_INBAND_FEC_REQUEST = 4012;
    public static final int OPUS_SET_PACKET_LOSS_PERC_REQUEST = 4014;
    public static final int OPUS_SET_DTX_REQUEST = 4016;
    public static final int OPUS_SET_VBR_CONSTRAINT_REQUEST = 4020;
    public static final int OPUS_SET_SIGNAL_REQUEST = 4024;
    public static final int OPUS_SET_LSB_DEPTH_REQUEST = 4036;

    private OpusConstants() {}
}
