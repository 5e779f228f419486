package com.questrail.opusbridge.config;

import com.questrail.opusbridge.codec.OpusConstants;

import java.util.List;
import java.util.Objects;

/**
 * EncoderPolicy
 * -----------------------------------------------------------------------------
 * The fixed configuration every bridge encoder receives right after creation.
 *
 * <p>Callers choose only sample rate, channel count, complexity and bitrate
 * (see {@link EncoderSettings}). Everything else is policy:</p>
 * <ul>
 *   <li>VOIP application</li>
 *   <li>constant bit-rate, with the VBR constraint enabled</li>
 *   <li>voice signal hint, 16-bit sample depth</li>
 *   <li>DTX, in-band FEC and the packet-loss hint all off</li>
 * </ul>
 *
 * <p>The policy is expressed as an ordered list of {@code opus_encoder_ctl}
 * requests so that it is applied, and verified in tests, in one place.</p>
 */
public record EncoderPolicy(
    int application,
    boolean variableBitrate,
    boolean constrainedVbr,
    int signal,
    int lsbDepth,
    boolean dtx,
    boolean inbandFec,
    int packetLossPercent
) {
    /** The policy used by the native bridge. */
    public static final EncoderPolicy VOICE_CBR = new EncoderPolicy(
        OpusConstants.OPUS_APPLICATION_VOIP,
        false,
        true,
        OpusConstants.OPUS_SIGNAL_VOICE,
        16,
        false,
        false,
        0
    );

    /**
     * One {@code opus_encoder_ctl(st, request, value)} call.
     */
    public record CtlRequest(String name, int request, int value) {
        public CtlRequest {
            Objects.requireNonNull(name, "name");
        }
    }

    /**
     * Returns the ctl calls that configure an encoder created with
     * {@code settings}, in the order they must be applied.
     */
    public List<CtlRequest> ctlRequests(EncoderSettings settings) {
        Objects.requireNonNull(settings, "settings");
        return List.of(
            new CtlRequest("VBR", OpusConstants.OPUS_SET_VBR_REQUEST, flag(variableBitrate)),
            new CtlRequest("VBR_CONSTRAINT", OpusConstants.OPUS_SET_VBR_CONSTRAINT_REQUEST, flag(constrainedVbr)),
            new CtlRequest("BITRATE", OpusConstants.OPUS_SET_BITRATE_REQUEST, settings.bitrate()),
            new CtlRequest("COMPLEXITY", OpusConstants.OPUS_SET_COMPLEXITY_REQUEST, settings.complexity()),
            new CtlRequest("SIGNAL", OpusConstants.OPUS_SET_SIGNAL_REQUEST, signal),
            new CtlRequest("LSB_DEPTH", OpusConstants.OPUS_SET_LSB_DEPTH_REQUEST, lsbDepth),
            new CtlRequest("DTX", OpusConstants.OPUS_SET_DTX_REQUEST, flag(dtx)),
            new CtlRequest("INBAND_FEC", OpusConstants.OPUS_SET_INBAND_FEC_REQUEST, flag(inbandFec)),
            new CtlRequest("PACKET_LOSS_PERC", OpusConstants.OPUS_SET_PACKET_LOSS_PERC_REQUEST, packetLossPercent)
        );
    }

    private static int flag(boolean enabled) {
        return enabled ? 1 : 0;
    }
}
