package com.questrail.opusbridge.session;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * Conversions between 16-bit little-endian PCM bytes and samples.
 */
public final class PcmConversions {
    private PcmConversions() {}

    /**
     * Reads {@code pcm.length / 2} samples. A trailing odd byte is ignored.
     */
    public static short[] toShorts(byte[] pcm) {
        Objects.requireNonNull(pcm, "pcm");
        ByteBuffer buffer = ByteBuffer.wrap(pcm).order(ByteOrder.LITTLE_ENDIAN);
        short[] samples = new short[pcm.length / 2];
        buffer.asShortBuffer().get(samples);
        return samples;
    }

    public static byte[] toBytes(short[] samples) {
        Objects.requireNonNull(samples, "samples");
        ByteBuffer buffer = ByteBuffer.allocate(samples.length * 2).order(ByteOrder.LITTLE_ENDIAN);
        buffer.asShortBuffer().put(samples);
        return buffer.array();
    }
}
