package com.questrail.opusbridge.memory;

import io.netty.buffer.ByteBuf;

/**
 * Lease over the first {@code count} 16-bit samples of a {@code short[]}.
 *
 * <p>Samples are laid out in native byte order, as libopus expects
 * {@code opus_int16} values.</p>
 */
public final class SampleLease extends NativeLease
{
    private final short[] array;
    private final int count;

    SampleLease(NativeBufferPool pool, ByteBuf buffer, short[] array, int count)
    {
        super(pool, buffer);
        this.array = array;
        this.count = count;
    }

    /**
     * Number of samples covered by the lease.
     */
    public int count()
    {
        return count;
    }

    /**
     * Copies the first {@code samples} samples of native memory back into the
     * managed array.
     */
    public void commit(int samples)
    {
        if (samples < 0 || samples > count) {
            throw new IllegalArgumentException("Cannot commit " + samples + " of " + count + " samples");
        }
        ByteBuf buf = buffer();
        for (int i = 0; i < samples; i++) {
            array[i] = NATIVE_LITTLE_ENDIAN ? buf.getShortLE(i * 2) : buf.getShort(i * 2);
        }
    }

    void copyIn()
    {
        ByteBuf buf = buffer();
        for (int i = 0; i < count; i++) {
            if (NATIVE_LITTLE_ENDIAN) {
                buf.setShortLE(i * 2, array[i]);
            }
            else {
                buf.setShort(i * 2, array[i]);
            }
        }
    }
}
