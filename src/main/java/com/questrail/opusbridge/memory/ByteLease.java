package com.questrail.opusbridge.memory;

import io.netty.buffer.ByteBuf;

/**
 * Lease over the first {@code count} bytes of a {@code byte[]}.
 */
public final class ByteLease extends NativeLease
{
    private final byte[] array;
    private final int count;

    ByteLease(NativeBufferPool pool, ByteBuf buffer, byte[] array, int count)
    {
        super(pool, buffer);
        this.array = array;
        this.count = count;
    }

    /**
     * Number of bytes covered by the lease.
     */
    public int count()
    {
        return count;
    }

    /**
     * Copies the first {@code bytes} bytes of native memory back into the
     * managed array.
     */
    public void commit(int bytes)
    {
        if (bytes < 0 || bytes > count) {
            throw new IllegalArgumentException("Cannot commit " + bytes + " of " + count + " bytes");
        }
        buffer().getBytes(0, array, 0, bytes);
    }

    void copyIn()
    {
        buffer().setBytes(0, array, 0, count);
    }
}
