package com.questrail.opusbridge.memory;

import com.sun.jna.Native;
import com.sun.jna.Pointer;
import io.netty.buffer.ByteBuf;

import java.nio.ByteOrder;

/**
 * NativeLease
 * -----------------------------------------------------------------------------
 * Exclusive, scoped access to a block of native memory mirroring part of a
 * managed array.
 *
 * <p>A lease is held from acquisition until {@link #close()}. Closing is
 * idempotent; only the first call releases the backing buffer. Using
 * {@link #pointer()} after close is a programming error.</p>
 *
 * <p>Leases are confined to the thread that acquired them.</p>
 */
public abstract class NativeLease implements AutoCloseable
{
    static final boolean NATIVE_LITTLE_ENDIAN = ByteOrder.nativeOrder() == ByteOrder.LITTLE_ENDIAN;

    private final NativeBufferPool pool;
    private final ByteBuf buffer;
    private final Pointer pointer;
    private boolean released;

    NativeLease(NativeBufferPool pool, ByteBuf buffer)
    {
        this.pool = pool;
        this.buffer = buffer;
        this.pointer = Native.getDirectBufferPointer(buffer.nioBuffer(0, buffer.capacity()));
    }

    /**
     * Native address of the leased block, valid until {@link #close()}.
     */
    public final Pointer pointer()
    {
        requireHeld();
        return pointer;
    }

    public final boolean isReleased()
    {
        return released;
    }

    final ByteBuf buffer()
    {
        requireHeld();
        return buffer;
    }

    @Override
    public final void close()
    {
        if (released) {
            return;
        }
        released = true;
        try {
            buffer.release();
        }
        finally {
            pool.leaseReleased();
        }
    }

    private void requireHeld()
    {
        if (released) {
            throw new IllegalStateException("Native lease used after release");
        }
    }
}
