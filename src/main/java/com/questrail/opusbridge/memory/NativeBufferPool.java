package com.questrail.opusbridge.memory;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.PooledByteBufAllocator;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * NativeBufferPool
 * =============================================================================
 * Issues {@link NativeLease}s backed by direct Netty buffers.
 *
 * <h2>Input and output leases</h2>
 * <ul>
 *   <li>{@code leaseSamples} / {@code leaseBytes} copy the managed contents in;
 *       the codec reads them.</li>
 *   <li>{@code leaseSampleOutput} / {@code leaseByteOutput} start zeroed; the
 *       codec writes them and the caller commits what it wants back.</li>
 * </ul>
 *
 * <h2>Accounting</h2>
 * <p>The pool counts leases that were acquired and not yet closed. The count
 * is global to the pool and safe to read from any thread.</p>
 */
public final class NativeBufferPool
{
    private final ByteBufAllocator allocator;
    private final AtomicInteger outstanding = new AtomicInteger();

    public NativeBufferPool(ByteBufAllocator allocator)
    {
        this.allocator = Objects.requireNonNull(allocator, "allocator");
    }

    /**
     * A pool over Netty's shared pooled allocator.
     */
    public static NativeBufferPool pooled()
    {
        return new NativeBufferPool(PooledByteBufAllocator.DEFAULT);
    }

    public SampleLease leaseSamples(short[] source, int count)
    {
        SampleLease lease = acquire(source.length, count, Short.BYTES,
                buf -> new SampleLease(this, buf, source, count));
        lease.copyIn();
        return lease;
    }

    public SampleLease leaseSampleOutput(short[] target, int count)
    {
        return acquire(target.length, count, Short.BYTES,
                buf -> new SampleLease(this, buf, target, count));
    }

    public ByteLease leaseBytes(byte[] source, int count)
    {
        ByteLease lease = acquire(source.length, count, Byte.BYTES,
                buf -> new ByteLease(this, buf, source, count));
        lease.copyIn();
        return lease;
    }

    public ByteLease leaseByteOutput(byte[] target, int count)
    {
        return acquire(target.length, count, Byte.BYTES,
                buf -> new ByteLease(this, buf, target, count));
    }

    /**
     * Number of leases acquired from this pool and not yet closed.
     */
    public int outstandingLeases()
    {
        return outstanding.get();
    }

    void leaseReleased()
    {
        outstanding.decrementAndGet();
    }

    private <L extends NativeLease> L acquire(int arrayLength, int count, int elementBytes, Function<ByteBuf, L> factory)
    {
        if (count <= 0 || count > arrayLength) {
            throw new IllegalArgumentException(
                    "Lease of " + count + " elements over an array of " + arrayLength);
        }
        int size = Math.multiplyExact(count, elementBytes);
        ByteBuf buf = allocator.directBuffer(size, size);
        final L lease;
        try {
            buf.setZero(0, size);
            lease = factory.apply(buf);
        }
        catch (RuntimeException | Error e) {
            buf.release();
            throw e;
        }
        outstanding.incrementAndGet();
        return lease;
    }
}
