/**
 * Buffer Marshaling: managed arrays to native memory
 * =============================================================================
 *
 * <p>This package moves caller-owned {@code short[]} and {@code byte[]}
 * buffers into native memory for the duration of a single codec call and
 * back again.</p>
 *
 * <pre>
 *   short[] / byte[]  (caller owned)
 *        → NativeBufferPool.lease...   (direct ByteBuf allocated, input copied in)
 *            → NativeLease.pointer()   (passed to the codec)
 *        ← lease.commit(n)             (output copied back, success only)
 *        ← lease.close()               (ByteBuf released, always)
 * </pre>
 *
 * <h2>Guaranteed release</h2>
 * <p>Every lease is an {@link java.lang.AutoCloseable}. Callers acquire leases
 * in a try-with-resources statement so that release runs on every exit path,
 * including an exception thrown while a second lease is being acquired.
 * {@link com.questrail.opusbridge.memory.NativeBufferPool#outstandingLeases()}
 * exposes the number of unreleased leases so tests can assert it returns to
 * zero.</p>
 *
 * <h2>Netty containment rule</h2>
 * <p>Netty types ({@code ByteBuf}, {@code ByteBufAllocator}) do not escape this
 * package. Consumers only see JNA {@link com.sun.jna.Pointer}s.</p>
 *
 * <h2>Commit semantics</h2>
 * <p>Nothing is copied back into a managed array unless
 * {@code commit(n)} is called, so a failed codec call leaves the caller's
 * output buffer exactly as it was.</p>
 */
package com.questrail.opusbridge.memory;
