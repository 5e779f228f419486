package com.questrail.opusbridge.api;

/**
 * OpusBridge
 * -----------------------------------------------------------------------------
 * Opaque-handle call surface over an Opus codec.
 *
 * <p>This interface is the single seam between managed callers and whatever
 * codec is linked underneath. Two implementations exist and expose exactly
 * the same signatures and sentinel conventions:</p>
 * <ul>
 *   <li>the native bridge, backed by libopus</li>
 *   <li>the unimplemented bridge, which performs no codec work at all</li>
 * </ul>
 * Callers must not be able to tell which one they hold other than by the
 * results they observe.
 *
 * <h2>Handles</h2>
 * <p>A handle is a {@code long} token. {@link BridgeStatus#NO_HANDLE} ({@code 0})
 * is never a valid handle and is returned on any creation failure. A handle is
 * valid from the return of a successful create call until the matching destroy
 * call. Encoder and decoder handles are not interchangeable: presenting one
 * where the other is expected is a caller contract violation.</p>
 *
 * <h2>Error conventions</h2>
 * <ul>
 *   <li>creation failure: {@link BridgeStatus#NO_HANDLE}</li>
 *   <li>precondition violation (null handle or buffer, insufficient length):
 *       {@link BridgeStatus#PRECONDITION_FAILED}, detected before any native
 *       memory is touched</li>
 *   <li>stale or unknown handle: {@link BridgeStatus#INVALID_HANDLE}</li>
 *   <li>codec failure: the codec's own negative code, unchanged
 *       (see {@link OpusError})</li>
 * </ul>
 * No operation throws for these conditions. On any failure the output buffer
 * content is unspecified and must not be inspected.
 *
 * <h2>Threading</h2>
 * <p>Every operation runs to completion on the caller's thread. A single
 * handle must not be used from two threads at once without external
 * synchronization; distinct handles are fully independent. Buffers passed to
 * a call are leased exclusively to the bridge for the duration of that call.</p>
 */
public interface OpusBridge extends AutoCloseable
{
    /**
     * Creates an encoder tuned for voice.
     *
     * @param sampleRateHz one of 8000, 12000, 16000, 24000, 48000
     * @param channels     1 (mono) or 2 (stereo)
     * @param complexity   0..10
     * @param bitrate      target bits per second, positive
     * @return a live encoder handle, or {@link BridgeStatus#NO_HANDLE} on failure
     */
    long createEncoder(int sampleRateHz, int channels, int complexity, int bitrate);

    /**
     * Creates a decoder.
     *
     * @return a live decoder handle, or {@link BridgeStatus#NO_HANDLE} on failure
     */
    long createDecoder(int sampleRateHz, int channels);

    /**
     * Compresses exactly {@code frameSize} samples per channel from
     * {@code inputSamples} into {@code outputBytes}.
     *
     * <p>Interleaved input must hold at least {@code frameSize * channels}
     * samples. The packet is capped at {@code outputBytes.length}.</p>
     *
     * @return bytes written ({@code >= 0}), or a negative status
     */
    int encode(long encoderHandle, short[] inputSamples, int frameSize, byte[] outputBytes);

    /**
     * Decompresses the first {@code byteLength} bytes of {@code inputBytes}
     * into at most {@code frameSize} samples per channel. In-band FEC decoding
     * is never requested.
     *
     * @return samples written per channel ({@code >= 0}), or a negative status
     */
    int decode(long decoderHandle, byte[] inputBytes, int byteLength, short[] outputSamples, int frameSize);

    /**
     * Releases an encoder. A {@link BridgeStatus#NO_HANDLE} argument is a no-op.
     * The handle must not be used afterwards.
     */
    void destroyEncoder(long encoderHandle);

    /**
     * Releases a decoder. A {@link BridgeStatus#NO_HANDLE} argument is a no-op.
     * The handle must not be used afterwards.
     */
    void destroyDecoder(long decoderHandle);

    /**
     * Returns the linked codec's version identifier. Never empty.
     */
    String getVersion();

    /**
     * Returns the native footprint in bytes of an encoder with the given
     * channel count, or an implementation-defined value (usually {@code 0})
     * for unsupported channel counts.
     */
    int getEncoderSize(int channels);

    /**
     * Returns the native footprint in bytes of a decoder with the given
     * channel count, or an implementation-defined value (usually {@code 0})
     * for unsupported channel counts.
     */
    int getDecoderSize(int channels);

    /**
     * Releases every handle the caller failed to destroy.
     *
     * <p>This is a safety net for shutdown, not part of the per-handle
     * contract: each reclaimed handle is reported as a leak.</p>
     */
    @Override
    void close();
}
