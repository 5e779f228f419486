package com.questrail.opusbridge.bridge;

import com.questrail.opusbridge.api.BridgeOperation;
import com.questrail.opusbridge.api.BridgeStatus;
import com.questrail.opusbridge.api.HandleKind;
import com.questrail.opusbridge.api.OpusBridge;
import com.questrail.opusbridge.api.OpusError;
import com.questrail.opusbridge.codec.OpusConstants;
import com.questrail.opusbridge.codec.OpusLibrary;
import com.questrail.opusbridge.config.DecoderSettings;
import com.questrail.opusbridge.config.EncoderPolicy;
import com.questrail.opusbridge.config.EncoderSettings;
import com.questrail.opusbridge.config.OpusBridgeConfig;
import com.questrail.opusbridge.config.OpusParameterRules;
import com.questrail.opusbridge.config.ParameterPolicy;
import com.questrail.opusbridge.internal.HandleRegistry;
import com.questrail.opusbridge.internal.HandleSequence;
import com.questrail.opusbridge.internal.time.GuardedWallClock;
import com.questrail.opusbridge.internal.time.WallClock;
import com.questrail.opusbridge.memory.ByteLease;
import com.questrail.opusbridge.memory.NativeBufferPool;
import com.questrail.opusbridge.memory.SampleLease;
import com.questrail.opusbridge.observability.CallRejectedEvent;
import com.questrail.opusbridge.observability.CodecErrorEvent;
import com.questrail.opusbridge.observability.GuardedObservabilitySink;
import com.questrail.opusbridge.observability.HandleLifecycleEvent;
import com.questrail.opusbridge.observability.OpusBridgeObservabilitySink;
import com.sun.jna.Pointer;
import com.sun.jna.ptr.IntByReference;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * NativeOpusBridge
 * =============================================================================
 * {@link OpusBridge} backed by libopus through an {@link OpusLibrary} binding.
 *
 * <h2>Handles</h2>
 * <p>Native encoder and decoder states never leave this class. Callers receive
 * tokens from two {@link HandleRegistry} tables fed by the process-wide
 * {@link HandleSequence#GLOBAL}, so a token is never reused and a destroyed,
 * unknown or wrong-kind token is answered with
 * {@link BridgeStatus#INVALID_HANDLE}.</p>
 *
 * <h2>Call sequence for encode / decode</h2>
 * <ol>
 *   <li>null handle or buffer: {@link BridgeStatus#PRECONDITION_FAILED}</li>
 *   <li>token lookup: {@link BridgeStatus#INVALID_HANDLE}</li>
 *   <li>length checks against the handle's channel count:
 *       {@link BridgeStatus#PRECONDITION_FAILED}</li>
 *   <li>buffers leased, codec called, output committed on success only,
 *       leases released</li>
 * </ol>
 * Nothing native is touched before step 4.
 *
 * <h2>Diagnostics</h2>
 * <p>Every rejection, codec error and lifecycle change is reported to the
 * configured {@link OpusBridgeObservabilitySink}. The sink and the
 * {@link WallClock} that stamps events are both guarded, so neither can
 * change a result.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Creation and destruction may run concurrently from any thread. A single
 * handle must not be used by two threads at once.</p>
 */
public final class NativeOpusBridge implements OpusBridge
{
    static final String UNKNOWN_VERSION = "libopus (version unavailable)";

    private final OpusLibrary opus;
    private final ParameterPolicy parameterPolicy;
    private final EncoderPolicy encoderPolicy;
    private final OpusBridgeObservabilitySink sink;
    private final WallClock clock;
    private final NativeBufferPool buffers;
    private final HandleRegistry<EncoderState> encoders = new HandleRegistry<>(HandleSequence.GLOBAL);
    private final HandleRegistry<DecoderState> decoders = new HandleRegistry<>(HandleSequence.GLOBAL);

    private record EncoderState(Pointer state, EncoderSettings settings) {}

    private record DecoderState(Pointer state, DecoderSettings settings) {}

    public NativeOpusBridge(OpusLibrary opus, OpusBridgeConfig config)
    {
        this(opus, config, NativeBufferPool.pooled());
    }

    public NativeOpusBridge(OpusLibrary opus, OpusBridgeConfig config, NativeBufferPool buffers)
    {
        this.opus = Objects.requireNonNull(opus, "opus");
        Objects.requireNonNull(config, "config");
        this.parameterPolicy = config.parameterPolicy();
        this.encoderPolicy = EncoderPolicy.VOICE_CBR;
        this.sink = GuardedObservabilitySink.guard(config.observabilitySink());
        this.clock = GuardedWallClock.guard(config.wallClock());
        this.buffers = Objects.requireNonNull(buffers, "buffers");
    }

    // -------------------------------------------------------------------------
    // Encoder session
    // -------------------------------------------------------------------------

    @Override
    public long createEncoder(int sampleRateHz, int channels, int complexity, int bitrate)
    {
        EncoderSettings settings = new EncoderSettings(sampleRateHz, channels, complexity, bitrate);

        if (parameterPolicy == ParameterPolicy.FAIL_FAST) {
            Optional<String> violation = OpusParameterRules.checkEncoder(settings);
            if (violation.isPresent()) {
                return createFailed(HandleKind.ENCODER, OpusError.BAD_ARG.code(),
                        "rejected " + settings.describe() + ": " + violation.get());
            }
        }

        IntByReference error = new IntByReference(OpusConstants.OPUS_OK);
        Pointer state = opus.opus_encoder_create(sampleRateHz, channels, encoderPolicy.application(), error);
        if (state == null || error.getValue() != OpusConstants.OPUS_OK) {
            if (state != null) {
                opus.opus_encoder_destroy(state);
            }
            int code = error.getValue() != OpusConstants.OPUS_OK ? error.getValue() : OpusError.ALLOC_FAIL.code();
            return createFailed(HandleKind.ENCODER, code,
                    "opus_encoder_create(" + settings.describe() + ") failed: " + describeCode(code));
        }

        for (EncoderPolicy.CtlRequest ctl : encoderPolicy.ctlRequests(settings)) {
            int result = opus.opus_encoder_ctl(state, ctl.request(), ctl.value());
            if (result != OpusConstants.OPUS_OK) {
                opus.opus_encoder_destroy(state);
                return createFailed(HandleKind.ENCODER, result,
                        "OPUS_SET_" + ctl.name() + "(" + ctl.value() + ") rejected for "
                                + settings.describe() + ": " + describeCode(result));
            }
        }

        long handle = encoders.register(new EncoderState(state, settings));
        sink.onHandleLifecycle(HandleLifecycleEvent.created(clock.now(), HandleKind.ENCODER, handle,
                settings.describe() + ", VOIP, CBR, voice"));
        return handle;
    }

    @Override
    public int encode(long encoderHandle, short[] inputSamples, int frameSize, byte[] outputBytes)
    {
        if (encoderHandle == BridgeStatus.NO_HANDLE || inputSamples == null || outputBytes == null) {
            return reject(BridgeOperation.ENCODE, encoderHandle, BridgeStatus.PRECONDITION_FAILED,
                    "null handle or buffer");
        }
        Optional<EncoderState> found = encoders.lookup(encoderHandle);
        if (found.isEmpty()) {
            return reject(BridgeOperation.ENCODE, encoderHandle, BridgeStatus.INVALID_HANDLE,
                    "no live encoder for handle");
        }
        EncoderState encoder = found.get();
        int channels = encoder.settings().channels();

        if (frameSize <= 0) {
            return reject(BridgeOperation.ENCODE, encoderHandle, BridgeStatus.PRECONDITION_FAILED,
                    "frame size " + frameSize + " must be positive");
        }
        long required = (long) frameSize * channels;
        if (inputSamples.length < required) {
            return reject(BridgeOperation.ENCODE, encoderHandle, BridgeStatus.PRECONDITION_FAILED,
                    "input holds " + inputSamples.length + " samples, frame of " + frameSize
                            + " x " + channels + "ch needs " + required);
        }
        if (outputBytes.length == 0) {
            return reject(BridgeOperation.ENCODE, encoderHandle, BridgeStatus.PRECONDITION_FAILED,
                    "output buffer is empty");
        }

        try (SampleLease pcm = buffers.leaseSamples(inputSamples, (int) required);
             ByteLease packet = buffers.leaseByteOutput(outputBytes, outputBytes.length))
        {
            int written = opus.opus_encode(encoder.state(), pcm.pointer(), frameSize,
                    packet.pointer(), outputBytes.length);
            if (written < 0) {
                return codecError(BridgeOperation.ENCODE, encoderHandle, written);
            }
            packet.commit(written);
            return written;
        }
    }

    @Override
    public void destroyEncoder(long encoderHandle)
    {
        if (encoderHandle == BridgeStatus.NO_HANDLE) {
            return;
        }
        Optional<EncoderState> removed = encoders.remove(encoderHandle);
        if (removed.isEmpty()) {
            reject(BridgeOperation.DESTROY_ENCODER, encoderHandle, BridgeStatus.INVALID_HANDLE,
                    "no live encoder for handle, ignoring destroy");
            return;
        }
        opus.opus_encoder_destroy(removed.get().state());
        sink.onHandleLifecycle(HandleLifecycleEvent.destroyed(clock.now(), HandleKind.ENCODER, encoderHandle));
    }

    // -------------------------------------------------------------------------
    // Decoder session
    // -------------------------------------------------------------------------

    @Override
    public long createDecoder(int sampleRateHz, int channels)
    {
        DecoderSettings settings = new DecoderSettings(sampleRateHz, channels);

        if (parameterPolicy == ParameterPolicy.FAIL_FAST) {
            Optional<String> violation = OpusParameterRules.checkDecoder(settings);
            if (violation.isPresent()) {
                return createFailed(HandleKind.DECODER, OpusError.BAD_ARG.code(),
                        "rejected " + settings.describe() + ": " + violation.get());
            }
        }

        IntByReference error = new IntByReference(OpusConstants.OPUS_OK);
        Pointer state = opus.opus_decoder_create(sampleRateHz, channels, error);
        if (state == null || error.getValue() != OpusConstants.OPUS_OK) {
            if (state != null) {
                opus.opus_decoder_destroy(state);
            }
            int code = error.getValue() != OpusConstants.OPUS_OK ? error.getValue() : OpusError.ALLOC_FAIL.code();
            return createFailed(HandleKind.DECODER, code,
                    "opus_decoder_create(" + settings.describe() + ") failed: " + describeCode(code));
        }

        long handle = decoders.register(new DecoderState(state, settings));
        sink.onHandleLifecycle(HandleLifecycleEvent.created(clock.now(), HandleKind.DECODER, handle,
                settings.describe()));
        return handle;
    }

    @Override
    public int decode(long decoderHandle, byte[] inputBytes, int byteLength, short[] outputSamples, int frameSize)
    {
        if (decoderHandle == BridgeStatus.NO_HANDLE || inputBytes == null || outputSamples == null) {
            return reject(BridgeOperation.DECODE, decoderHandle, BridgeStatus.PRECONDITION_FAILED,
                    "null handle or buffer");
        }
        Optional<DecoderState> found = decoders.lookup(decoderHandle);
        if (found.isEmpty()) {
            return reject(BridgeOperation.DECODE, decoderHandle, BridgeStatus.INVALID_HANDLE,
                    "no live decoder for handle");
        }
        DecoderState decoder = found.get();
        int channels = decoder.settings().channels();

        if (byteLength <= 0 || byteLength > inputBytes.length) {
            return reject(BridgeOperation.DECODE, decoderHandle, BridgeStatus.PRECONDITION_FAILED,
                    "byte length " + byteLength + " outside 1.." + inputBytes.length);
        }
        if (frameSize <= 0) {
            return reject(BridgeOperation.DECODE, decoderHandle, BridgeStatus.PRECONDITION_FAILED,
                    "frame size " + frameSize + " must be positive");
        }
        long required = (long) frameSize * channels;
        if (outputSamples.length < required) {
            return reject(BridgeOperation.DECODE, decoderHandle, BridgeStatus.PRECONDITION_FAILED,
                    "output holds " + outputSamples.length + " samples, frame of " + frameSize
                            + " x " + channels + "ch needs " + required);
        }

        try (ByteLease packet = buffers.leaseBytes(inputBytes, byteLength);
             SampleLease pcm = buffers.leaseSampleOutput(outputSamples, (int) required))
        {
            int decoded = opus.opus_decode(decoder.state(), packet.pointer(), byteLength,
                    pcm.pointer(), frameSize, 0);
            if (decoded < 0) {
                return codecError(BridgeOperation.DECODE, decoderHandle, decoded);
            }
            pcm.commit(decoded * channels);
            return decoded;
        }
    }

    @Override
    public void destroyDecoder(long decoderHandle)
    {
        if (decoderHandle == BridgeStatus.NO_HANDLE) {
            return;
        }
        Optional<DecoderState> removed = decoders.remove(decoderHandle);
        if (removed.isEmpty()) {
            reject(BridgeOperation.DESTROY_DECODER, decoderHandle, BridgeStatus.INVALID_HANDLE,
                    "no live decoder for handle, ignoring destroy");
            return;
        }
        opus.opus_decoder_destroy(removed.get().state());
        sink.onHandleLifecycle(HandleLifecycleEvent.destroyed(clock.now(), HandleKind.DECODER, decoderHandle));
    }

    // -------------------------------------------------------------------------
    // Diagnostics
    // -------------------------------------------------------------------------

    @Override
    public String getVersion()
    {
        String version = opus.opus_get_version_string();
        return version == null || version.isBlank() ? UNKNOWN_VERSION : version;
    }

    @Override
    public int getEncoderSize(int channels)
    {
        return opus.opus_encoder_get_size(channels);
    }

    @Override
    public int getDecoderSize(int channels)
    {
        return opus.opus_decoder_get_size(channels);
    }

    /**
     * Destroys every encoder and decoder still registered and reports each as
     * reclaimed. The bridge stays usable afterwards.
     */
    @Override
    public void close()
    {
        Map<Long, EncoderState> leakedEncoders = encoders.drain();
        leakedEncoders.forEach((handle, encoder) -> {
            opus.opus_encoder_destroy(encoder.state());
            sink.onHandleLifecycle(HandleLifecycleEvent.reclaimed(clock.now(), HandleKind.ENCODER, handle,
                    "never destroyed (" + encoder.settings().describe() + ")"));
        });
        Map<Long, DecoderState> leakedDecoders = decoders.drain();
        leakedDecoders.forEach((handle, decoder) -> {
            opus.opus_decoder_destroy(decoder.state());
            sink.onHandleLifecycle(HandleLifecycleEvent.reclaimed(clock.now(), HandleKind.DECODER, handle,
                    "never destroyed (" + decoder.settings().describe() + ")"));
        });
    }

    /**
     * Number of encoder and decoder handles currently live.
     */
    public int liveHandleCount()
    {
        return encoders.size() + decoders.size();
    }

    /**
     * Number of buffer leases currently held. Zero between calls.
     */
    public int outstandingLeases()
    {
        return buffers.outstandingLeases();
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private long createFailed(HandleKind kind, int errorCode, String detail)
    {
        sink.onHandleLifecycle(HandleLifecycleEvent.createFailed(clock.now(), kind, errorCode, detail));
        return BridgeStatus.NO_HANDLE;
    }

    private int reject(BridgeOperation operation, long handle, int status, String reason)
    {
        sink.onCallRejected(new CallRejectedEvent(clock.now(), operation, handle, status, reason));
        return status;
    }

    private int codecError(BridgeOperation operation, long handle, int errorCode)
    {
        sink.onCodecError(new CodecErrorEvent(clock.now(), operation, handle, errorCode, describeCode(errorCode)));
        return errorCode;
    }

    private String describeCode(int code)
    {
        String text = opus.opus_strerror(code);
        return text == null || text.isBlank() ? OpusError.fromCode(code).description() : text;
    }
}
