package com.questrail.opusbridge.bridge;

import com.questrail.opusbridge.api.BridgeOperation;
import com.questrail.opusbridge.api.BridgeStatus;
import com.questrail.opusbridge.api.OpusBridge;
import com.questrail.opusbridge.config.OpusBridgeConfig;
import com.questrail.opusbridge.internal.time.GuardedWallClock;
import com.questrail.opusbridge.internal.time.WallClock;
import com.questrail.opusbridge.observability.GuardedObservabilitySink;
import com.questrail.opusbridge.observability.OpusBridgeObservabilitySink;
import com.questrail.opusbridge.observability.StubCallEvent;

import java.util.Objects;

/**
 * {@link OpusBridge} with no codec behind it.
 *
 * <p>Creation always fails, encode and decode always report
 * {@link BridgeStatus#PRECONDITION_FAILED}, destroy does nothing and sizes are
 * zero. Lets callers link and run against the full surface on platforms
 * where libopus is absent. Every call is reported as a {@link StubCallEvent}.</p>
 */
public final class UnimplementedOpusBridge implements OpusBridge
{
    public static final String VERSION = "Opus bridge (unimplemented) 1.0 - no native codec linked";

    private final OpusBridgeObservabilitySink sink;
    private final WallClock clock;

    public UnimplementedOpusBridge(OpusBridgeConfig config)
    {
        Objects.requireNonNull(config, "config");
        this.sink = GuardedObservabilitySink.guard(config.observabilitySink());
        this.clock = GuardedWallClock.guard(config.wallClock());
    }

    @Override
    public long createEncoder(int sampleRateHz, int channels, int complexity, int bitrate)
    {
        stubCall(BridgeOperation.CREATE_ENCODER);
        return BridgeStatus.NO_HANDLE;
    }

    @Override
    public long createDecoder(int sampleRateHz, int channels)
    {
        stubCall(BridgeOperation.CREATE_DECODER);
        return BridgeStatus.NO_HANDLE;
    }

    @Override
    public int encode(long encoderHandle, short[] inputSamples, int frameSize, byte[] outputBytes)
    {
        stubCall(BridgeOperation.ENCODE);
        return BridgeStatus.PRECONDITION_FAILED;
    }

    @Override
    public int decode(long decoderHandle, byte[] inputBytes, int byteLength, short[] outputSamples, int frameSize)
    {
        stubCall(BridgeOperation.DECODE);
        return BridgeStatus.PRECONDITION_FAILED;
    }

    @Override
    public void destroyEncoder(long encoderHandle)
    {
        stubCall(BridgeOperation.DESTROY_ENCODER);
    }

    @Override
    public void destroyDecoder(long decoderHandle)
    {
        stubCall(BridgeOperation.DESTROY_DECODER);
    }

    @Override
    public String getVersion()
    {
        stubCall(BridgeOperation.GET_VERSION);
        return VERSION;
    }

    @Override
    public int getEncoderSize(int channels)
    {
        stubCall(BridgeOperation.GET_ENCODER_SIZE);
        return 0;
    }

    @Override
    public int getDecoderSize(int channels)
    {
        stubCall(BridgeOperation.GET_DECODER_SIZE);
        return 0;
    }

    /**
     * Nothing to release.
     */
    @Override
    public void close()
    {
    }

    private void stubCall(BridgeOperation operation)
    {
        sink.onStubCall(new StubCallEvent(clock.now(), operation));
    }
}
