package com.questrail.opusbridge.session;

import com.questrail.opusbridge.api.BridgeStatus;
import com.questrail.opusbridge.api.OpusBridge;
import com.questrail.opusbridge.bridge.NativeOpusBridge;
import com.questrail.opusbridge.bridge.UnimplementedOpusBridge;
import com.questrail.opusbridge.codec.FakeOpusLibrary;
import com.questrail.opusbridge.config.OpusBridgeConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class OpusFrameCodecTest
{
    private FakeOpusLibrary opus;
    private NativeOpusBridge bridge;

    @BeforeEach
    void setUp() {
        opus = new FakeOpusLibrary();
        bridge = new NativeOpusBridge(opus, OpusBridgeConfig.defaults());
    }

    @AfterEach
    void nothingLeaks() {
        assertEquals(0, bridge.liveHandleCount());
        assertEquals(0, bridge.outstandingLeases());
    }

    @Test
    void defaultCodecOpensAndCloses() {
        OpusFrameCodec codec = new OpusFrameCodec(bridge, FrameCodecConfig.defaults());

        assertFalse(codec.isReady());
        assertTrue(codec.open());
        assertTrue(codec.isReady());
        assertEquals(2, bridge.liveHandleCount());

        codec.close();
        codec.close();
        assertFalse(codec.isReady());
        assertEquals(1, opus.encodersDestroyed());
        assertEquals(1, opus.decodersDestroyed());
    }

    @Test
    void frameRoundTripPreservesSilence() {
        try (OpusFrameCodec codec = new OpusFrameCodec(bridge, FrameCodecConfig.defaults())) {
            assertTrue(codec.open());

            byte[] packet = codec.encode(new short[960]).orElseThrow();
            assertTrue(packet.length > 0 && packet.length <= OpusFrameCodec.MAX_PACKET_BYTES);

            short[] pcm = codec.decode(packet).orElseThrow();
            assertEquals(960, pcm.length);
            assertTrue(Arrays.stream(toInts(pcm)).allMatch(s -> s == 0));
        }
    }

    @Test
    void stereoFramesAreInterleaved() {
        FrameCodecConfig stereo = FrameCodecConfig.builder()
            .withSampleRate(48000)
            .withChannels(2)
            .withFrameSize(960)
            .withBitrate(64000)
            .build();
        try (OpusFrameCodec codec = new OpusFrameCodec(bridge, stereo)) {
            assertTrue(codec.open());

            byte[] packet = codec.encode(new short[1920]).orElseThrow();
            assertEquals(1920, codec.decode(packet).orElseThrow().length);
        }
    }

    @Test
    void wrongFrameLengthIsRefused() {
        try (OpusFrameCodec codec = new OpusFrameCodec(bridge, FrameCodecConfig.defaults())) {
            assertTrue(codec.open());

            assertTrue(codec.encode(new short[959]).isEmpty());
            assertTrue(codec.encode(new short[1920]).isEmpty());
            assertEquals(0, opus.encodeCalls());
        }
    }

    @Test
    void unopenedCodecRefusesWork() {
        OpusFrameCodec codec = new OpusFrameCodec(bridge, FrameCodecConfig.defaults());

        assertTrue(codec.encode(new short[960]).isEmpty());
        assertTrue(codec.decode(new byte[] {1}).isEmpty());
    }

    @Test
    void invalidConfigurationNeverReachesTheBridge() {
        FrameCodecConfig badFrame = FrameCodecConfig.builder().withFrameSize(100).build();
        FrameCodecConfig badBitrate = FrameCodecConfig.builder().withBitrate(5000).build();
        FrameCodecConfig badRate = FrameCodecConfig.builder().withSampleRate(44100).build();

        assertFalse(new OpusFrameCodec(bridge, badFrame).open());
        assertFalse(new OpusFrameCodec(bridge, badBitrate).open());
        assertFalse(new OpusFrameCodec(bridge, badRate).open());
        assertEquals(0, opus.encodersCreated());
    }

    @Test
    void decoderFailureReleasesTheEncoder() {
        OpusFrameCodec codec = new OpusFrameCodec(new DecoderlessBridge(bridge), FrameCodecConfig.defaults());

        assertFalse(codec.open());
        assertFalse(codec.isReady());
        assertEquals(1, opus.encodersCreated());
        assertEquals(1, opus.encodersDestroyed());
    }

    @Test
    void nothingWorksOverTheUnimplementedBridge() {
        OpusFrameCodec codec = new OpusFrameCodec(new UnimplementedOpusBridge(OpusBridgeConfig.defaults()),
            FrameCodecConfig.defaults());

        assertFalse(codec.open());
        assertTrue(codec.encode(new short[960]).isEmpty());
    }

    @Test
    void streamsSkipFailedFrames() {
        try (OpusFrameCodec codec = new OpusFrameCodec(bridge, FrameCodecConfig.defaults())) {
            assertTrue(codec.open());

            List<byte[]> packets = codec.encodeStream(List.of(new short[960], new short[10], new short[960]));
            assertEquals(2, packets.size());

            List<short[]> frames = codec.decodeStream(List.of(packets.get(0), new byte[] {0, 1, 2}, packets.get(1)));
            assertEquals(2, frames.size());
        }
    }

    @Test
    void streamInformation() {
        OpusFrameCodec codec = new OpusFrameCodec(bridge, FrameCodecConfig.defaults());

        assertEquals(60f, codec.frameDurationMillis(), 0.001f);
        assertEquals(16.667f, codec.framesPerSecond(), 0.001f);
        assertEquals(8f, codec.compressionRatio(), 0.001f);
        assertTrue(codec.describe().contains("16000Hz"));
    }

    @Test
    void everyListedFrameSizeIsAcceptedByTheCodec() {
        FrameCodecConfig.SUPPORTED_FRAME_SIZES.forEach((rate, sizes) -> {
            for (int size : sizes) {
                FrameCodecConfig config = FrameCodecConfig.builder().withSampleRate(rate).withFrameSize(size).build();
                try (OpusFrameCodec codec = new OpusFrameCodec(bridge, config)) {
                    assertTrue(codec.open(), rate + "/" + size);
                    assertTrue(codec.encode(new short[size]).isPresent(), rate + "/" + size);
                }
            }
        });
    }

    /** Delegates everything except decoder creation, which always fails. */
    private static final class DecoderlessBridge implements OpusBridge
    {
        private final OpusBridge delegate;

        DecoderlessBridge(OpusBridge delegate) {
            this.delegate = delegate;
        }

        @Override
        public long createEncoder(int sampleRateHz, int channels, int complexity, int bitrate) {
            return delegate.createEncoder(sampleRateHz, channels, complexity, bitrate);
        }

        @Override
        public long createDecoder(int sampleRateHz, int channels) {
            return BridgeStatus.NO_HANDLE;
        }

        @Override
        public int encode(long encoderHandle, short[] inputSamples, int frameSize, byte[] outputBytes) {
            return delegate.encode(encoderHandle, inputSamples, frameSize, outputBytes);
        }

        @Override
        public int decode(long decoderHandle, byte[] inputBytes, int byteLength, short[] outputSamples, int frameSize) {
            return delegate.decode(decoderHandle, inputBytes, byteLength, outputSamples, frameSize);
        }

        @Override
        public void destroyEncoder(long encoderHandle) {
            delegate.destroyEncoder(encoderHandle);
        }

        @Override
        public void destroyDecoder(long decoderHandle) {
            delegate.destroyDecoder(decoderHandle);
        }

        @Override
        public String getVersion() {
            return delegate.getVersion();
        }

        @Override
        public int getEncoderSize(int channels) {
            return delegate.getEncoderSize(channels);
        }

        @Override
        public int getDecoderSize(int channels) {
            return delegate.getDecoderSize(channels);
        }

        @Override
        public void close() {
            delegate.close();
        }
    }

    private static int[] toInts(short[] samples) {
        int[] ints = new int[samples.length];
        for (int i = 0; i < samples.length; i++) {
            ints[i] = samples[i];
        }
        return ints;
    }
}
