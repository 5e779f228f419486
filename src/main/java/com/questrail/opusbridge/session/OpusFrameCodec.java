package com.questrail.opusbridge.session;

import com.questrail.opusbridge.api.BridgeStatus;
import com.questrail.opusbridge.api.OpusBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * OpusFrameCodec
 * =============================================================================
 * One encoder and one decoder for a fixed PCM stream format, on top of any
 * {@link OpusBridge}.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   new → open() → encode/decode ... → close()
 * </pre>
 * <p>{@link #open()} creates the encoder and then the decoder; if the decoder
 * cannot be created the encoder is destroyed again. {@link #close()} destroys
 * whatever is held, exactly once. A closed codec can be reopened.</p>
 *
 * <h2>Frames</h2>
 * <p>{@link #encode(short[])} accepts exactly one interleaved frame
 * ({@code frameSize * channels} samples). Packets are produced into a
 * {@value #MAX_PACKET_BYTES}-byte scratch buffer and returned trimmed.</p>
 *
 * <p>Not thread-safe. Use one instance per stream.</p>
 */
public final class OpusFrameCodec implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(OpusFrameCodec.class);

    /** Upper bound on one Opus packet produced by this codec. */
    public static final int MAX_PACKET_BYTES = 4000;

    private final OpusBridge bridge;
    private final FrameCodecConfig config;

    private long encoderHandle = BridgeStatus.NO_HANDLE;
    private long decoderHandle = BridgeStatus.NO_HANDLE;

    public OpusFrameCodec(OpusBridge bridge, FrameCodecConfig config)
    {
        this.bridge = Objects.requireNonNull(bridge, "bridge");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Validates the configuration and creates both handles.
     *
     * @return true if the codec is ready
     */
    public boolean open()
    {
        if (isReady()) {
            return true;
        }
        Optional<String> problem = config.validate();
        if (problem.isPresent()) {
            log.error("Invalid Opus frame codec configuration: {}", problem.get());
            return false;
        }

        encoderHandle = bridge.createEncoder(config.sampleRateHz(), config.channels(),
                config.complexity(), config.bitrate());
        if (encoderHandle == BridgeStatus.NO_HANDLE) {
            log.error("Opus encoder creation failed for {}", describe());
            return false;
        }

        decoderHandle = bridge.createDecoder(config.sampleRateHz(), config.channels());
        if (decoderHandle == BridgeStatus.NO_HANDLE) {
            log.error("Opus decoder creation failed for {}", describe());
            bridge.destroyEncoder(encoderHandle);
            encoderHandle = BridgeStatus.NO_HANDLE;
            return false;
        }

        log.debug("Opus frame codec ready: {} ({})", describe(), bridge.getVersion());
        return true;
    }

    public boolean isReady()
    {
        return encoderHandle != BridgeStatus.NO_HANDLE && decoderHandle != BridgeStatus.NO_HANDLE;
    }

    /**
     * Encodes one frame.
     *
     * @return the packet, or empty if the codec is not open, the frame has the
     *         wrong length, or the encoder failed
     */
    public Optional<byte[]> encode(short[] pcm)
    {
        Objects.requireNonNull(pcm, "pcm");
        if (!isReady()) {
            log.error("Opus frame codec is not open");
            return Optional.empty();
        }
        if (pcm.length != config.samplesPerFrame()) {
            log.error("PCM frame holds {} samples, expected {}", pcm.length, config.samplesPerFrame());
            return Optional.empty();
        }

        byte[] scratch = new byte[MAX_PACKET_BYTES];
        int written = bridge.encode(encoderHandle, pcm, config.frameSize(), scratch);
        if (BridgeStatus.isFailure(written)) {
            log.error("Opus encode failed: {} ({})", written, BridgeStatus.describe(written));
            return Optional.empty();
        }
        log.trace("Encoded {} samples into {} bytes", pcm.length, written);
        return Optional.of(Arrays.copyOf(scratch, written));
    }

    /**
     * Decodes one packet.
     *
     * @return the interleaved samples, or empty if the codec is not open or
     *         the decoder failed
     */
    public Optional<short[]> decode(byte[] packet)
    {
        Objects.requireNonNull(packet, "packet");
        if (!isReady()) {
            log.error("Opus frame codec is not open");
            return Optional.empty();
        }

        short[] pcm = new short[config.samplesPerFrame()];
        int decoded = bridge.decode(decoderHandle, packet, packet.length, pcm, config.frameSize());
        if (BridgeStatus.isFailure(decoded)) {
            log.error("Opus decode failed: {} ({})", decoded, BridgeStatus.describe(decoded));
            return Optional.empty();
        }
        int samples = decoded * config.channels();
        log.trace("Decoded {} bytes into {} samples", packet.length, samples);
        return Optional.of(samples == pcm.length ? pcm : Arrays.copyOf(pcm, samples));
    }

    /**
     * Encodes each frame in turn, leaving out frames that fail.
     */
    public List<byte[]> encodeStream(List<short[]> frames)
    {
        List<byte[]> packets = new ArrayList<>(frames.size());
        for (short[] frame : frames) {
            Optional<byte[]> packet = encode(frame);
            if (packet.isPresent()) {
                packets.add(packet.get());
            }
            else {
                log.warn("Skipping frame that failed to encode");
            }
        }
        log.debug("Encoded {}/{} frames", packets.size(), frames.size());
        return packets;
    }

    /**
     * Decodes each packet in turn, leaving out packets that fail.
     */
    public List<short[]> decodeStream(List<byte[]> packets)
    {
        List<short[]> frames = new ArrayList<>(packets.size());
        for (byte[] packet : packets) {
            Optional<short[]> frame = decode(packet);
            if (frame.isPresent()) {
                frames.add(frame.get());
            }
            else {
                log.warn("Skipping packet that failed to decode");
            }
        }
        log.debug("Decoded {}/{} packets", frames.size(), packets.size());
        return frames;
    }

    public float frameDurationMillis()
    {
        return config.frameSize() * 1000f / config.sampleRateHz();
    }

    public float framesPerSecond()
    {
        return (float) config.sampleRateHz() / config.frameSize();
    }

    /**
     * Ratio of the raw 16-bit PCM bitrate to the configured Opus bitrate.
     */
    public float compressionRatio()
    {
        int pcmBitrate = config.sampleRateHz() * config.channels() * 16;
        return (float) pcmBitrate / config.bitrate();
    }

    public String describe()
    {
        return "Opus " + config.sampleRateHz() + "Hz, " + config.channels() + "ch, frame "
                + config.frameSize() + ", " + config.bitrate() + "bps, complexity " + config.complexity();
    }

    public FrameCodecConfig config()
    {
        return config;
    }

    @Override
    public void close()
    {
        if (encoderHandle != BridgeStatus.NO_HANDLE) {
            bridge.destroyEncoder(encoderHandle);
            encoderHandle = BridgeStatus.NO_HANDLE;
        }
        if (decoderHandle != BridgeStatus.NO_HANDLE) {
            bridge.destroyDecoder(decoderHandle);
            decoderHandle = BridgeStatus.NO_HANDLE;
        }
    }
}
