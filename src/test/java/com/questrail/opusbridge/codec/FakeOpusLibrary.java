package com.questrail.opusbridge.codec;

import com.questrail.opusbridge.api.OpusError;
import com.sun.jna.Pointer;
import com.sun.jna.ptr.IntByReference;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory stand-in for libopus.
 *
 * <p>Validates arguments the way libopus documents and keeps per-state
 * bookkeeping, but the "compression" is a trivial block average:</p>
 * <pre>
 *   [TOC][frameSize hi][frameSize lo][one byte per 16 interleaved samples]
 * </pre>
 * Each payload byte is the high byte of its block's mean. Decoding expands
 * every byte back to {@code value << 8}, so silence round-trips exactly.
 *
 * <p>Native states are fake addresses and are never dereferenced. PCM and
 * packet pointers are real native memory and are read and written through
 * JNA. Destroying a state twice fails the test with an
 * {@link IllegalStateException}.</p>
 */
public final class FakeOpusLibrary implements OpusLibrary {
    public static final String VERSION = "libopus 1.3.1-fake";
    public static final byte TOC = 0x78;
    public static final int BLOCK = 16;
    public static final int ENCODER_SIZE_MONO = 17_664;
    public static final int ENCODER_SIZE_STEREO = 30_992;
    public static final int DECODER_SIZE_MONO = 17_860;
    public static final int DECODER_SIZE_STEREO = 26_580;

    private static final Set<Integer> RATES = Set.of(8000, 12000, 16000, 24000, 48000);
    private static final Set<Integer> APPLICATIONS = Set.of(
        OpusConstants.OPUS_APPLICATION_VOIP,
        OpusConstants.OPUS_APPLICATION_AUDIO,
        OpusConstants.OPUS_APPLICATION_RESTRICTED_LOWDELAY);

    /** One recorded ctl call. */
    public record Ctl(int request, int value) {}

    private static final class State {
        final boolean encoder;
        final int sampleRateHz;
        final int channels;
        final List<Ctl> ctls = new ArrayList<>();

        State(boolean encoder, int sampleRateHz, int channels) {
            this.encoder = encoder;
            this.sampleRateHz = sampleRateHz;
            this.channels = channels;
        }
    }

    private final AtomicLong nextAddress = new AtomicLong(0x7f00_0000_1000L);
    private final Map<Long, State> live = new ConcurrentHashMap<>();
    private final Set<Long> destroyed = ConcurrentHashMap.newKeySet();

    private final AtomicInteger encodersCreated = new AtomicInteger();
    private final AtomicInteger decodersCreated = new AtomicInteger();
    private final AtomicInteger encodersDestroyed = new AtomicInteger();
    private final AtomicInteger decodersDestroyed = new AtomicInteger();
    private final AtomicInteger encodeCalls = new AtomicInteger();
    private final AtomicInteger decodeCalls = new AtomicInteger();

    private volatile boolean failAllocation;
    private volatile int rejectedCtlRequest = -1;
    private volatile int nextCodecError;
    private volatile String version = VERSION;

    // ---------------------------------------------------------------------
    // Test controls
    // ---------------------------------------------------------------------

    /** Makes every create call report {@link OpusError#ALLOC_FAIL}. */
    public void failAllocation(boolean fail) {
        this.failAllocation = fail;
    }

    /** Makes the given ctl request report {@link OpusError#UNIMPLEMENTED}. */
    public void rejectCtl(int request) {
        this.rejectedCtlRequest = request;
    }

    /** Makes the next encode or decode call return {@code code}. */
    public void failNextCodecCall(int code) {
        this.nextCodecError = code;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    // ---------------------------------------------------------------------
    // Inspection
    // ---------------------------------------------------------------------

    public int liveStates() {
        return live.size();
    }

    public int encodersCreated() {
        return encodersCreated.get();
    }

    public int decodersCreated() {
        return decodersCreated.get();
    }

    public int encodersDestroyed() {
        return encodersDestroyed.get();
    }

    public int decodersDestroyed() {
        return decodersDestroyed.get();
    }

    public int encodeCalls() {
        return encodeCalls.get();
    }

    public int decodeCalls() {
        return decodeCalls.get();
    }

    /** Ctl calls applied to the most recently created encoder, in order. */
    public synchronized List<Ctl> lastEncoderCtls() {
        return live.entrySet().stream()
            .filter(e -> e.getValue().encoder)
            .max(Map.Entry.comparingByKey())
            .map(e -> List.copyOf(e.getValue().ctls))
            .orElse(List.of());
    }

    // ---------------------------------------------------------------------
    // Encoder
    // ---------------------------------------------------------------------

    @Override
    public Pointer opus_encoder_create(int fs, int channels, int application, IntByReference error) {
        if (failAllocation) {
            error.setValue(OpusError.ALLOC_FAIL.code());
            return null;
        }
        if (!RATES.contains(fs) || channels < 1 || channels > 2 || !APPLICATIONS.contains(application)) {
            error.setValue(OpusError.BAD_ARG.code());
            return null;
        }
        error.setValue(OpusConstants.OPUS_OK);
        encodersCreated.incrementAndGet();
        return allocate(new State(true, fs, channels));
    }

    @Override
    public synchronized int opus_encoder_ctl(Pointer st, int request, Object... args) {
        State state = require(st, true);
        int value = (Integer) args[0];
        if (request == rejectedCtlRequest) {
            return OpusError.UNIMPLEMENTED.code();
        }
        if (request == OpusConstants.OPUS_SET_COMPLEXITY_REQUEST && (value < 0 || value > 10)) {
            return OpusError.BAD_ARG.code();
        }
        if (request == OpusConstants.OPUS_SET_BITRATE_REQUEST && value <= 0) {
            return OpusError.BAD_ARG.code();
        }
        state.ctls.add(new Ctl(request, value));
        return OpusConstants.OPUS_OK;
    }

    @Override
    public int opus_encode(Pointer st, Pointer pcm, int frameSize, Pointer data, int maxDataBytes) {
        encodeCalls.incrementAndGet();
        State state = require(st, true);
        int injected = takeInjectedError();
        if (injected != 0) {
            return injected;
        }
        if (!isValidFrameSize(state.sampleRateHz, frameSize)) {
            return OpusError.BAD_ARG.code();
        }
        int samples = frameSize * state.channels;
        int blocks = (samples + BLOCK - 1) / BLOCK;
        int packetBytes = 3 + blocks;
        if (packetBytes > maxDataBytes) {
            return OpusError.BUFFER_TOO_SMALL.code();
        }
        data.setByte(0, TOC);
        data.setByte(1, (byte) (frameSize >> 8));
        data.setByte(2, (byte) frameSize);
        for (int b = 0; b < blocks; b++) {
            int from = b * BLOCK;
            int to = Math.min(samples, from + BLOCK);
            long sum = 0;
            for (int i = from; i < to; i++) {
                sum += pcm.getShort(i * 2L);
            }
            data.setByte(3 + b, (byte) ((sum / (to - from)) >> 8));
        }
        return packetBytes;
    }

    @Override
    public void opus_encoder_destroy(Pointer st) {
        release(st, true);
        encodersDestroyed.incrementAndGet();
    }

    @Override
    public int opus_encoder_get_size(int channels) {
        return switch (channels) {
            case 1 -> ENCODER_SIZE_MONO;
            case 2 -> ENCODER_SIZE_STEREO;
            default -> 0;
        };
    }

    // ---------------------------------------------------------------------
    // Decoder
    // ---------------------------------------------------------------------

    @Override
    public Pointer opus_decoder_create(int fs, int channels, IntByReference error) {
        if (failAllocation) {
            error.setValue(OpusError.ALLOC_FAIL.code());
            return null;
        }
        if (!RATES.contains(fs) || channels < 1 || channels > 2) {
            error.setValue(OpusError.BAD_ARG.code());
            return null;
        }
        error.setValue(OpusConstants.OPUS_OK);
        decodersCreated.incrementAndGet();
        return allocate(new State(false, fs, channels));
    }

    @Override
    public int opus_decode(Pointer st, Pointer data, int len, Pointer pcm, int frameSize, int decodeFec) {
        decodeCalls.incrementAndGet();
        State state = require(st, false);
        int injected = takeInjectedError();
        if (injected != 0) {
            return injected;
        }
        if (decodeFec != 0) {
            return OpusError.BAD_ARG.code();
        }
        if (len < 3 || data.getByte(0) != TOC) {
            return OpusError.INVALID_PACKET.code();
        }
        int packetFrame = ((data.getByte(1) & 0xFF) << 8) | (data.getByte(2) & 0xFF);
        int samples = packetFrame * state.channels;
        int blocks = (samples + BLOCK - 1) / BLOCK;
        if (len != 3 + blocks) {
            return OpusError.INVALID_PACKET.code();
        }
        if (packetFrame > frameSize) {
            return OpusError.BUFFER_TOO_SMALL.code();
        }
        for (int i = 0; i < samples; i++) {
            byte level = data.getByte(3 + i / BLOCK);
            pcm.setShort(i * 2L, (short) (level << 8));
        }
        return packetFrame;
    }

    @Override
    public void opus_decoder_destroy(Pointer st) {
        release(st, false);
        decodersDestroyed.incrementAndGet();
    }

    @Override
    public int opus_decoder_get_size(int channels) {
        return switch (channels) {
            case 1 -> DECODER_SIZE_MONO;
            case 2 -> DECODER_SIZE_STEREO;
            default -> 0;
        };
    }

    // ---------------------------------------------------------------------
    // Misc
    // ---------------------------------------------------------------------

    @Override
    public String opus_get_version_string() {
        return version;
    }

    @Override
    public String opus_strerror(int error) {
        return OpusError.fromCode(error).description();
    }

    private Pointer allocate(State state) {
        long address = nextAddress.getAndAdd(0x100);
        live.put(address, state);
        return new Pointer(address);
    }

    private State require(Pointer st, boolean encoder) {
        State state = live.get(Pointer.nativeValue(st));
        if (state == null || state.encoder != encoder) {
            throw new IllegalStateException("Use of dead or foreign codec state " + st);
        }
        return state;
    }

    private void release(Pointer st, boolean encoder) {
        long address = Pointer.nativeValue(st);
        if (destroyed.contains(address)) {
            throw new IllegalStateException("Double free of codec state " + st);
        }
        require(st, encoder);
        live.remove(address);
        destroyed.add(address);
    }

    private int takeInjectedError() {
        int code = nextCodecError;
        nextCodecError = 0;
        return code;
    }

    private static boolean isValidFrameSize(int fs, int frameSize) {
        int unit = fs / 400;
        return frameSize == unit || frameSize == 2 * unit || frameSize == 4 * unit
            || frameSize == 8 * unit || frameSize == 16 * unit || frameSize == 24 * unit;
    }
}
