package com.questrail.opusbridge.codec;

import com.sun.jna.Library;
import com.sun.jna.Pointer;
import com.sun.jna.ptr.IntByReference;

/**
 * libopus C API via JNA.
 *
 * <p>Only the primitives the bridge consumes are mapped. State pointers
 * ({@code OpusEncoder*}, {@code OpusDecoder*}) are opaque to Java and are
 * never dereferenced outside the library. Sample and packet pointers must
 * refer to native memory that stays valid for the duration of the call.</p>
 */
public interface OpusLibrary extends Library {
    // Encoder
    Pointer opus_encoder_create(int fs, int channels, int application, IntByReference error);

    int opus_encoder_ctl(Pointer st, int request, Object... args);

    int opus_encode(Pointer st, Pointer pcm, int frameSize, Pointer data, int maxDataBytes);

    void opus_encoder_destroy(Pointer st);

    int opus_encoder_get_size(int channels);

    // Decoder
    Pointer opus_decoder_create(int fs, int channels, IntByReference error);

    int opus_decode(Pointer st, Pointer data, int len, Pointer pcm, int frameSize, int decodeFec);

    void opus_decoder_destroy(Pointer st);

    int opus_decoder_get_size(int channels);

    // Library information
    String opus_get_version_string();

    String opus_strerror(int error);
}
