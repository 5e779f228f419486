package com.questrail.opusbridge.bridge;

import com.questrail.opusbridge.api.OpusBridge;
import com.questrail.opusbridge.codec.OpusLibrary;
import com.questrail.opusbridge.codec.OpusLibraryLoader;
import com.questrail.opusbridge.codec.OpusLibraryUnavailableException;
import com.questrail.opusbridge.config.OpusBridgeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * OpusBridges
 * =============================================================================
 * Composition root choosing which {@link OpusBridge} a process uses.
 *
 * <p>The choice is made once, here. Call sites hold an {@link OpusBridge} and
 * never branch on which variant it is.</p>
 *
 * <ul>
 *   <li>{@link #nativeBridge(OpusBridgeConfig)}: libopus or an exception</li>
 *   <li>{@link #unimplemented(OpusBridgeConfig)}: no codec at all</li>
 *   <li>{@link #linked(OpusBridgeConfig)}: libopus when it links, otherwise
 *       the unimplemented variant</li>
 * </ul>
 */
public final class OpusBridges
{
    private static final Logger log = LoggerFactory.getLogger(OpusBridges.class);

    private OpusBridges() {}

    /**
     * Links the configured library and returns a bridge over it.
     *
     * @throws OpusLibraryUnavailableException if the library cannot be linked
     */
    public static NativeOpusBridge nativeBridge(OpusBridgeConfig config)
    {
        Objects.requireNonNull(config, "config");
        OpusLibrary library = OpusLibraryLoader.load(config.libraryName());
        log.info("Opus bridge using native library '{}' ({})", config.libraryName(), library.opus_get_version_string());
        return new NativeOpusBridge(library, config);
    }

    public static UnimplementedOpusBridge unimplemented(OpusBridgeConfig config)
    {
        return new UnimplementedOpusBridge(config);
    }

    /**
     * Returns the native bridge if the configured library links, the
     * unimplemented bridge otherwise.
     */
    public static OpusBridge linked(OpusBridgeConfig config)
    {
        Objects.requireNonNull(config, "config");
        try {
            return nativeBridge(config);
        }
        catch (OpusLibraryUnavailableException e) {
            log.warn("{}; falling back to the unimplemented Opus bridge", e.getMessage(), e);
            return unimplemented(config);
        }
    }
}
