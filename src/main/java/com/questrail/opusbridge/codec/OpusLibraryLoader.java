package com.questrail.opusbridge.codec;

import com.sun.jna.Native;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * OpusLibraryLoader
 * -----------------------------------------------------------------------------
 * Links libopus into the process through JNA.
 *
 * <p>The library name is resolved the usual JNA way ({@code jna.library.path},
 * then the system search path), so {@code "opus"} finds {@code libopus.so},
 * {@code libopus.dylib} or {@code opus.dll}. An absolute path is accepted as
 * well.</p>
 */
public final class OpusLibraryLoader
{
    private static final Logger log = LoggerFactory.getLogger(OpusLibraryLoader.class);

    private OpusLibraryLoader() {}

    /**
     * Loads the named library.
     *
     * @throws OpusLibraryUnavailableException if it cannot be found or linked
     */
    public static OpusLibrary load(String libraryName)
    {
        Objects.requireNonNull(libraryName, "libraryName");
        try {
            OpusLibrary library = Native.load(libraryName, OpusLibrary.class);
            // Functions bind lazily; resolve one now so a wrong library fails here.
            String version = library.opus_get_version_string();
            log.debug("Linked native Opus library '{}': {}", libraryName, version);
            return library;
        }
        catch (UnsatisfiedLinkError e) {
            throw new OpusLibraryUnavailableException(
                    "Native Opus library '" + libraryName + "' could not be linked", e);
        }
    }

    /**
     * Returns true if {@link #load(String)} would succeed for the name.
     */
    public static boolean isAvailable(String libraryName)
    {
        try {
            load(libraryName);
            return true;
        }
        catch (OpusLibraryUnavailableException e) {
            log.debug("Native Opus library '{}' unavailable: {}", libraryName, e.getCause().getMessage());
            return false;
        }
    }
}
