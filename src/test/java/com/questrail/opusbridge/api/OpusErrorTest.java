package com.questrail.opusbridge.api;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class OpusErrorTest
{
    @Test
    void libopusCodesMapToTheirConstants() {
        assertEquals(OpusError.OK, OpusError.fromCode(0));
        assertEquals(OpusError.BAD_ARG, OpusError.fromCode(-1));
        assertEquals(OpusError.BUFFER_TOO_SMALL, OpusError.fromCode(-2));
        assertEquals(OpusError.INTERNAL_ERROR, OpusError.fromCode(-3));
        assertEquals(OpusError.INVALID_PACKET, OpusError.fromCode(-4));
        assertEquals(OpusError.UNIMPLEMENTED, OpusError.fromCode(-5));
        assertEquals(OpusError.INVALID_STATE, OpusError.fromCode(-6));
        assertEquals(OpusError.ALLOC_FAIL, OpusError.fromCode(-7));
    }

    @Test
    void unmappedCodesAreUnknown() {
        assertEquals(OpusError.UNKNOWN, OpusError.fromCode(-8));
        assertEquals(OpusError.UNKNOWN, OpusError.fromCode(BridgeStatus.INVALID_HANDLE));
        assertEquals(OpusError.UNKNOWN, OpusError.fromCode(Integer.MIN_VALUE));
    }

    @Test
    void invalidHandleDoesNotCollideWithCodecCodes() {
        for (OpusError error : OpusError.values()) {
            assertNotEquals(BridgeStatus.INVALID_HANDLE, error.code());
        }
        assertNotEquals(BridgeStatus.NO_HANDLE, (long) BridgeStatus.INVALID_HANDLE);
    }

    @Test
    void statusDescriptions() {
        assertEquals("ok", BridgeStatus.describe(12));
        assertEquals("invalid handle", BridgeStatus.describe(BridgeStatus.INVALID_HANDLE));
        assertEquals("buffer too small", BridgeStatus.describe(-2));
        assertTrue(BridgeStatus.isFailure(-1));
        assertFalse(BridgeStatus.isFailure(0));
    }
}
