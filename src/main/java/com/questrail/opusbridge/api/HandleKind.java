package com.questrail.opusbridge.api;

/**
 * The two kinds of codec resource a handle can stand for.
 */
public enum HandleKind
{
    ENCODER,
    DECODER
}
