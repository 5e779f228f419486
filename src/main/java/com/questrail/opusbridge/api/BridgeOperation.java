package com.questrail.opusbridge.api;

/**
 * The operations of the {@link OpusBridge} call surface, used to label
 * diagnostics.
 */
public enum BridgeOperation
{
    CREATE_ENCODER("createEncoder"),
    CREATE_DECODER("createDecoder"),
    ENCODE("encode"),
    DECODE("decode"),
    DESTROY_ENCODER("destroyEncoder"),
    DESTROY_DECODER("destroyDecoder"),
    GET_VERSION("getVersion"),
    GET_ENCODER_SIZE("getEncoderSize"),
    GET_DECODER_SIZE("getDecoderSize");

    private final String methodName;

    BridgeOperation(String methodName)
    {
        this.methodName = methodName;
    }

    public String methodName()
    {
        return methodName;
    }
}
