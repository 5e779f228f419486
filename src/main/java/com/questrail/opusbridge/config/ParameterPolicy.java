package com.questrail.opusbridge.config;

/**
 * How a bridge treats creation parameters outside the codec's documented
 * ranges.
 */
public enum ParameterPolicy {
    /**
     * Pass every value to the codec and let it accept or reject it.
     * Creation fails only if the codec reports an error.
     */
    FORWARD,

    /**
     * Check values against {@link OpusParameterRules} first and fail creation
     * without calling the codec when one is out of range.
     */
    FAIL_FAST
}
