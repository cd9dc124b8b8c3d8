package com.questrail.lockcodec.observability;

/**
 * Public codec operations reported to a {@link CodecObservabilitySink}.
 */
public enum CodecOperation
{
    ENCODE,
    DECODE,
    ENCODE_BATCH,
    DECODE_BATCH,
    MULTI_ENCODE,
    MULTI_DECODE,
    RELOCK
}
