package com.questrail.lockcodec.observability;

/**
 * No-op implementation of CodecObservabilitySink.
 */
public final class NullObservabilitySink implements CodecObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onOperation(CodecOperationEvent event) {}

    @Override
    public void onError(CodecErrorEvent event) {}
}
