package com.questrail.lockcodec.observability;

/**
 * Receives codec observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Sinks are called synchronously on the caller's thread and must not throw.</p>
 */
public interface CodecObservabilitySink {
    /**
     * Called once per public codec operation, successful or not.
     * @param event the operation summary
     */
    void onOperation(CodecOperationEvent event);

    /**
     * Called when an operation fails, after {@link #onOperation}.
     * @param event the error event
     */
    void onError(CodecErrorEvent event);
}
