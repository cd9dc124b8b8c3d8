package com.questrail.lockcodec.codec.impl;

import com.questrail.lockcodec.config.LockCodecConfig;
import com.questrail.lockcodec.observability.CodecErrorEvent;
import com.questrail.lockcodec.observability.CodecObservabilitySink;
import com.questrail.lockcodec.observability.CodecOperation;
import com.questrail.lockcodec.observability.CodecOperationEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * Turns operation outcomes into observability events.
 *
 * <p>A sink that throws never changes the outcome of the codec call: its
 * failure is logged and the call returns or throws as it would have.</p>
 */
final class OperationReporter
{
    private static final Logger log = LoggerFactory.getLogger(OperationReporter.class);

    private final CodecObservabilitySink sink;
    private final Clock clock;

    OperationReporter(LockCodecConfig config)
    {
        this.sink = config.observabilitySink();
        this.clock = config.clock();
    }

    void succeeded(CodecOperation operation, int characterCount, int codeCount)
    {
        completed(operation, true, characterCount, codeCount);
    }

    /**
     * Reports an operation that ran to the end; {@code success} is false when
     * some elements of a lenient batch failed.
     */
    void completed(CodecOperation operation, boolean success, int characterCount, int codeCount)
    {
        publish(operation, new CodecOperationEvent(clock.instant(), operation, success, characterCount, codeCount));
    }

    void failed(CodecOperation operation, RuntimeException failure)
    {
        final Instant now = clock.instant();
        publish(operation, new CodecOperationEvent(now, operation, false, -1, -1));
        publish(operation, new CodecErrorEvent(now, operation, failure.getMessage(), failure));
    }

    /** Reports a per-element failure inside a lenient batch. */
    void elementFailed(CodecOperation operation, int index, RuntimeException failure)
    {
        publish(operation, new CodecErrorEvent(clock.instant(), operation,
                "element " + index + ": " + failure.getMessage(), failure));
    }

    private void publish(CodecOperation operation, Object event)
    {
        try {
            if (event instanceof CodecOperationEvent e) {
                sink.onOperation(e);
            } else {
                sink.onError((CodecErrorEvent) event);
            }
        }
        catch (RuntimeException e) {
            log.warn("Observability sink {} failed on {} event", sink.getClass().getName(), operation, e);
        }
    }
}
