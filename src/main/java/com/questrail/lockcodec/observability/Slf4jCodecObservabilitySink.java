package com.questrail.lockcodec.observability;

import com.questrail.lockcodec.error.LockCodecException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of CodecObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jCodecObservabilitySink implements CodecObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jCodecObservabilitySink.class);

    @Override
    public void onOperation(CodecOperationEvent event) {
        if (event.success()) {
            log.debug("{} ok: {} characters, {} codes",
                event.operation(),
                event.characterCount(),
                event.codeCount());
        }
    }

    @Override
    public void onError(CodecErrorEvent event) {
        if (event.cause() instanceof LockCodecException e) {
            log.warn("{} failed [{}]: {}", event.operation(), e.category(), event.message());
        } else {
            log.error("{} failed: {}", event.operation(), event.message(), event.cause());
        }
    }
}
