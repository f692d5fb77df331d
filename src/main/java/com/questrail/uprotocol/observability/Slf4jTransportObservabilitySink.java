package com.questrail.uprotocol.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of TransportObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jTransportObservabilitySink implements TransportObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jTransportObservabilitySink.class);

    @Override
    public void onListenerEvent(ListenerLifecycleEvent event) {
        switch (event.phase()) {
            case REGISTERED -> log.debug("Listener registered: sink={} source={}",
                event.sinkFilter(), event.sourceFilter().map(Object::toString).orElse("<none>"));
            case REJECTED -> log.warn("Listener registration rejected: sink={} source={} status={}",
                event.sinkFilter(), event.sourceFilter().map(Object::toString).orElse("<none>"), event.status());
            case CLEANED_UP -> log.debug("Listener cleaned up: sink={}", event.sinkFilter());
        }
    }

    @Override
    public void onSendEvent(SendOutcomeEvent event) {
        if (event.status().isOk()) {
            log.trace("Sent {} {}", event.messageType(), event.messageId());
        } else {
            log.warn("Send of {} {} failed: {}", event.messageType(), event.messageId(), event.status());
        }
    }

    @Override
    public void onError(TransportErrorEvent event) {
        log.error("Transport error: {}", event.message(), event.cause());
    }
}
