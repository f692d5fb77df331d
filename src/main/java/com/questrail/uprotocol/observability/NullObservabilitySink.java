package com.questrail.uprotocol.observability;

/**
 * No-op implementation of TransportObservabilitySink.
 */
public final class NullObservabilitySink implements TransportObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onListenerEvent(ListenerLifecycleEvent event) {}

    @Override
    public void onSendEvent(SendOutcomeEvent event) {}

    @Override
    public void onError(TransportErrorEvent event) {}
}
