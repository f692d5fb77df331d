package com.questrail.uprotocol.observability;

/**
 * Receives transport observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks run synchronously on the thread performing the operation and
 * must not block.</p>
 */
public interface TransportObservabilitySink {
    /**
     * Called when a listener registration is accepted, rejected or cleaned up.
     * @param event the lifecycle event
     */
    void onListenerEvent(ListenerLifecycleEvent event);

    /**
     * Called once per send attempt with the status returned to the caller.
     * @param event the send outcome
     */
    void onSendEvent(SendOutcomeEvent event);

    /**
     * Called when a hook or a listener throws.
     * @param event the error event
     */
    void onError(TransportErrorEvent event);
}
