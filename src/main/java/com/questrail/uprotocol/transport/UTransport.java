package com.questrail.uprotocol.transport;

import com.questrail.uprotocol.api.Result;
import com.questrail.uprotocol.api.UCode;
import com.questrail.uprotocol.api.UMessage;
import com.questrail.uprotocol.api.UStatus;
import com.questrail.uprotocol.api.UUri;
import com.questrail.uprotocol.config.TransportConfig;
import com.questrail.uprotocol.observability.ListenerLifecycleEvent;
import com.questrail.uprotocol.observability.SendOutcomeEvent;
import com.questrail.uprotocol.observability.TransportErrorEvent;
import com.questrail.uprotocol.observability.TransportObservabilitySink;
import com.questrail.uprotocol.time.WallClock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * UTransport
 * =============================================================================
 * Contract every concrete transport (bus driver, shared memory, network binding,
 * in-process loopback) fulfils.
 *
 * <h2>Hooks</h2>
 * Concrete transports implement three hooks:
 * <ul>
 *   <li>{@link #sendImpl(UMessage)}: put a message on the medium</li>
 *   <li>{@link #registerListenerImpl(UUri, CallableConn, Optional)}: start
 *       delivering matching inbound messages to a connection</li>
 *   <li>{@link #cleanupListener(CallableConn)}: stop delivering to it</li>
 * </ul>
 *
 * <h2>Registration lifecycle</h2>
 * <pre>
 *   Unregistered --registerListener (hook OK)--&gt; Registered --handle release--&gt; Cleaned
 * </pre>
 * <p>
 * A cleanup is owed if and only if the register hook returned OK, and it is
 * performed exactly once, when the returned {@link ListenerHandle} is released.
 * A rejected registration yields no handle; its connection is invalidated and
 * {@link #cleanupListener(CallableConn)} is never called for it.
 * </p>
 *
 * <h2>Failure model</h2>
 * <p>
 * Hook statuses are returned verbatim. The contract layer never retries. A hook
 * that throws instead of returning a status is a transport defect: it is
 * reported to the observability sink and surfaces as {@link UCode#INTERNAL}.
 * A sink that throws is logged and otherwise ignored; it never changes the
 * outcome of an operation.
 * </p>
 *
 * <h2>Filtering</h2>
 * <p>
 * Filters are forwarded untouched; matching semantics belong to the concrete
 * transport.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * {@code send} and {@code registerListener} may be called concurrently; the
 * contract layer adds no serialization of its own. Hooks must be thread-safe.
 * Implementations must stop invoking a connection once it is no longer
 * {@linkplain CallableConn#isValid() valid}; invoking through
 * {@link CallableConn#invoke} guarantees this.
 * </p>
 */
public abstract class UTransport
{
    private static final Logger log = LoggerFactory.getLogger(UTransport.class);

    private final UUri defaultSource;
    private final TransportObservabilitySink observability;
    private final WallClock clock;

    protected UTransport(UUri defaultSource) {
        this(TransportConfig.of(defaultSource));
    }

    protected UTransport(TransportConfig config) {
        Objects.requireNonNull(config, "config");
        this.defaultSource = config.defaultSource();
        this.observability = config.observability();
        this.clock = config.clock();
    }

    /**
     * The identity of this transport, fixed at construction.
     */
    public final UUri getDefaultSource() {
        return defaultSource;
    }

    /**
     * Sends a message.
     *
     * @return the status reported by the transport; never {@code null}
     */
    public final UStatus send(UMessage message) {
        Objects.requireNonNull(message, "message");

        UStatus status;
        try {
            status = sendImpl(message);
        } catch (RuntimeException e) {
            reportError("sendImpl threw", e);
            status = UStatus.of(UCode.INTERNAL, "send failed: " + e);
        }
        if (status == null) {
            status = UStatus.of(UCode.INTERNAL, "sendImpl returned no status");
        }

        emitSendEvent(new SendOutcomeEvent(
                clock.now(),
                message.attributes().id(),
                message.attributes().type(),
                status
        ));
        return status;
    }

    /**
     * Registers a listener for messages sent to {@code sinkFilter} from any source.
     */
    public final Result<ListenerHandle> registerListener(UUri sinkFilter, UListener listener) {
        return registerListener(sinkFilter, listener, Optional.empty());
    }

    /**
     * Registers a listener for messages sent to {@code sinkFilter} from
     * {@code sourceFilter}.
     */
    public final Result<ListenerHandle> registerListener(UUri sinkFilter, UListener listener, UUri sourceFilter) {
        return registerListener(sinkFilter, listener, Optional.of(sourceFilter));
    }

    /**
     * Registers a listener.
     *
     * @param sinkFilter   where matching messages were sent to
     * @param listener     callback for matching messages
     * @param sourceFilter where matching messages come from, if restricted
     * @return a handle whose release unregisters the listener, or the status
     *         reported by the transport
     */
    public final Result<ListenerHandle> registerListener(UUri sinkFilter,
                                                         UListener listener,
                                                         Optional<UUri> sourceFilter) {
        Objects.requireNonNull(sinkFilter, "sinkFilter");
        Objects.requireNonNull(listener, "listener");
        Objects.requireNonNull(sourceFilter, "sourceFilter");

        CallableConn connection = CallableConn.of(listener);

        UStatus status;
        try {
            status = registerListenerImpl(sinkFilter, connection, sourceFilter);
        } catch (RuntimeException e) {
            reportError("registerListenerImpl threw", e);
            status = UStatus.of(UCode.INTERNAL, "registration failed: " + e);
        }
        if (status == null) {
            status = UStatus.of(UCode.INTERNAL, "registerListenerImpl returned no status");
        }

        if (!status.isOk()) {
            connection.invalidate();
            emitListenerEvent(new ListenerLifecycleEvent(
                    clock.now(), ListenerLifecycleEvent.Phase.REJECTED, sinkFilter, sourceFilter, status));
            return Result.err(status);
        }

        emitListenerEvent(new ListenerLifecycleEvent(
                clock.now(), ListenerLifecycleEvent.Phase.REGISTERED, sinkFilter, sourceFilter, status));

        return Result.ok(new ListenerHandle(connection, c -> cleanup(c, sinkFilter, sourceFilter)));
    }

    private void cleanup(CallableConn connection, UUri sinkFilter, Optional<UUri> sourceFilter) {
        try {
            cleanupListener(connection);
        } catch (RuntimeException e) {
            reportError("cleanupListener threw", e);
        }
        emitListenerEvent(new ListenerLifecycleEvent(
                clock.now(), ListenerLifecycleEvent.Phase.CLEANED_UP, sinkFilter, sourceFilter, UStatus.ok()));
    }

    /**
     * Reports an unexpected exception to the observability sink.
     */
    protected final void reportError(String message, Throwable cause) {
        try {
            observability.onError(new TransportErrorEvent(clock.now(), message, cause));
        } catch (RuntimeException e) {
            log.error("observability sink threw while recording '{}' (cause: {})", message, cause, e);
        }
    }

    private void emitSendEvent(SendOutcomeEvent event) {
        try {
            observability.onSendEvent(event);
        } catch (RuntimeException e) {
            log.warn("observability sink threw on send event {}", event, e);
        }
    }

    private void emitListenerEvent(ListenerLifecycleEvent event) {
        try {
            observability.onListenerEvent(event);
        } catch (RuntimeException e) {
            log.warn("observability sink threw on listener event {}", event, e);
        }
    }

    // -------------------------------------------------------------------------
    // Transport hooks
    // -------------------------------------------------------------------------

    /**
     * Puts {@code message} on the medium.
     *
     * @return {@link UStatus#ok()} on success, otherwise the failure
     */
    protected abstract UStatus sendImpl(UMessage message);

    /**
     * Starts delivering inbound messages matching the filters to {@code listener}.
     *
     * <p>The transport keeps the connection until
     * {@link #cleanupListener(CallableConn)} is called with an equal one. If
     * this method returns a failure, that call never happens.</p>
     */
    protected abstract UStatus registerListenerImpl(UUri sinkFilter,
                                                    CallableConn listener,
                                                    Optional<UUri> sourceFilter);

    /**
     * Stops delivering to {@code listener}. Called exactly once per successful
     * registration, after the connection stopped accepting invocations.
     */
    protected abstract void cleanupListener(CallableConn listener);
}
