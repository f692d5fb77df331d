package com.questrail.uprotocol.transport.local;

import com.questrail.uprotocol.api.UCode;
import com.questrail.uprotocol.api.UMessage;
import com.questrail.uprotocol.api.UStatus;
import com.questrail.uprotocol.api.UUri;
import com.questrail.uprotocol.config.LocalTransportConfig;
import com.questrail.uprotocol.config.TransportConfig;
import com.questrail.uprotocol.transport.CallableConn;
import com.questrail.uprotocol.transport.UTransport;
import com.questrail.uprotocol.utils.SafeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * LocalUTransport
 * =============================================================================
 * In-process {@link UTransport}: messages sent through it are delivered to the
 * listeners registered on the same instance.
 *
 * <h2>Matching</h2>
 * <p>
 * A registration receives a message when its source filter (if any) matches
 * the message source and its sink filter matches the message sink. Messages
 * without a sink (publications) only reach registrations whose sink filter is
 * {@link UUri#ANY}; such listeners normally restrict the topic with a source
 * filter. Matching uses {@link UriFilters}.
 * </p>
 *
 * <h2>Delivery</h2>
 * <ul>
 *   <li>{@code SYNCHRONOUS}: listeners run on the sending thread before
 *       {@code send} returns.</li>
 *   <li>{@code QUEUED}: messages go into a bounded queue drained in order by
 *       one dispatcher thread. If no space frees up within the configured
 *       offer timeout, {@code send} returns {@link UCode#RESOURCE_EXHAUSTED}.</li>
 * </ul>
 *
 * <p>
 * A listener that throws is reported to the observability sink; delivery to
 * the other listeners continues. Released listeners are never invoked again,
 * and releasing waits for an in-flight delivery to the same listener.
 * </p>
 */
public final class LocalUTransport extends UTransport implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(LocalUTransport.class);

    private static final long POLL_INTERVAL_MILLIS = 50;

    private final LocalTransportConfig localConfig;
    private final SafeMap<CallableConn, Registration> registrations = new SafeMap<>();

    private final BlockingQueue<UMessage> queue;
    private final ExecutorService dispatcher;

    // Enqueueing holds the read side; close() flips the flag under the write side.
    private final ReentrantReadWriteLock admission = new ReentrantReadWriteLock();

    private volatile boolean closed;

    public LocalUTransport(UUri defaultSource) {
        this(TransportConfig.of(defaultSource), LocalTransportConfig.synchronous());
    }

    public LocalUTransport(TransportConfig config, LocalTransportConfig localConfig) {
        super(config);
        this.localConfig = Objects.requireNonNull(localConfig, "localConfig");

        if (localConfig.deliveryMode() == LocalTransportConfig.DeliveryMode.QUEUED) {
            this.queue = new ArrayBlockingQueue<>(localConfig.queueCapacity());
            this.dispatcher = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "local-utransport-dispatch");
                t.setDaemon(true);
                return t;
            });
            this.dispatcher.execute(this::drainLoop);
        } else {
            this.queue = null;
            this.dispatcher = null;
        }
    }

    /**
     * Number of live registrations.
     */
    public int registrationCount() {
        return registrations.size();
    }

    @Override
    protected UStatus sendImpl(UMessage message) {
        if (closed) {
            return UStatus.of(UCode.UNAVAILABLE, "transport is closed");
        }

        if (queue == null) {
            dispatch(message);
            return UStatus.ok();
        }

        return enqueue(message);
    }

    private UStatus enqueue(UMessage message) {
        ReentrantReadWriteLock.ReadLock readLock = admission.readLock();
        readLock.lock();
        try {
            if (closed) {
                return UStatus.of(UCode.UNAVAILABLE, "transport is closed");
            }
            boolean accepted = queue.offer(
                    message, localConfig.offerTimeout().toNanos(), TimeUnit.NANOSECONDS);
            if (!accepted) {
                return UStatus.of(UCode.RESOURCE_EXHAUSTED,
                        "dispatch queue full (capacity " + localConfig.queueCapacity() + ")");
            }
            return UStatus.ok();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return UStatus.of(UCode.CANCELLED, "interrupted while waiting for queue space");
        } finally {
            readLock.unlock();
        }
    }

    @Override
    protected UStatus registerListenerImpl(UUri sinkFilter, CallableConn listener, Optional<UUri> sourceFilter) {
        if (closed) {
            return UStatus.of(UCode.UNAVAILABLE, "transport is closed");
        }
        boolean added = registrations.putIfAbsent(listener, new Registration(sinkFilter, sourceFilter));
        if (!added) {
            return UStatus.of(UCode.ALREADY_EXISTS, "listener already registered");
        }
        return UStatus.ok();
    }

    @Override
    protected void cleanupListener(CallableConn listener) {
        if (registrations.remove(listener).isEmpty()) {
            log.debug("cleanup for unknown listener {}", listener);
        }
    }

    /**
     * Stops accepting messages and registrations. Queued messages that were
     * already accepted are still delivered before the dispatcher exits.
     */
    @Override
    public void close() {
        ReentrantReadWriteLock.WriteLock writeLock = admission.writeLock();
        writeLock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
        } finally {
            writeLock.unlock();
        }

        if (dispatcher != null) {
            dispatcher.shutdown();
            try {
                if (!dispatcher.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("dispatcher did not drain within 5s; {} messages dropped", queue.size());
                    dispatcher.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                dispatcher.shutdownNow();
            }
        }
    }

    private void drainLoop() {
        try {
            while (!closed || !queue.isEmpty()) {
                UMessage message = queue.poll(POLL_INTERVAL_MILLIS, TimeUnit.MILLISECONDS);
                if (message == null) {
                    continue;
                }
                try {
                    dispatch(message);
                } catch (Error e) {
                    log.error("listener error while dispatching {}; dispatcher continues",
                            message.attributes().id(), e);
                    reportError("listener error while handling " + message.attributes().id(), e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void dispatch(UMessage message) {
        List<CallableConn> targets = registrations.read(m -> m.entrySet().stream()
                .filter(e -> e.getValue().accepts(message))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList()));

        for (CallableConn target : targets) {
            try {
                target.invoke(message);
            } catch (RuntimeException e) {
                reportError("listener threw while handling " + message.attributes().id(), e);
            }
        }
    }

    /**
     * Filters of one registration.
     */
    private record Registration(UUri sinkFilter, Optional<UUri> sourceFilter) {

        boolean accepts(UMessage message) {
            if (sourceFilter.isPresent()
                    && !UriFilters.matches(sourceFilter.get(), message.attributes().source())) {
                return false;
            }
            return message.attributes().sink()
                    .map(sink -> UriFilters.matches(sinkFilter, sink))
                    .orElseGet(() -> sinkFilter.equals(UUri.ANY));
        }
    }
}
