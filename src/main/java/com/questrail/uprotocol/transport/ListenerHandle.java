package com.questrail.uprotocol.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.Cleaner;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * ListenerHandle
 * =============================================================================
 * Single-owner handle for a successful listener registration.
 *
 * <h2>Exactly-once cleanup</h2>
 * <p>
 * Releasing the handle ({@link #release()} or {@link #close()}) unregisters the
 * listener: the connection is invalidated and the transport's cleanup hook
 * receives the very {@link CallableConn} that was registered. An atomic guard
 * makes this happen once per registration no matter how many code paths
 * release it. Later releases are no-ops.
 * </p>
 *
 * <h2>Ownership transfer</h2>
 * <p>
 * Handles cannot be copied. {@link #transfer()} moves the cleanup obligation to
 * a new handle and leaves this one inert.
 * </p>
 *
 * <h2>Dropped handles</h2>
 * <p>
 * A handle that becomes unreachable while still active is released by a
 * {@link Cleaner} on the cleaner's thread, and a warning is logged. Callers
 * should release handles explicitly, ideally with try-with-resources.
 * </p>
 */
public final class ListenerHandle implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(ListenerHandle.class);

    private static final Cleaner CLEANER = Cleaner.create();

    private final Owner owner;
    private final Cleaner.Cleanable cleanable;

    ListenerHandle(CallableConn connection, Consumer<CallableConn> cleanup) {
        this(new Registration(
                Objects.requireNonNull(connection, "connection"),
                Objects.requireNonNull(cleanup, "cleanup")));
    }

    private ListenerHandle(Registration registration) {
        this.owner = new Owner(registration);
        this.cleanable = CLEANER.register(this, owner);
    }

    /**
     * Returns {@code true} while this handle still owes a cleanup.
     */
    public boolean isActive() {
        return owner.current() != null;
    }

    /**
     * The registered connection, while this handle is active.
     */
    public Optional<CallableConn> connection() {
        Registration r = owner.current();
        return r == null ? Optional.empty() : Optional.of(r.connection);
    }

    /**
     * Unregisters the listener. Runs synchronously on the calling thread and
     * does nothing if the handle is inert.
     */
    public void release() {
        Registration r = owner.detach();
        cleanable.clean();
        if (r != null) {
            r.release();
        }
    }

    @Override
    public void close() {
        release();
    }

    /**
     * Moves the cleanup obligation to a new handle. This handle becomes inert.
     * Transferring an inert handle yields an inert handle.
     */
    public ListenerHandle transfer() {
        Registration r = owner.detach();
        cleanable.clean();
        return new ListenerHandle(r);
    }

    @Override
    public String toString() {
        Registration r = owner.current();
        return "ListenerHandle[" + (r == null ? "inert" : r.connection) + "]";
    }

    /**
     * The shared cleanup state of one registration.
     */
    private static final class Registration {
        private final CallableConn connection;
        private final Consumer<CallableConn> cleanup;
        private final AtomicBoolean released = new AtomicBoolean();

        private Registration(CallableConn connection, Consumer<CallableConn> cleanup) {
            this.connection = connection;
            this.cleanup = cleanup;
        }

        private void release() {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            connection.invalidate();
            cleanup.accept(connection);
        }
    }

    /**
     * Cleaner action. Must not reference the handle itself.
     */
    private static final class Owner implements Runnable {
        private final AtomicReference<Registration> registration;

        private Owner(Registration registration) {
            this.registration = new AtomicReference<>(registration);
        }

        private Registration current() {
            return registration.get();
        }

        private Registration detach() {
            return registration.getAndSet(null);
        }

        @Override
        public void run() {
            Registration r = detach();
            if (r != null) {
                log.warn("ListenerHandle for {} became unreachable without release; cleaning up", r.connection);
                r.release();
            }
        }
    }
}
