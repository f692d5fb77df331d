package com.questrail.uprotocol.transport;

import com.questrail.uprotocol.api.UMessage;

import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * CallableConn
 * =============================================================================
 * Identity-comparable connection to a registered {@link UListener}.
 *
 * <h2>Identity</h2>
 * <p>
 * A connection is shared by reference between the caller's
 * {@link ListenerHandle}, the transport's registration record and the cleanup
 * call. Equality is reference identity: two connections are equal iff they are
 * the same registration, even when two registrations wrap the same listener
 * object. Transports may therefore use connections as map keys.
 * </p>
 *
 * <h2>Validity</h2>
 * <p>
 * {@link #isValid()} is {@code true} until the connection is invalidated by
 * handle release or by a failed registration. Invoking an invalid connection
 * does nothing and returns {@code false}.
 * </p>
 *
 * <h2>Invocation vs. invalidation</h2>
 * <p>
 * Invocations hold the read side of a lock; invalidation takes the write side.
 * Once invalidation has started no new invocation begins, and invalidation
 * returns only after in-flight invocations have completed. A listener that
 * releases its own handle from inside {@link UListener#onReceive} seals the
 * connection without waiting for itself, but still waits for invocations
 * running on other threads.
 * </p>
 */
public final class CallableConn
{
    private final ReentrantReadWriteLock gate = new ReentrantReadWriteLock();

    // Signalled when an invocation of an invalidated connection leaves the gate.
    private final ReentrantLock drainLock = new ReentrantLock();
    private final Condition drained = drainLock.newCondition();

    private volatile UListener listener;

    private CallableConn(UListener listener) {
        this.listener = listener;
    }

    public static CallableConn of(UListener listener) {
        return new CallableConn(Objects.requireNonNull(listener, "listener"));
    }

    public boolean isValid() {
        return listener != null;
    }

    /**
     * Invokes the listener with {@code message} if the connection is still valid.
     *
     * <p>Exceptions thrown by the listener propagate to the caller.</p>
     *
     * @return {@code true} if the listener ran
     */
    public boolean invoke(UMessage message) {
        Objects.requireNonNull(message, "message");

        ReentrantReadWriteLock.ReadLock readLock = gate.readLock();
        readLock.lock();
        try {
            UListener l = listener;
            if (l == null) {
                return false;
            }
            l.onReceive(message);
            return true;
        } finally {
            readLock.unlock();
            if (listener == null) {
                signalDrained();
            }
        }
    }

    /**
     * Releases the listener. Idempotent.
     */
    void invalidate() {
        if (gate.getReadHoldCount() > 0) {
            // Called from inside our own invocation; waiting for the write lock would deadlock.
            listener = null;
            awaitOtherInvocations();
            return;
        }

        ReentrantReadWriteLock.WriteLock writeLock = gate.writeLock();
        writeLock.lock();
        try {
            listener = null;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Blocks until the only read holds left on the gate are the caller's own.
     */
    private void awaitOtherInvocations() {
        drainLock.lock();
        try {
            while (gate.getReadLockCount() > gate.getReadHoldCount()) {
                drained.awaitUninterruptibly();
            }
        } finally {
            drainLock.unlock();
        }
    }

    private void signalDrained() {
        drainLock.lock();
        try {
            drained.signalAll();
        } finally {
            drainLock.unlock();
        }
    }

    @Override
    public String toString() {
        return "CallableConn@" + Integer.toHexString(System.identityHashCode(this))
                + (isValid() ? "[valid]" : "[invalid]");
    }
}
