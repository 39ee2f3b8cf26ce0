package com.sailfish.backoff;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * A cooperative, one-shot cancellation handle shared between a caller and the backoff executor.
 *
 * Once cancelled the signal never returns to the uncancelled state, and the first reason supplied
 * is the one every observer sees. The signal can be polled with {@link #isCancelled()} or observed
 * through {@link #onCancel(Consumer)}.
 *
 * Thread-safe.
 */
public final class CancellationSignal {

    private static final Logger log = LoggerFactory.getLogger(CancellationSignal.class);

    private final AtomicReference<Object> reason = new AtomicReference<>();
    private final Set<ListenerRegistration> listeners = ConcurrentHashMap.newKeySet();

    private CancellationSignal() {
    }

    /**
     * Creates a new, not yet cancelled signal.
     */
    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    /**
     * Cancels with a default reason, a {@link CancellationException}.
     *
     * @return true if this call cancelled the signal, false if it was already cancelled.
     */
    public boolean cancel() {
        return cancel(new CancellationException("Cancellation requested"));
    }

    /**
     * Cancels the signal and notifies every registered listener on the calling thread. A listener
     * that throws is logged and does not keep the remaining listeners from being notified.
     *
     * @param reason Opaque value handed to observers. A null reason is replaced by the default one.
     * @return true if this call cancelled the signal, false if it was already cancelled.
     */
    public boolean cancel(Object reason) {
        Object effectiveReason = reason != null ? reason : new CancellationException("Cancellation requested");
        if (!this.reason.compareAndSet(null, effectiveReason)) {
            return false;
        }
        log.debug("Cancellation signalled with reason: {}", effectiveReason);
        for (ListenerRegistration registration : listeners) {
            listeners.remove(registration);
            registration.fire(effectiveReason);
        }
        return true;
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    /**
     * @return The cancellation reason, or null while not cancelled.
     */
    public Object getReason() {
        return reason.get();
    }

    /**
     * Registers a listener invoked at most once with the cancellation reason. If the signal is
     * already cancelled the listener runs immediately on the calling thread.
     *
     * @param listener Receives the reason.
     * @return A subscription that removes the listener when closed.
     */
    public Subscription onCancel(Consumer<Object> listener) {
        ListenerRegistration registration = new ListenerRegistration(listener);
        listeners.add(registration);
        Object current = reason.get();
        if (current != null) {
            // cancel() may have iterated before our add became visible
            listeners.remove(registration);
            registration.fire(current);
        }
        return registration;
    }

    /**
     * @return The number of listeners still waiting for cancellation.
     */
    public int listenerCount() {
        return listeners.size();
    }

    @Override
    public String toString() {
        Object current = reason.get();
        return current == null ? "CancellationSignal[active]" : "CancellationSignal[cancelled: " + current + "]";
    }

    /**
     * Handle returned by {@link #onCancel(Consumer)}.
     */
    public interface Subscription extends AutoCloseable {

        /**
         * Removes the listener. Has no effect once the listener has fired.
         */
        @Override
        void close();
    }

    private final class ListenerRegistration implements Subscription {

        private final Consumer<Object> listener;
        private final AtomicBoolean done = new AtomicBoolean();

        private ListenerRegistration(Consumer<Object> listener) {
            this.listener = Objects.requireNonNull(listener, "listener cannot be null");
        }

        private void fire(Object cancellationReason) {
            if (!done.compareAndSet(false, true)) {
                return;
            }
            try {
                listener.accept(cancellationReason);
            } catch (Throwable e) {
                log.warn("Cancellation listener {} failed: {}", listener, e.toString(), e);
            }
        }

        @Override
        public void close() {
            if (done.compareAndSet(false, true)) {
                listeners.remove(this);
            }
        }
    }
}
