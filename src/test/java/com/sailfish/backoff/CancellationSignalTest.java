package com.sailfish.backoff;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class CancellationSignalTest {

    @Test
    @DisplayName("A new signal is not cancelled")
    void startsActive() {
        CancellationSignal signal = CancellationSignal.create();

        assertThat(signal.isCancelled()).isFalse();
        assertThat(signal.getReason()).isNull();
    }

    @Test
    @DisplayName("The first reason wins and later cancels are ignored")
    void firstReasonWins() {
        CancellationSignal signal = CancellationSignal.create();

        assertThat(signal.cancel("shutdown")).isTrue();
        assertThat(signal.cancel("second")).isFalse();

        assertThat(signal.isCancelled()).isTrue();
        assertThat(signal.getReason()).isEqualTo("shutdown");
    }

    @Test
    @DisplayName("Cancelling without a reason uses a CancellationException")
    void defaultReason() {
        CancellationSignal signal = CancellationSignal.create();

        signal.cancel();

        assertThat(signal.getReason()).isInstanceOf(CancellationException.class);
    }

    @Test
    @DisplayName("Listeners are notified once with the reason")
    @SuppressWarnings("unchecked")
    void notifiesListenersOnce() {
        // Given
        CancellationSignal signal = CancellationSignal.create();
        Consumer<Object> listener = mock(Consumer.class);
        signal.onCancel(listener);

        // When
        signal.cancel("stop");
        signal.cancel("again");

        // Then
        verify(listener, times(1)).accept("stop");
        verifyNoMoreInteractions(listener);
        assertThat(signal.listenerCount()).isZero();
    }

    @Test
    @DisplayName("Subscribing to a cancelled signal fires immediately")
    void lateSubscriberFiresImmediately() {
        CancellationSignal signal = CancellationSignal.create();
        signal.cancel("done");
        List<Object> seen = new ArrayList<>();

        signal.onCancel(seen::add);

        assertThat(seen).containsExactly("done");
        assertThat(signal.listenerCount()).isZero();
    }

    @Test
    @DisplayName("Closed subscriptions are not notified")
    @SuppressWarnings("unchecked")
    void closedSubscriptionIsSilent() {
        CancellationSignal signal = CancellationSignal.create();
        Consumer<Object> listener = mock(Consumer.class);
        CancellationSignal.Subscription subscription = signal.onCancel(listener);

        subscription.close();
        signal.cancel("ignored");

        verify(listener, never()).accept(any());
        assertThat(signal.listenerCount()).isZero();
    }

    @Test
    @DisplayName("A failing listener does not prevent others from being notified")
    void failingListenerIsIsolated() {
        CancellationSignal signal = CancellationSignal.create();
        AtomicInteger notified = new AtomicInteger();
        signal.onCancel(reason -> {
            throw new IllegalStateException("listener bug");
        });
        signal.onCancel(reason -> notified.incrementAndGet());

        signal.cancel("x");

        assertThat(notified.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("A listener throwing an Error does not stop notification of the others")
    void listenerErrorIsIsolated() {
        // Given
        CancellationSignal signal = CancellationSignal.create();
        AtomicInteger notified = new AtomicInteger();
        signal.onCancel(reason -> notified.incrementAndGet());
        signal.onCancel(reason -> {
            throw new AssertionError("listener invariant broken");
        });
        signal.onCancel(reason -> notified.incrementAndGet());

        // When
        boolean cancelled = signal.cancel("x");

        // Then
        assertThat(cancelled).isTrue();
        assertThat(notified.get()).isEqualTo(2);
        assertThat(signal.listenerCount()).isZero();
    }
}
