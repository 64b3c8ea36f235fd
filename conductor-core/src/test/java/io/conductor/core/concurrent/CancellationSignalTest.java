package io.conductor.core.concurrent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class CancellationSignalTest {

    @Test
    void shouldRunCallbacksOnceOnCancel() {
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger calls = new AtomicInteger();
        signal.onCancel(calls::incrementAndGet);

        signal.cancel();
        signal.cancel();

        assertThat(signal.isCancelled()).isTrue();
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void shouldRunLateCallbackImmediately() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();
        AtomicInteger calls = new AtomicInteger();

        signal.onCancel(calls::incrementAndGet);

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void shouldKeepRunningCallbacksWhenOneThrows() {
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger calls = new AtomicInteger();
        signal.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        signal.onCancel(calls::incrementAndGet);

        assertThatCode(signal::cancel).doesNotThrowAnyException();
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void shouldDropCallbackWhenRegistrationClosed() {
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger calls = new AtomicInteger();

        for (int i = 0; i < 5; i++) {
            try (CancellationSignal.Registration ignored = signal.onCancel(calls::incrementAndGet)) {
                assertThat(signal.callbackCount()).isEqualTo(1);
            }
        }
        signal.cancel();

        assertThat(signal.callbackCount()).isZero();
        assertThat(calls.get()).isZero();
    }

    @Test
    void shouldThrowOnlyAfterCancel() {
        CancellationSignal signal = CancellationSignal.none();

        assertThatCode(signal::throwIfCancelled).doesNotThrowAnyException();
        signal.cancel();
        assertThatThrownBy(signal::throwIfCancelled).isInstanceOf(CancellationException.class);
    }
}
