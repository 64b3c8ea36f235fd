package io.conductor.core.concurrent;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cooperative cancellation shared between a caller and the provider or tool work it started.
 * Callbacks registered with {@link #onCancel(Runnable)} run once, on the cancelling thread,
 * or immediately when registered after cancellation.
 */
public final class CancellationSignal {
    private static final Logger LOG = LoggerFactory.getLogger(CancellationSignal.class);

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Runnable callback : callbacks) {
            if (callbacks.remove(callback)) {
                run(callback);
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Registers {@code callback}. Closing the returned registration removes it again.
     */
    public Registration onCancel(Runnable callback) {
        Runnable entry = callback::run;
        callbacks.add(entry);
        if (cancelled.get() && callbacks.remove(entry)) {
            run(entry);
        }
        return () -> callbacks.remove(entry);
    }

    int callbackCount() {
        return callbacks.size();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("operation cancelled");
        }
    }

    private void run(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            LOG.warn("Cancellation callback failed", e);
        }
    }

    /**
     * Handle of a registered callback.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
