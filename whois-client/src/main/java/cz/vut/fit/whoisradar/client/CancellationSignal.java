package cz.vut.fit.whoisradar.client;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A signal used to cancel an asynchronous lookup. Once fired, it stays fired.
 * <p>
 * Components that perform cancellable work register an action that aborts it. Actions registered after the
 * signal has fired are run immediately, on the registering thread.
 *
 * @author WhoisRadar contributors
 */
public final class CancellationSignal {
    private static final CancellationSignal NONE = new CancellationSignal(false);

    private final AtomicBoolean _cancelled = new AtomicBoolean();
    private final List<Runnable> _actions = new CopyOnWriteArrayList<>();
    private final boolean _cancellable;

    private CancellationSignal(boolean cancellable) {
        _cancellable = cancellable;
    }

    public CancellationSignal() {
        this(true);
    }

    /**
     * Returns a signal that never fires.
     */
    public static CancellationSignal none() {
        return NONE;
    }

    /**
     * Fires the signal and runs all registered actions. Subsequent calls have no effect.
     */
    public void cancel() {
        if (!_cancellable)
            throw new IllegalStateException("This signal cannot be cancelled");

        if (_cancelled.compareAndSet(false, true)) {
            // Whoever removes an action runs it, so that each action runs exactly once
            for (var action : _actions) {
                if (_actions.remove(action))
                    action.run();
            }
        }
    }

    public boolean isCancelled() {
        return _cancelled.get();
    }

    /**
     * Registers an action to run when the signal fires.
     *
     * @param action The action.
     * @return A registration that removes the action when the work it aborts has finished.
     */
    public Registration register(@NotNull Runnable action) {
        if (!_cancellable)
            return () -> {
            };

        _actions.add(action);
        // The signal may have fired before the action was added
        if (_cancelled.get() && _actions.remove(action)) {
            action.run();
        }
        return () -> _actions.remove(action);
    }

    /**
     * Creates the exception that cancelled operations fail with.
     */
    public static CancellationException cancelled(String what) {
        return new CancellationException(what + " cancelled");
    }

    /**
     * A registered cancellation action.
     */
    @FunctionalInterface
    public interface Registration {
        void unregister();
    }
}
