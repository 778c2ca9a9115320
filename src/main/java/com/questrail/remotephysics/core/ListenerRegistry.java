package com.questrail.remotephysics.core;

import com.questrail.remotephysics.api.Subscription;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * ListenerRegistry
 * -----------------------------------------------------------------------------
 * Subscriber list for one event type.
 *
 * <h2>Threading model</h2>
 * Registration and removal are guarded by a single private lock. Every
 * mutation publishes a fresh immutable snapshot; {@link #dispatch(Consumer)}
 * reads the current snapshot once and invokes listeners with no lock held, so
 * a listener may subscribe or cancel from inside its own callback.
 *
 * <h2>Failure isolation</h2>
 * A listener that throws does not prevent delivery to the listeners after it.
 * The failure is handed to the registry's failure handler.
 *
 * @param <L> listener type
 */
public final class ListenerRegistry<L>
{
    private final Object lock = new Object();

    private final String eventName;
    private final BiConsumer<String, RuntimeException> failureHandler;

    private volatile List<L> snapshot = List.of();

    public ListenerRegistry(String eventName, BiConsumer<String, RuntimeException> failureHandler)
    {
        this.eventName = Objects.requireNonNull(eventName, "eventName");
        this.failureHandler = Objects.requireNonNull(failureHandler, "failureHandler");
    }

    public Subscription add(L listener)
    {
        Objects.requireNonNull(listener, "listener");

        synchronized (lock) {
            List<L> next = new ArrayList<>(snapshot.size() + 1);
            next.addAll(snapshot);
            next.add(listener);
            snapshot = List.copyOf(next);
        }
        return () -> remove(listener);
    }

    /**
     * Removes one registration of {@code listener}.
     *
     * @return {@code true} if a registration was removed
     */
    public boolean remove(L listener)
    {
        synchronized (lock) {
            List<L> next = new ArrayList<>(snapshot);
            // Identity, not equals(): lambdas registered twice are two registrations.
            for (int i = 0; i < next.size(); i++) {
                if (next.get(i) == listener) {
                    next.remove(i);
                    snapshot = List.copyOf(next);
                    return true;
                }
            }
            return false;
        }
    }

    public void dispatch(Consumer<? super L> action)
    {
        List<L> current = snapshot;
        for (L listener : current) {
            try {
                action.accept(listener);
            }
            catch (RuntimeException e) {
                failureHandler.accept(eventName, e);
            }
        }
    }

    public int size()
    {
        return snapshot.size();
    }

    public boolean isEmpty()
    {
        return snapshot.isEmpty();
    }

    public String eventName()
    {
        return eventName;
    }
}
