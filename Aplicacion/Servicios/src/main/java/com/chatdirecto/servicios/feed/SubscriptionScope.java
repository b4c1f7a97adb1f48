package com.chatdirecto.servicios.feed;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Agrupa las suscripciones abiertas durante una sesión o una conversación y las libera
 * juntas al cerrarse, en orden inverso de apertura. Una vez cerrado, todo lo que se
 * registre se cierra de inmediato.
 */
public final class SubscriptionScope implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(SubscriptionScope.class.getName());

    private final String name;
    private final Deque<SubscriptionHandle> handles = new ArrayDeque<>();
    private boolean closed;

    public SubscriptionScope(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public SubscriptionHandle open(ChangeFeedSubscriber subscriber, FeedTopic topic, ChangeHandler handler) {
        return track(subscriber.subscribe(topic, handler));
    }

    /**
     * @throws IllegalStateException si el ámbito ya se cerró; el handle queda cerrado
     */
    public synchronized SubscriptionHandle track(SubscriptionHandle handle) {
        Objects.requireNonNull(handle, "handle");
        if (closed) {
            handle.close();
            throw new IllegalStateException("El ámbito " + name + " ya está cerrado");
        }
        handles.push(handle);
        return handle;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized int size() {
        return handles.size();
    }

    public String getName() {
        return name;
    }

    @Override
    public void close() {
        Deque<SubscriptionHandle> toClose;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            toClose = new ArrayDeque<>(handles);
            handles.clear();
        }
        RuntimeException failure = null;
        for (SubscriptionHandle handle : toClose) {
            try {
                handle.close();
            } catch (RuntimeException ex) {
                if (failure == null) {
                    failure = ex;
                } else {
                    failure.addSuppressed(ex);
                }
            }
        }
        LOGGER.fine(() -> "Ámbito " + name + " cerrado (" + toClose.size() + " suscripciones)");
        if (failure != null) {
            throw failure;
        }
    }
}
