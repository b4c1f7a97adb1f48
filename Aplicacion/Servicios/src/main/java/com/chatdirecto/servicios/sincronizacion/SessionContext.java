package com.chatdirecto.servicios.sincronizacion;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.chatdirecto.config.ClientConfig;
import com.chatdirecto.entidades.Notification;
import com.chatdirecto.entidades.Profile;
import com.chatdirecto.repositorios.RemoteStore;
import com.chatdirecto.servicios.eventos.SyncEventBus;
import com.chatdirecto.servicios.eventos.SyncEventType;
import com.chatdirecto.servicios.feed.ChangeFeedSubscriber;
import com.chatdirecto.servicios.feed.SubscriptionScope;

/**
 * Contexto de una sesión iniciada: el perfil actual y los colaboradores que comparten los
 * sincronizadores. Se crea al iniciar sesión y se cierra al salir; cerrarlo libera todas las
 * suscripciones abiertas con su ámbito.
 */
public final class SessionContext implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(SessionContext.class.getName());

    private final Profile profile;
    private final RemoteStore store;
    private final ChangeFeedSubscriber subscriber;
    private final Executor loop;
    private final SyncEventBus eventBus;
    private final ClientConfig config;
    private final Clock clock;
    private final SubscriptionScope scope;

    public SessionContext(Profile profile,
                          RemoteStore store,
                          ChangeFeedSubscriber subscriber,
                          Executor loop,
                          SyncEventBus eventBus,
                          ClientConfig config,
                          Clock clock) {
        this.profile = Objects.requireNonNull(profile, "profile");
        Objects.requireNonNull(profile.getId(), "profile.id");
        this.store = Objects.requireNonNull(store, "store");
        this.subscriber = Objects.requireNonNull(subscriber, "subscriber");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scope = new SubscriptionScope("session-" + profile.getId());
    }

    public String userId() {
        return profile.getId();
    }

    public String username() {
        return profile.getUsername();
    }

    public Profile getProfile() {
        return profile;
    }

    public RemoteStore getStore() {
        return store;
    }

    public ChangeFeedSubscriber getSubscriber() {
        return subscriber;
    }

    public Executor getLoop() {
        return loop;
    }

    public SyncEventBus getEventBus() {
        return eventBus;
    }

    public ClientConfig getConfig() {
        return config;
    }

    public Clock getClock() {
        return clock;
    }

    public SubscriptionScope getScope() {
        return scope;
    }

    public boolean isClosed() {
        return scope.isClosed();
    }

    /**
     * Inserta una notificación como efecto secundario de una escritura ya confirmada.
     * El futuro nunca falla: un error se registra y no cambia el resultado de la acción principal.
     */
    public CompletableFuture<Void> notifyBestEffort(Notification notification) {
        return store.notifications().insert(notification).handle((created, error) -> {
            if (error != null) {
                LOGGER.log(Level.WARNING, "No se pudo crear la notificación " + notification.getType().wireValue()
                    + " para " + notification.getUserId(), unwrap(error));
            }
            return null;
        });
    }

    /**
     * Anuncia el fallo de una acción del usuario y lo devuelve sin envolver.
     */
    Throwable reportFailure(String action, Throwable error) {
        Throwable cause = unwrap(error);
        LOGGER.log(Level.FINE, "Acción " + action + " fallida", cause);
        eventBus.publish(SyncEventType.ACTION_FAILED, Map.of(
            "action", action,
            "error", cause.getClass().getSimpleName()));
        return cause;
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @Override
    public void close() {
        scope.close();
        LOGGER.fine(() -> "Contexto de sesión de " + profile.getId() + " cerrado");
    }
}
