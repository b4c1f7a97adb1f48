package com.chatdirecto.controladores;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.chatdirecto.config.ClientConfig;
import com.chatdirecto.entidades.Friendship;
import com.chatdirecto.entidades.Message;
import com.chatdirecto.entidades.Notification;
import com.chatdirecto.entidades.Profile;
import com.chatdirecto.repositorios.RemoteStore;
import com.chatdirecto.repositorios.excepciones.NotFoundException;
import com.chatdirecto.servicios.eventos.SyncEventBus;
import com.chatdirecto.servicios.eventos.SyncEventType;
import com.chatdirecto.servicios.feed.ChangeFeedSubscriber;
import com.chatdirecto.servicios.metrics.MetricsSyncObserver;
import com.chatdirecto.servicios.sincronizacion.ConversationSynchronizer;
import com.chatdirecto.servicios.sincronizacion.FriendRequest;
import com.chatdirecto.servicios.sincronizacion.FriendshipSynchronizer;
import com.chatdirecto.servicios.sincronizacion.MediaUpload;
import com.chatdirecto.servicios.sincronizacion.NotificationAggregator;
import com.chatdirecto.servicios.sincronizacion.SessionContext;
import com.chatdirecto.servicios.sincronizacion.UserDirectory;
import com.chatdirecto.servicios.validacion.ValidationException;

/**
 * Punto de entrada de la capa de presentación. Inicia y cierra la sesión y encola cada acción
 * en el loop del cliente; todo lo que devuelve es un {@link CompletableFuture}.
 *
 * <p>Cerrar sesión libera de forma síncrona, dentro del loop, la conversación abierta y todas
 * las suscripciones de la sesión antes de que pueda crearse otra.
 */
public class ChatSessionController implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(ChatSessionController.class.getName());
    private static final String ROOT_LOGGER = "com.chatdirecto";

    private final RemoteStore store;
    private final ClientConfig config;
    private final Executor loop;
    private final ScheduledExecutorService retryScheduler;
    private final SyncEventBus eventBus;
    private final Clock clock;
    private final ChangeFeedSubscriber subscriber;
    private final ClientEventLoop ownedLoop;

    private ActiveSession active;

    public ChatSessionController(RemoteStore store, ClientConfig config) {
        this(store, config, new ClientEventLoop(config.getLoopShutdownTimeoutMs()), newRetryScheduler(),
            new SyncEventBus(), Clock.systemUTC(), true);
        new MetricsSyncObserver(eventBus);
    }

    public ChatSessionController(RemoteStore store,
                                 ClientConfig config,
                                 Executor loop,
                                 ScheduledExecutorService retryScheduler,
                                 SyncEventBus eventBus,
                                 Clock clock) {
        this(store, config, loop, retryScheduler, eventBus, clock, false);
    }

    private ChatSessionController(RemoteStore store,
                                  ClientConfig config,
                                  Executor loop,
                                  ScheduledExecutorService retryScheduler,
                                  SyncEventBus eventBus,
                                  Clock clock,
                                  boolean ownsExecutors) {
        this.store = Objects.requireNonNull(store, "store");
        this.config = Objects.requireNonNull(config, "config");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.retryScheduler = Objects.requireNonNull(retryScheduler, "retryScheduler");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ownedLoop = ownsExecutors ? (ClientEventLoop) loop : null;
        this.subscriber = new ChangeFeedSubscriber(store.feed(), loop, retryScheduler, config, eventBus);
        configureLogging(config);
    }

    // --- Sesión ---

    /**
     * Inicia sesión como {@code userId}, cerrando antes cualquier sesión previa. El perfil debe
     * tener nombre de usuario. Termina cuando las amistades y las notificaciones están cargadas.
     */
    public CompletableFuture<Profile> signIn(String userId) {
        if (userId == null || userId.isBlank()) {
            return CompletableFuture.failedFuture(new ValidationException("Falta el usuario"));
        }
        return onLoop(() -> store.profiles().findById(userId)
            .thenComposeAsync(found -> {
                Profile profile = found.orElseThrow(() -> new NotFoundException("No existe el perfil " + userId));
                if (profile.getUsername() == null || profile.getUsername().isBlank()) {
                    throw new ValidationException("Debes elegir un nombre de usuario antes de entrar");
                }
                return startSession(profile);
            }, loop));
    }

    public CompletableFuture<Void> signOut() {
        return onLoop(() -> {
            endSession();
            return CompletableFuture.completedFuture(null);
        });
    }

    public CompletableFuture<Optional<Profile>> currentUser() {
        return onLoop(() -> CompletableFuture.completedFuture(
            Optional.ofNullable(active).map(session -> session.context.getProfile())));
    }

    // --- Amistades ---

    public CompletableFuture<Friendship> requestFriend(String targetId) {
        return inSession(session -> session.friendships.requestFriend(targetId));
    }

    public CompletableFuture<Friendship> respond(String friendshipId, boolean accept) {
        return inSession(session -> session.friendships.respond(friendshipId, accept));
    }

    public CompletableFuture<List<Profile>> friends() {
        return inSession(session -> CompletableFuture.completedFuture(session.friendships.friends()));
    }

    public CompletableFuture<List<Friendship>> pendingOutgoing() {
        return inSession(session -> CompletableFuture.completedFuture(session.friendships.pendingOutgoing()));
    }

    public CompletableFuture<List<Profile>> searchUsers(String query) {
        return inSession(session -> session.directory.search(query));
    }

    // --- Conversación ---

    public CompletableFuture<List<Message>> openConversation(String friendId) {
        return inSession(session -> session.conversation.open(friendId));
    }

    public CompletableFuture<Message> sendMessage(String content, MediaUpload media) {
        return inSession(session -> session.conversation.send(content, media));
    }

    public CompletableFuture<Void> closeConversation() {
        return inSession(session -> {
            session.conversation.close();
            return CompletableFuture.completedFuture(null);
        });
    }

    public CompletableFuture<List<Message>> messages() {
        return inSession(session -> CompletableFuture.completedFuture(session.conversation.messages()));
    }

    // --- Notificaciones ---

    public CompletableFuture<Notification> markNotificationRead(String notificationId) {
        return inSession(session -> session.notifications.markRead(notificationId));
    }

    public CompletableFuture<List<Notification>> notifications() {
        return inSession(session -> CompletableFuture.completedFuture(session.notifications.notifications()));
    }

    public CompletableFuture<List<FriendRequest>> pendingRequests() {
        return inSession(session -> CompletableFuture.completedFuture(session.notifications.pendingRequests()));
    }

    public CompletableFuture<Integer> unreadCount() {
        return inSession(session -> CompletableFuture.completedFuture(session.notifications.unreadCount()));
    }

    public SyncEventBus getEventBus() {
        return eventBus;
    }

    /**
     * Cierra la sesión, el suscriptor del feed y, si son propios, el loop y el planificador.
     */
    @Override
    public void close() {
        try {
            signOut().get(config.getLoopShutdownTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            LOGGER.log(Level.WARNING, "No se pudo cerrar la sesión de forma ordenada", e);
        } finally {
            subscriber.close();
            if (ownedLoop != null) {
                retryScheduler.shutdownNow();
                ownedLoop.close();
            }
        }
    }

    // --- Internos ---

    private CompletableFuture<Profile> startSession(Profile profile) {
        endSession();
        SessionContext context = new SessionContext(profile, store, subscriber, loop, eventBus, config, clock);
        ActiveSession session = new ActiveSession(context);
        active = session;
        LOGGER.info(() -> "Sesión iniciada como " + profile.getUsername());
        eventBus.publish(SyncEventType.SESSION_STARTED, Map.of("userId", profile.getId()));
        return CompletableFuture.allOf(session.friendships.start(), session.notifications.start())
            .handleAsync((ignored, error) -> {
                if (error != null) {
                    LOGGER.log(Level.WARNING, "No se pudo cargar el estado inicial de " + profile.getUsername(), error);
                    if (active == session) {
                        endSession();
                    }
                    throw error instanceof CompletionException
                        ? (CompletionException) error
                        : new CompletionException(error);
                }
                return profile;
            }, loop);
    }

    private void endSession() {
        ActiveSession session = active;
        if (session == null) {
            return;
        }
        active = null;
        try {
            session.conversation.close();
        } finally {
            session.context.close();
        }
        LOGGER.info(() -> "Sesión de " + session.context.username() + " cerrada");
        eventBus.publish(SyncEventType.SESSION_ENDED, Map.of("userId", session.context.userId()));
    }

    private <T> CompletableFuture<T> inSession(Function<ActiveSession, CompletableFuture<T>> action) {
        return onLoop(() -> {
            ActiveSession session = active;
            if (session == null) {
                throw new IllegalStateException("No hay una sesión iniciada");
            }
            return action.apply(session);
        });
    }

    private <T> CompletableFuture<T> onLoop(Supplier<CompletableFuture<T>> action) {
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            loop.execute(() -> {
                try {
                    action.get().whenComplete((value, error) -> {
                        if (error != null) {
                            result.completeExceptionally(unwrap(error));
                        } else {
                            result.complete(value);
                        }
                    });
                } catch (RuntimeException ex) {
                    result.completeExceptionally(ex);
                }
            });
        } catch (RejectedExecutionException ex) {
            result.completeExceptionally(new IllegalStateException("El controlador de sesión está cerrado", ex));
        }
        return result;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static void configureLogging(ClientConfig config) {
        Level level = config.getLogLevel();
        Logger.getLogger(ROOT_LOGGER).setLevel(level);
    }

    private static ScheduledExecutorService newRetryScheduler() {
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "chat-feed-retry");
            thread.setDaemon(true);
            return thread;
        });
    }

    private static final class ActiveSession {
        private final SessionContext context;
        private final FriendshipSynchronizer friendships;
        private final ConversationSynchronizer conversation;
        private final NotificationAggregator notifications;
        private final UserDirectory directory;

        private ActiveSession(SessionContext context) {
            this.context = context;
            this.friendships = new FriendshipSynchronizer(context);
            this.conversation = new ConversationSynchronizer(context);
            this.notifications = new NotificationAggregator(context);
            this.directory = new UserDirectory(context);
        }
    }
}
