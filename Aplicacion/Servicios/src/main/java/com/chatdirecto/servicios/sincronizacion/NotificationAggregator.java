package com.chatdirecto.servicios.sincronizacion;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import com.chatdirecto.entidades.Friendship;
import com.chatdirecto.entidades.Notification;
import com.chatdirecto.entidades.Profile;
import com.chatdirecto.servicios.eventos.SyncEventType;
import com.chatdirecto.servicios.feed.ChangeEvent;
import com.chatdirecto.servicios.feed.ChangeHandler;
import com.chatdirecto.servicios.feed.FeedTopic;
import com.chatdirecto.servicios.validacion.ValidationException;

/**
 * Notificaciones recientes y solicitudes de amistad entrantes del usuario. Ambas listas se
 * vuelven a consultar completas ante cualquier cambio en sus dos temas; solo la última
 * consulta emitida puede publicar su resultado.
 *
 * <p>El contador de no leídas suma notificaciones sin leer y solicitudes pendientes, por lo que
 * una solicitud cuenta dos veces mientras su notificación siga sin leer.
 *
 * <p>Las consultas que terminan después de cerrar la sesión no cambian las listas ni publican.
 */
public class NotificationAggregator implements ChangeHandler {

    private static final Logger LOGGER = Logger.getLogger(NotificationAggregator.class.getName());

    private final SessionContext session;
    private final int limit;

    private List<Notification> notifications = List.of();
    private List<FriendRequest> pendingRequests = List.of();
    private long issuedRefresh;

    public NotificationAggregator(SessionContext session) {
        this.session = Objects.requireNonNull(session, "session");
        this.limit = session.getConfig().getNotificationLimit();
    }

    public CompletableFuture<Integer> start() {
        String me = session.userId();
        session.getScope().open(session.getSubscriber(), FeedTopic.notificationsFor(me), this);
        session.getScope().open(session.getSubscriber(), FeedTopic.friendshipsAddressedTo(me), this);
        return refresh();
    }

    /**
     * Marca una notificación propia como leída y refresca las listas. Los errores remotos
     * se devuelven al llamador.
     */
    public CompletableFuture<Notification> markRead(String notificationId) {
        if (notificationId == null || notificationId.isBlank()) {
            ValidationException error = new ValidationException("Falta la notificación a marcar");
            session.reportFailure("mark_read", error);
            return CompletableFuture.failedFuture(error);
        }
        return session.getStore().notifications().markRead(notificationId, session.userId())
            .thenComposeAsync(updated -> refresh().handle((count, error) -> {
                if (error != null) {
                    LOGGER.log(Level.WARNING, "No se pudieron refrescar las notificaciones tras marcar "
                        + notificationId, SessionContext.unwrap(error));
                }
                return updated;
            }), session.getLoop())
            .whenComplete((updated, error) -> {
                if (error != null) {
                    session.reportFailure("mark_read", error);
                }
            });
    }

    /**
     * Consulta ambas listas. El futuro devuelve el contador vigente al terminar, aunque esta
     * consulta haya quedado obsoleta y no haya publicado nada.
     */
    public CompletableFuture<Integer> refresh() {
        long ticket = ++issuedRefresh;
        String me = session.userId();
        CompletableFuture<List<Notification>> recent = session.getStore().notifications().findRecentFor(me, limit);
        CompletableFuture<List<FriendRequest>> requests = session.getStore().friendships().findPendingFor(me)
            .thenCompose(this::withRequesters);
        return recent.thenCombine(requests, Snapshot::new)
            .thenApplyAsync(snapshot -> {
                if (ticket != issuedRefresh || session.isClosed()) {
                    LOGGER.fine(() -> "Refresco " + ticket + " de notificaciones obsoleto, se descarta");
                    return unreadCount();
                }
                notifications = Collections.unmodifiableList(snapshot.notifications);
                pendingRequests = Collections.unmodifiableList(snapshot.requests);
                int unread = unreadCount();
                session.getEventBus().publish(SyncEventType.NOTIFICATIONS_CHANGED, Map.of(
                    "unread", unread,
                    "pendingRequests", pendingRequests.size()));
                return unread;
            }, session.getLoop());
    }

    @Override
    public void onChange(ChangeEvent event) {
        if (session.isClosed()) {
            return;
        }
        LOGGER.fine(() -> "Cambio en " + event.getTopic() + ", refrescando notificaciones");
        refreshInBackground();
    }

    @Override
    public void onResubscribed(FeedTopic topic) {
        if (session.isClosed()) {
            return;
        }
        refreshInBackground();
    }

    public List<Notification> notifications() {
        return notifications;
    }

    public List<FriendRequest> pendingRequests() {
        return pendingRequests;
    }

    public int unreadCount() {
        long unreadNotifications = notifications.stream().filter(notification -> !notification.isRead()).count();
        return (int) unreadNotifications + pendingRequests.size();
    }

    private void refreshInBackground() {
        refresh().whenComplete((count, error) -> {
            if (error != null) {
                LOGGER.log(Level.WARNING, "No se pudieron refrescar las notificaciones", SessionContext.unwrap(error));
            }
        });
    }

    private CompletableFuture<List<FriendRequest>> withRequesters(List<Friendship> pending) {
        if (pending.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        List<String> requesterIds = pending.stream()
            .map(Friendship::getRequesterId)
            .distinct()
            .collect(Collectors.toList());
        return session.getStore().profiles().findByIds(requesterIds).thenApply(profiles -> {
            Map<String, Profile> byId = profiles.stream()
                .collect(Collectors.toMap(Profile::getId, Function.identity(), (a, b) -> a));
            return pending.stream()
                .map(friendship -> new FriendRequest(friendship, byId.get(friendship.getRequesterId())))
                .collect(Collectors.toList());
        });
    }

    private static final class Snapshot {
        private final List<Notification> notifications;
        private final List<FriendRequest> requests;

        private Snapshot(List<Notification> notifications, List<FriendRequest> requests) {
            this.notifications = notifications;
            this.requests = requests;
        }
    }
}
