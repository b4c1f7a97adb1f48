package com.chatdirecto.servicios.sincronizacion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import com.chatdirecto.entidades.Friendship;
import com.chatdirecto.entidades.FriendshipStatus;
import com.chatdirecto.entidades.Notification;
import com.chatdirecto.entidades.NotificationKind;
import com.chatdirecto.entidades.Profile;
import com.chatdirecto.repositorios.FriendshipRepository;
import com.chatdirecto.repositorios.excepciones.ConflictException;
import com.chatdirecto.servicios.eventos.SyncEventType;
import com.chatdirecto.servicios.feed.ChangeEvent;
import com.chatdirecto.servicios.feed.ChangeHandler;
import com.chatdirecto.servicios.feed.FeedTopic;
import com.chatdirecto.servicios.validacion.ValidationException;

/**
 * Mantiene el conjunto local de amistades del usuario y la lista de amigos derivada.
 *
 * <p>La lista se recalcula completa a partir de todas las filas locales en cada cambio. Una fila
 * que ya está aceptada o rechazada localmente no se sobrescribe con otro estado: los eventos
 * desordenados o inválidos se registran y se ignoran. Tras cerrar la sesión, las respuestas
 * pendientes ya no tocan el estado local ni publican cambios.
 */
public class FriendshipSynchronizer implements ChangeHandler {

    private static final Logger LOGGER = Logger.getLogger(FriendshipSynchronizer.class.getName());

    static final String FRIEND_REQUEST_TEXT = "Tienes una nueva solicitud de amistad";
    static final String FRIEND_ACCEPTED_TEXT = "Tu solicitud de amistad fue aceptada";

    private final SessionContext session;
    private final FriendshipRepository friendships;

    private final Map<String, Friendship> rows = new LinkedHashMap<>();
    private final Map<String, Profile> profileCache = new HashMap<>();
    private List<Profile> friends = List.of();

    public FriendshipSynchronizer(SessionContext session) {
        this.session = Objects.requireNonNull(session, "session");
        this.friendships = session.getStore().friendships();
    }

    /**
     * Consulta todas las amistades del usuario y se suscribe a sus cambios.
     */
    public CompletableFuture<List<Profile>> start() {
        session.getScope().open(session.getSubscriber(), FeedTopic.friendshipsTouching(session.userId()), this);
        return fetchAll();
    }

    public CompletableFuture<Friendship> requestFriend(String targetId) {
        String me = session.userId();
        if (targetId == null || targetId.isBlank()) {
            return fail("request_friend", new ValidationException("Debes indicar a quién enviar la solicitud"));
        }
        if (targetId.equals(me)) {
            return fail("request_friend", new ValidationException("No puedes enviarte una solicitud a ti mismo"));
        }
        return friendships.findBetween(me, targetId)
            .thenComposeAsync(existing -> {
                if (existing.isPresent()) {
                    throw new ConflictException(existing.get().getStatus() == FriendshipStatus.ACCEPTED
                        ? "Ya son amigos"
                        : "Ya existe una solicitud de amistad entre ambos usuarios");
                }
                return friendships.insert(new Friendship(me, targetId));
            }, session.getLoop())
            .thenApplyAsync(created -> {
                if (!session.isClosed() && apply(created)) {
                    recomputeFriends();
                }
                LOGGER.info(() -> "Solicitud de amistad " + created.getId() + " enviada a " + targetId);
                session.getEventBus().publish(SyncEventType.FRIEND_REQUEST_SENT, Map.of("friendshipId", created.getId()));
                return created;
            }, session.getLoop())
            .thenCompose(created -> session.notifyBestEffort(
                    new Notification(targetId, NotificationKind.FRIEND_REQUEST, FRIEND_REQUEST_TEXT, me))
                .thenApply(ignored -> created))
            .whenComplete((created, error) -> {
                if (error != null) {
                    session.reportFailure("request_friend", error);
                }
            });
    }

    /**
     * Acepta o rechaza una solicitud dirigida al usuario. Al aceptar, avisa al solicitante.
     */
    public CompletableFuture<Friendship> respond(String friendshipId, boolean accept) {
        if (friendshipId == null || friendshipId.isBlank()) {
            return fail("respond", new ValidationException("Falta la solicitud a responder"));
        }
        FriendshipStatus next = accept ? FriendshipStatus.ACCEPTED : FriendshipStatus.REJECTED;
        return friendships.updateStatus(friendshipId, next, session.userId())
            .thenApplyAsync(updated -> {
                if (!session.isClosed() && apply(updated)) {
                    recomputeFriends();
                }
                session.getEventBus().publish(SyncEventType.FRIEND_REQUEST_ANSWERED, Map.of(
                    "friendshipId", updated.getId(),
                    "status", updated.getStatus().wireValue()));
                return updated;
            }, session.getLoop())
            .thenCompose(updated -> {
                if (!accept) {
                    return CompletableFuture.completedFuture(updated);
                }
                Notification accepted = new Notification(updated.getRequesterId(), NotificationKind.FRIEND_ACCEPTED,
                    FRIEND_ACCEPTED_TEXT, session.userId());
                return session.notifyBestEffort(accepted).thenApply(ignored -> updated);
            })
            .whenComplete((updated, error) -> {
                if (error != null) {
                    session.reportFailure("respond", error);
                }
            });
    }

    @Override
    public void onChange(ChangeEvent event) {
        if (!session.isClosed() && apply(event.friendship())) {
            recomputeFriends();
        }
    }

    @Override
    public void onResubscribed(FeedTopic topic) {
        if (session.isClosed()) {
            return;
        }
        fetchAll().whenComplete((ignored, error) -> {
            if (error != null) {
                LOGGER.log(Level.WARNING, "No se pudo actualizar la lista de amistades tras reconectar",
                    SessionContext.unwrap(error));
            }
        });
    }

    public List<Profile> friends() {
        return friends;
    }

    public List<Friendship> friendships() {
        return new ArrayList<>(rows.values());
    }

    public List<Friendship> pendingIncoming() {
        return pending(friendship -> session.userId().equals(friendship.getAddresseeId()));
    }

    public List<Friendship> pendingOutgoing() {
        return pending(friendship -> session.userId().equals(friendship.getRequesterId()));
    }

    private List<Friendship> pending(Predicate<Friendship> side) {
        return rows.values().stream()
            .filter(friendship -> friendship.getStatus() == FriendshipStatus.PENDING)
            .filter(side)
            .collect(Collectors.toList());
    }

    private CompletableFuture<List<Profile>> fetchAll() {
        return friendships.findTouching(session.userId())
            .thenComposeAsync(fetched -> {
                if (session.isClosed()) {
                    return CompletableFuture.completedFuture(friends);
                }
                fetched.forEach(this::apply);
                return recomputeFriends();
            }, session.getLoop());
    }

    /**
     * Aplica una fila al estado local. Devuelve {@code true} si algo cambió.
     */
    boolean apply(Friendship incoming) {
        if (incoming == null || incoming.getId() == null || !incoming.involves(session.userId())) {
            return false;
        }
        Friendship current = rows.get(incoming.getId());
        if (current != null && current.getStatus() != null && current.getStatus().isTerminal()) {
            if (current.getStatus() != incoming.getStatus()) {
                LOGGER.warning(() -> "Se ignora el cambio de la amistad " + incoming.getId() + " de "
                    + current.getStatus().wireValue() + " a "
                    + (incoming.getStatus() != null ? incoming.getStatus().wireValue() : null));
                session.getEventBus().publish(SyncEventType.EVENT_DISCARDED, Map.of(
                    "reason", "terminal_status",
                    "rowId", incoming.getId()));
            }
            return false;
        }
        if (incoming.getStatus() == null) {
            LOGGER.warning(() -> "Amistad " + incoming.getId() + " sin estado, ignorada");
            return false;
        }
        rows.put(incoming.getId(), incoming);
        return current == null || current.getStatus() != incoming.getStatus();
    }

    private CompletableFuture<List<Profile>> recomputeFriends() {
        List<String> friendIds = acceptedFriendIds();
        Set<String> missing = friendIds.stream()
            .filter(id -> !profileCache.containsKey(id))
            .collect(Collectors.toCollection(LinkedHashSet::new));
        if (missing.isEmpty()) {
            publishFriends();
            return CompletableFuture.completedFuture(friends);
        }
        return session.getStore().profiles().findByIds(missing)
            .handleAsync((profiles, error) -> {
                if (session.isClosed()) {
                    return friends;
                }
                if (error != null) {
                    LOGGER.log(Level.WARNING, "No se pudieron cargar los perfiles de " + missing, SessionContext.unwrap(error));
                } else {
                    profiles.forEach(profile -> profileCache.put(profile.getId(), profile));
                }
                publishFriends();
                return friends;
            }, session.getLoop());
    }

    private void publishFriends() {
        List<Profile> resolved = new ArrayList<>();
        for (String friendId : acceptedFriendIds()) {
            Profile profile = profileCache.get(friendId);
            if (profile != null) {
                resolved.add(profile);
            }
        }
        resolved.sort(Comparator.comparing(Profile::getUsername, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER)));
        friends = Collections.unmodifiableList(resolved);
        session.getEventBus().publish(SyncEventType.FRIENDS_CHANGED, Map.of(
            "friends", friends.size(),
            "pendingIncoming", pendingIncoming().size()));
    }

    private List<String> acceptedFriendIds() {
        String me = session.userId();
        return rows.values().stream()
            .filter(friendship -> friendship.getStatus() == FriendshipStatus.ACCEPTED)
            .map(friendship -> friendship.otherParty(me))
            .distinct()
            .collect(Collectors.toList());
    }

    private <T> CompletableFuture<T> fail(String action, RuntimeException error) {
        session.reportFailure(action, error);
        return CompletableFuture.failedFuture(error);
    }
}
