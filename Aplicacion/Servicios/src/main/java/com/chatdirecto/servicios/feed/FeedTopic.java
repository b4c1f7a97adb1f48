package com.chatdirecto.servicios.feed;

import java.util.Objects;

import com.chatdirecto.repositorios.RowKind;
import com.chatdirecto.repositorios.feed.RowFilter;

/**
 * Destino lógico de una suscripción: un nombre legible y un filtro sobre un tipo de fila.
 * Dos temas con el mismo tipo y filtro comparten conexión aunque se llamen distinto.
 */
public final class FeedTopic {

    private final String name;
    private final RowKind kind;
    private final RowFilter filter;

    public FeedTopic(String name, RowKind kind, RowFilter filter) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.filter = Objects.requireNonNull(filter, "filter");
    }

    /**
     * Amistades donde el usuario es solicitante o destinatario.
     */
    public static FeedTopic friendshipsTouching(String userId) {
        return new FeedTopic("friendships-" + userId, RowKind.FRIENDSHIP,
            RowFilter.or(RowFilter.eq("requester_id", userId), RowFilter.eq("addressee_id", userId)));
    }

    public static FeedTopic friendshipsAddressedTo(String userId) {
        return new FeedTopic("friend-requests-" + userId, RowKind.FRIENDSHIP,
            RowFilter.eq("addressee_id", userId));
    }

    public static FeedTopic notificationsFor(String userId) {
        return new FeedTopic("notifications-" + userId, RowKind.NOTIFICATION,
            RowFilter.eq("user_id", userId));
    }

    /**
     * Mensajes del par no ordenado {userId, friendId}.
     */
    public static FeedTopic conversation(String userId, String friendId) {
        return new FeedTopic("messages-" + userId + "-" + friendId, RowKind.MESSAGE,
            RowFilter.or(
                RowFilter.and(RowFilter.eq("sender_id", userId), RowFilter.eq("receiver_id", friendId)),
                RowFilter.and(RowFilter.eq("sender_id", friendId), RowFilter.eq("receiver_id", userId))));
    }

    public String getName() {
        return name;
    }

    public RowKind getKind() {
        return kind;
    }

    public RowFilter getFilter() {
        return filter;
    }

    /**
     * Clave de la conexión compartida.
     */
    public String key() {
        return kind.table() + "?" + filter;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FeedTopic)) {
            return false;
        }
        FeedTopic other = (FeedTopic) o;
        return name.equals(other.name) && key().equals(other.key());
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, key());
    }

    @Override
    public String toString() {
        return name;
    }
}
