package com.chatdirecto.servicios.feed;

import java.util.Objects;

import com.chatdirecto.entidades.Friendship;
import com.chatdirecto.entidades.Message;
import com.chatdirecto.entidades.Notification;
import com.chatdirecto.entidades.Profile;
import com.chatdirecto.repositorios.RowKind;
import com.chatdirecto.repositorios.feed.ChangeType;
import com.chatdirecto.repositorios.feed.FeedFrame;
import com.chatdirecto.repositorios.feed.RowJson;

/**
 * Cambio ya decodificado según el tipo de fila. Los consumidores piden la fila tipada
 * con el accesor de su tipo; pedir otro tipo es un error de programación.
 */
public final class ChangeEvent {

    private final FeedTopic topic;
    private final RowKind kind;
    private final ChangeType changeType;
    private final String rowId;
    private final Object row;
    private final long epoch;

    private ChangeEvent(FeedTopic topic, RowKind kind, ChangeType changeType, String rowId, Object row, long epoch) {
        this.topic = topic;
        this.kind = kind;
        this.changeType = changeType;
        this.rowId = rowId;
        this.row = row;
        this.epoch = epoch;
    }

    /**
     * @throws IllegalArgumentException si la fila no tiene id o no corresponde a su tipo
     */
    public static ChangeEvent decode(FeedTopic topic, FeedFrame frame, long epoch) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(frame, "frame");
        String rowId = frame.rowId();
        if (rowId == null) {
            throw new IllegalArgumentException("Fila sin id en " + frame.getKind().table());
        }
        Object row = RowJson.fromRecord(frame.getRecord(), frame.getKind().rowType());
        return new ChangeEvent(topic, frame.getKind(), frame.getChangeType(), rowId, row, epoch);
    }

    /**
     * Construye un evento a partir de una fila ya tipada, p. ej. para reinyectar cambios en pruebas.
     */
    public static ChangeEvent of(FeedTopic topic, ChangeType changeType, String rowId, Object row) {
        RowKind kind = Objects.requireNonNull(topic, "topic").getKind();
        if (!kind.rowType().isInstance(row)) {
            throw new IllegalArgumentException("La fila no es de tipo " + kind.rowType().getSimpleName());
        }
        return new ChangeEvent(topic, kind, Objects.requireNonNull(changeType, "changeType"),
            Objects.requireNonNull(rowId, "rowId"), row, 0L);
    }

    public FeedTopic getTopic() {
        return topic;
    }

    public RowKind getKind() {
        return kind;
    }

    public ChangeType getChangeType() {
        return changeType;
    }

    public String getRowId() {
        return rowId;
    }

    public long getEpoch() {
        return epoch;
    }

    public boolean isInsert() {
        return changeType == ChangeType.INSERT;
    }

    public Friendship friendship() {
        return as(RowKind.FRIENDSHIP, Friendship.class);
    }

    public Message message() {
        return as(RowKind.MESSAGE, Message.class);
    }

    public Notification notification() {
        return as(RowKind.NOTIFICATION, Notification.class);
    }

    public Profile profile() {
        return as(RowKind.PROFILE, Profile.class);
    }

    private <T> T as(RowKind expected, Class<T> type) {
        if (kind != expected) {
            throw new IllegalStateException("El evento es de " + kind.table() + ", no de " + expected.table());
        }
        return type.cast(row);
    }

    @Override
    public String toString() {
        return kind.table() + ":" + changeType + ":" + rowId + "@" + topic;
    }
}
