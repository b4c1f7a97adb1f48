package com.chatdirecto.entidades;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationKind {
    FRIEND_REQUEST("friend_request"),
    FRIEND_ACCEPTED("friend_accepted"),
    MESSAGE("message");

    private final String wireValue;

    NotificationKind(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static NotificationKind fromWire(String value) {
        for (NotificationKind kind : values()) {
            if (kind.wireValue.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Tipo de notificación desconocido: " + value);
    }
}
