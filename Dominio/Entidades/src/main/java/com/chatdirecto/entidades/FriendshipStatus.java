package com.chatdirecto.entidades;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Estados posibles de una amistad. Solo existen las transiciones
 * PENDING -> ACCEPTED y PENDING -> REJECTED; ambas son definitivas.
 */
public enum FriendshipStatus {
    PENDING("pending"),
    ACCEPTED("accepted"),
    REJECTED("rejected");

    private final String wireValue;

    FriendshipStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    public boolean canTransitionTo(FriendshipStatus next) {
        return this == PENDING && next != null && next != PENDING;
    }

    @JsonCreator
    public static FriendshipStatus fromWire(String value) {
        for (FriendshipStatus status : values()) {
            if (status.wireValue.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Estado de amistad desconocido: " + value);
    }
}
