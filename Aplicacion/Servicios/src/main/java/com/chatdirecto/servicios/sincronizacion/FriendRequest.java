package com.chatdirecto.servicios.sincronizacion;

import java.util.Objects;

import com.chatdirecto.entidades.Friendship;
import com.chatdirecto.entidades.Profile;

/**
 * Solicitud de amistad pendiente dirigida al usuario, con el perfil de quien la envió
 * si pudo resolverse.
 */
public final class FriendRequest {

    private final Friendship friendship;
    private final Profile requester;

    public FriendRequest(Friendship friendship, Profile requester) {
        this.friendship = Objects.requireNonNull(friendship, "friendship");
        this.requester = requester;
    }

    public Friendship getFriendship() {
        return friendship;
    }

    public Profile getRequester() {
        return requester;
    }

    public String getFriendshipId() {
        return friendship.getId();
    }
}
