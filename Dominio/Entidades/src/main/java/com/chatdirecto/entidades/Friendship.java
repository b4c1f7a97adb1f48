package com.chatdirecto.entidades;

import java.time.Instant;
import java.util.Objects;

public class Friendship {
    private String id;
    private String requesterId;
    private String addresseeId;
    private FriendshipStatus status;
    private Instant createdAt;

    public Friendship() {
    }

    public Friendship(String requesterId, String addresseeId) {
        this.requesterId = requesterId;
        this.addresseeId = addresseeId;
        this.status = FriendshipStatus.PENDING;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getRequesterId() {
        return requesterId;
    }

    public void setRequesterId(String requesterId) {
        this.requesterId = requesterId;
    }

    public String getAddresseeId() {
        return addresseeId;
    }

    public void setAddresseeId(String addresseeId) {
        this.addresseeId = addresseeId;
    }

    public FriendshipStatus getStatus() {
        return status;
    }

    public void setStatus(FriendshipStatus status) {
        this.status = status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    /**
     * Devuelve el id de la otra parte de la amistad desde el punto de vista de {@code userId}.
     */
    public String otherParty(String userId) {
        return Objects.equals(userId, addresseeId) ? requesterId : addresseeId;
    }

    public boolean involves(String userId) {
        return Objects.equals(userId, requesterId) || Objects.equals(userId, addresseeId);
    }

    /**
     * El par {requester, addressee} es no ordenado.
     */
    public boolean isBetween(String a, String b) {
        return (Objects.equals(a, requesterId) && Objects.equals(b, addresseeId))
            || (Objects.equals(b, requesterId) && Objects.equals(a, addresseeId));
    }
}
