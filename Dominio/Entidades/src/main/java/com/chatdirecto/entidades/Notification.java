package com.chatdirecto.entidades;

import java.time.Instant;

public class Notification {
    private String id;
    private String userId;
    private NotificationKind type;
    private String content;
    private String relatedId;
    private boolean read;
    private Instant createdAt;

    public Notification() {
    }

    public Notification(String userId, NotificationKind type, String content, String relatedId) {
        this.userId = userId;
        this.type = type;
        this.content = content;
        this.relatedId = relatedId;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public NotificationKind getType() {
        return type;
    }

    public void setType(NotificationKind type) {
        this.type = type;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public String getRelatedId() {
        return relatedId;
    }

    public void setRelatedId(String relatedId) {
        this.relatedId = relatedId;
    }

    public boolean isRead() {
        return read;
    }

    public void setRead(boolean read) {
        this.read = read;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
