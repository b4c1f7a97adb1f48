package com.chatdirecto.entidades;

import java.time.Instant;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;

public class Message {
    private String id;
    private String senderId;
    private String receiverId;
    private String content;
    private String mediaUrl;
    private MediaKind mediaType;
    private String fileName;
    private boolean read;
    private Instant createdAt;

    public Message() {
    }

    public Message(String senderId, String receiverId, String content, MediaAttachment media) {
        this.senderId = senderId;
        this.receiverId = receiverId;
        this.content = content;
        setMedia(media);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getSenderId() {
        return senderId;
    }

    public void setSenderId(String senderId) {
        this.senderId = senderId;
    }

    public String getReceiverId() {
        return receiverId;
    }

    public void setReceiverId(String receiverId) {
        this.receiverId = receiverId;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public String getMediaUrl() {
        return mediaUrl;
    }

    public void setMediaUrl(String mediaUrl) {
        this.mediaUrl = mediaUrl;
    }

    public MediaKind getMediaType() {
        return mediaType;
    }

    public void setMediaType(MediaKind mediaType) {
        this.mediaType = mediaType;
    }

    public String getFileName() {
        return fileName;
    }

    public void setFileName(String fileName) {
        this.fileName = fileName;
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

    @JsonIgnore
    public MediaAttachment getMedia() {
        if (mediaUrl == null || mediaType == null) {
            return null;
        }
        return new MediaAttachment(mediaUrl, mediaType, fileName);
    }

    @JsonIgnore
    public void setMedia(MediaAttachment media) {
        this.mediaUrl = media != null ? media.getUrl() : null;
        this.mediaType = media != null ? media.getKind() : null;
        this.fileName = media != null ? media.getFileName() : null;
    }

    @JsonIgnore
    public boolean hasBody() {
        return (content != null && !content.isBlank()) || mediaUrl != null;
    }

    public boolean belongsTo(String a, String b) {
        return (Objects.equals(a, senderId) && Objects.equals(b, receiverId))
            || (Objects.equals(b, senderId) && Objects.equals(a, receiverId));
    }
}
