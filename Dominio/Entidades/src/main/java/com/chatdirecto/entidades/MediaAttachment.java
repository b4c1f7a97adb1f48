package com.chatdirecto.entidades;

import java.util.Objects;

/**
 * Descriptor de un adjunto ya subido: URL durable, tipo y nombre original del archivo.
 */
public final class MediaAttachment {

    private final String url;
    private final MediaKind kind;
    private final String fileName;

    public MediaAttachment(String url, MediaKind kind, String fileName) {
        this.url = Objects.requireNonNull(url, "url");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.fileName = fileName;
    }

    public String getUrl() {
        return url;
    }

    public MediaKind getKind() {
        return kind;
    }

    public String getFileName() {
        return fileName;
    }
}
