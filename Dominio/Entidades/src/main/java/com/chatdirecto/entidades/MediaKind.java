package com.chatdirecto.entidades;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MediaKind {
    IMAGE("image"),
    VIDEO("video"),
    FILE("file"),
    GIF("gif");

    private final String wireValue;

    MediaKind(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static MediaKind fromWire(String value) {
        for (MediaKind kind : values()) {
            if (kind.wireValue.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Tipo de adjunto desconocido: " + value);
    }

    /**
     * Clasifica un adjunto a partir de su tipo MIME. Los GIF se distinguen del resto de imágenes.
     */
    public static MediaKind fromContentType(String contentType) {
        if (contentType == null) {
            return FILE;
        }
        String normalized = contentType.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("image/gif")) {
            return GIF;
        }
        if (normalized.startsWith("image/")) {
            return IMAGE;
        }
        if (normalized.startsWith("video/")) {
            return VIDEO;
        }
        return FILE;
    }
}
