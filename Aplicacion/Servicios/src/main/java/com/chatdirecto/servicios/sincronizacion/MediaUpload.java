package com.chatdirecto.servicios.sincronizacion;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import com.chatdirecto.entidades.MediaKind;

/**
 * Archivo local elegido para adjuntar a un mensaje, antes de subirlo.
 */
public final class MediaUpload {

    private static final Pattern SAFE_EXTENSION = Pattern.compile("[a-z0-9]+");

    private final String fileName;
    private final String contentType;
    private final byte[] content;

    public MediaUpload(String fileName, String contentType, byte[] content) {
        this.fileName = Objects.requireNonNull(fileName, "fileName");
        this.contentType = contentType;
        this.content = Objects.requireNonNull(content, "content").clone();
    }

    public String getFileName() {
        return fileName;
    }

    public String getContentType() {
        return contentType;
    }

    public byte[] getContent() {
        return content.clone();
    }

    public long size() {
        return content.length;
    }

    public MediaKind kind() {
        return MediaKind.fromContentType(contentType);
    }

    /**
     * Extensión para la ruta de almacenamiento: la del nombre del archivo o, si no tiene,
     * el subtipo del tipo MIME sin su sufijo {@code +xml}, {@code +json}... Solo se aceptan
     * letras y dígitos; cualquier otra cosa queda como {@code bin}.
     */
    public String extension() {
        int dot = fileName.lastIndexOf('.');
        if (dot >= 0 && dot < fileName.length() - 1) {
            String fromName = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
            if (SAFE_EXTENSION.matcher(fromName).matches()) {
                return fromName;
            }
        }
        if (contentType != null && contentType.indexOf('/') > 0) {
            String subtype = contentType.substring(contentType.indexOf('/') + 1);
            int cut = indexOfAny(subtype, ';', '+');
            String fromType = (cut >= 0 ? subtype.substring(0, cut) : subtype).trim().toLowerCase(Locale.ROOT);
            if (SAFE_EXTENSION.matcher(fromType).matches()) {
                return fromType;
            }
        }
        return "bin";
    }

    private static int indexOfAny(String value, char first, char second) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == first || c == second) {
                return i;
            }
        }
        return -1;
    }
}
