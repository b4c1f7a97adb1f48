package com.chatdirecto.repositorios.excepciones;

public class UploadException extends RemoteStoreException {

    public UploadException(String message) {
        super(500, message);
    }

    public UploadException(String message, Throwable cause) {
        super(500, message, cause);
    }
}
