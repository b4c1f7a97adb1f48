package com.chatdirecto.repositorios.excepciones;

public class NotFoundException extends RemoteStoreException {

    public NotFoundException(String message) {
        super(404, message);
    }
}
