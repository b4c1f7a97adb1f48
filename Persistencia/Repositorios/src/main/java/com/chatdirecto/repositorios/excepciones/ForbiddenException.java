package com.chatdirecto.repositorios.excepciones;

/**
 * El usuario que actúa no es dueño de la fila.
 */
public class ForbiddenException extends RemoteStoreException {

    public ForbiddenException(String message) {
        super(403, message);
    }
}
