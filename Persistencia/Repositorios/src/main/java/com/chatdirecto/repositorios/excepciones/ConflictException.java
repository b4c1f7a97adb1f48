package com.chatdirecto.repositorios.excepciones;

/**
 * Violación de unicidad (nombre de usuario o amistad duplicados).
 */
public class ConflictException extends RemoteStoreException {

    public ConflictException(String message) {
        super(409, message);
    }
}
