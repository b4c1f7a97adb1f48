package com.chatdirecto.repositorios.excepciones;

/**
 * Caída de la conexión del feed. Nunca llega al usuario: el suscriptor se reconecta.
 */
public class TransportException extends RemoteStoreException {

    public TransportException(String message) {
        super(503, message);
    }

    public TransportException(String message, Throwable cause) {
        super(503, message, cause);
    }
}
