package com.chatdirecto.repositorios.excepciones;

/**
 * Error devuelto por el almacén remoto. El código sigue la semántica HTTP de la respuesta.
 */
public class RemoteStoreException extends RuntimeException {

    private final int code;

    public RemoteStoreException(int code, String message) {
        super(message);
        this.code = code;
    }

    public RemoteStoreException(int code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
