package com.chatdirecto.repositorios.excepciones;

/**
 * El almacén rechazó la fila: campos obligatorios ausentes o transición de estado no permitida.
 */
public class InvalidRowException extends RemoteStoreException {

    public InvalidRowException(String message) {
        super(422, message);
    }
}
