package com.chatdirecto.servicios.validacion;

/**
 * Entrada rechazada en el cliente antes de cualquier llamada remota.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }
}
