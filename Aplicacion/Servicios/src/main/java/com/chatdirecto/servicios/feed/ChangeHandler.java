package com.chatdirecto.servicios.feed;

/**
 * Manejador de cambios de un tema. Se invoca siempre en el hilo del loop del cliente.
 */
@FunctionalInterface
public interface ChangeHandler {

    void onChange(ChangeEvent event);

    /**
     * Llamado tras reconectar el tema. Los eventos perdidos no se reenvían, así que el dueño
     * debe volver a consultar el estado completo.
     */
    default void onResubscribed(FeedTopic topic) {
    }
}
