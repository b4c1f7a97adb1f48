package com.chatdirecto.servicios.eventos;

/**
 * Interfaz observer para reaccionar ante cambios de estado del cliente.
 */
@FunctionalInterface
public interface SyncObserver {

    void onEvent(SyncEvent event);
}
