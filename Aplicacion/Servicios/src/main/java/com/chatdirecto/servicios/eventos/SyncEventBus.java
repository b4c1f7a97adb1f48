package com.chatdirecto.servicios.eventos;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

public class SyncEventBus {

    private static final Logger LOGGER = Logger.getLogger(SyncEventBus.class.getName());

    private final List<SyncObserver> observers = new CopyOnWriteArrayList<>();

    public void subscribe(SyncObserver observer) {
        observers.add(observer);
    }

    public void unsubscribe(SyncObserver observer) {
        observers.remove(observer);
    }

    public void publish(SyncEvent event) {
        for (SyncObserver observer : observers) {
            try {
                observer.onEvent(event);
            } catch (RuntimeException ex) {
                LOGGER.log(Level.WARNING, "Un observador falló procesando " + event.getType(), ex);
            }
        }
    }

    public void publish(SyncEventType type, Map<String, Object> payload) {
        publish(new SyncEvent(type, payload));
    }
}
