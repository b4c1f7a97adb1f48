package com.chatdirecto.servicios.feed;

/**
 * Suscripción viva de un manejador a un tema. Cerrarla es idempotente.
 */
public interface SubscriptionHandle extends AutoCloseable {

    FeedTopic getTopic();

    boolean isActive();

    @Override
    void close();
}
