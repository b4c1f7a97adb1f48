package com.chatdirecto.repositorios;

import com.chatdirecto.entidades.Notification;

import java.util.List;
import java.util.concurrent.CompletableFuture;

public interface NotificationRepository {

    CompletableFuture<Notification> insert(Notification notification);

    /**
     * Últimas {@code limit} notificaciones del usuario, de la más reciente a la más antigua.
     */
    CompletableFuture<List<Notification>> findRecentFor(String userId, int limit);

    CompletableFuture<Notification> markRead(String id, String actingUserId);
}
