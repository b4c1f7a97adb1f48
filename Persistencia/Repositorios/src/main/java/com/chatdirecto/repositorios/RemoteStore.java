package com.chatdirecto.repositorios;

import com.chatdirecto.repositorios.feed.ChangeFeed;

/**
 * Superficie completa del almacén remoto: CRUD por tipo de fila, almacenamiento de adjuntos
 * y feed de cambios.
 */
public interface RemoteStore {

    ProfileRepository profiles();

    FriendshipRepository friendships();

    MessageRepository messages();

    NotificationRepository notifications();

    BlobStorage blobs();

    ChangeFeed feed();
}
