package com.chatdirecto.repositorios;

import com.chatdirecto.entidades.Friendship;
import com.chatdirecto.entidades.FriendshipStatus;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

public interface FriendshipRepository {

    /**
     * Inserta una amistad pendiente. Falla con ConflictException si ya existe una para el par.
     */
    CompletableFuture<Friendship> insert(Friendship friendship);

    /**
     * Actualiza el estado. Falla con NotFoundException si el id no existe y con
     * ForbiddenException si {@code actingUserId} no es el destinatario.
     */
    CompletableFuture<Friendship> updateStatus(String id, FriendshipStatus status, String actingUserId);

    CompletableFuture<Optional<Friendship>> findById(String id);

    /**
     * Busca la amistad del par no ordenado {a, b}.
     */
    CompletableFuture<Optional<Friendship>> findBetween(String a, String b);

    /**
     * Todas las amistades donde el usuario es solicitante o destinatario, en cualquier estado.
     */
    CompletableFuture<List<Friendship>> findTouching(String userId);

    CompletableFuture<List<Friendship>> findPendingFor(String addresseeId);
}
