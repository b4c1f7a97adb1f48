package com.chatdirecto.repositorios;

import com.chatdirecto.entidades.Profile;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

public interface ProfileRepository {

    CompletableFuture<Optional<Profile>> findById(String id);

    CompletableFuture<List<Profile>> findByIds(Collection<String> ids);

    /**
     * Busca perfiles cuyo nombre de usuario contiene {@code fragment} (sin distinguir mayúsculas),
     * excluyendo {@code excludeId} y los perfiles sin nombre de usuario.
     */
    CompletableFuture<List<Profile>> searchByUsername(String fragment, String excludeId, int limit);
}
