package com.chatdirecto.servicios.sincronizacion;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

import com.chatdirecto.entidades.Profile;

/**
 * Búsqueda de usuarios por nombre para enviar solicitudes de amistad.
 */
public class UserDirectory {

    private final SessionContext session;

    public UserDirectory(SessionContext session) {
        this.session = Objects.requireNonNull(session, "session");
    }

    /**
     * Perfiles cuyo nombre contiene {@code query}, sin distinguir mayúsculas, excluyendo al
     * propio usuario y a quienes aún no eligieron nombre. Una consulta vacía no llega al almacén.
     */
    public CompletableFuture<List<Profile>> search(String query) {
        if (query == null || query.isBlank()) {
            return CompletableFuture.completedFuture(List.of());
        }
        int limit = session.getConfig().getSearchLimit();
        return session.getStore().profiles()
            .searchByUsername(query.trim(), session.userId(), limit)
            .thenApply(found -> found.stream()
                .filter(profile -> profile.getUsername() != null)
                .filter(profile -> !session.userId().equals(profile.getId()))
                .limit(limit)
                .collect(Collectors.toList()))
            .whenComplete((found, error) -> {
                if (error != null) {
                    session.reportFailure("search", error);
                }
            });
    }
}
