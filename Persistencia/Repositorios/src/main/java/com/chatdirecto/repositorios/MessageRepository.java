package com.chatdirecto.repositorios;

import com.chatdirecto.entidades.Message;

import java.util.List;
import java.util.concurrent.CompletableFuture;

public interface MessageRepository {

    /**
     * Persiste el mensaje y devuelve la fila almacenada con su id y fecha de creación.
     */
    CompletableFuture<Message> insert(Message message);

    /**
     * Mensajes entre dos usuarios en cualquier dirección, ordenados por fecha de creación ascendente.
     */
    CompletableFuture<List<Message>> findConversation(String a, String b);

    /**
     * Marca como leídos los mensajes no leídos enviados por {@code senderId} a {@code receiverId}.
     * @return cantidad de filas actualizadas
     */
    CompletableFuture<Integer> markReadFrom(String senderId, String receiverId);
}
