package com.chatdirecto.repositorios;

import java.util.concurrent.CompletableFuture;

public interface BlobStorage {

    /**
     * Sube el contenido a {@code bucket/path}, reemplazando lo que hubiera en esa ruta.
     * @return URL pública y durable del archivo; falla con UploadException
     */
    CompletableFuture<String> upload(String bucket, String path, byte[] content, String contentType);
}
