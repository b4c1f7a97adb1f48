package com.chatdirecto.repositorios.feed;

import com.chatdirecto.repositorios.RowKind;

public interface ChangeFeed {

    /**
     * Abre una conexión que entrega cada inserción o actualización de filas {@code kind}
     * que cumplen {@code filter}. No hay repetición de eventos perdidos.
     *
     * @throws com.chatdirecto.repositorios.excepciones.TransportException si no se puede conectar
     */
    FeedConnection connect(RowKind kind, RowFilter filter, FeedListener listener);
}
