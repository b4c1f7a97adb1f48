package com.chatdirecto.repositorios.feed;

/**
 * Receptor de una conexión del feed. Las llamadas pueden llegar desde hilos del transporte.
 */
public interface FeedListener {

    void onFrame(FeedFrame frame);

    /**
     * La conexión se perdió y ya no entregará más cambios.
     */
    void onTransportError(Throwable cause);
}
