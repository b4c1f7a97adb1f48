package com.chatdirecto.repositorios.feed;

public interface FeedConnection extends AutoCloseable {

    boolean isOpen();

    @Override
    void close();
}
