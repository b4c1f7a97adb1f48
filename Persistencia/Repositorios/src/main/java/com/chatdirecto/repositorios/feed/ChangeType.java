package com.chatdirecto.repositorios.feed;

public enum ChangeType {
    INSERT,
    UPDATE
}
