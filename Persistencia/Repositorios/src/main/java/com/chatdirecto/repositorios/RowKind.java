package com.chatdirecto.repositorios;

import com.chatdirecto.entidades.Friendship;
import com.chatdirecto.entidades.Message;
import com.chatdirecto.entidades.Notification;
import com.chatdirecto.entidades.Profile;

/**
 * Tipos de fila que expone el almacén remoto, con el nombre de su tabla y la clase que la representa.
 */
public enum RowKind {
    PROFILE("profiles", Profile.class),
    FRIENDSHIP("friendships", Friendship.class),
    MESSAGE("messages", Message.class),
    NOTIFICATION("notifications", Notification.class);

    private final String table;
    private final Class<?> rowType;

    RowKind(String table, Class<?> rowType) {
        this.table = table;
        this.rowType = rowType;
    }

    public String table() {
        return table;
    }

    public Class<?> rowType() {
        return rowType;
    }
}
