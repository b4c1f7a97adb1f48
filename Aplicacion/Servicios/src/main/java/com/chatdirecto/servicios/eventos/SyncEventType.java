package com.chatdirecto.servicios.eventos;

public enum SyncEventType {
    SESSION_STARTED,
    SESSION_ENDED,
    FRIENDS_CHANGED,       // Lista de amigos o solicitudes recalculada
    FRIEND_REQUEST_SENT,
    FRIEND_REQUEST_ANSWERED,
    CONVERSATION_OPENED,
    CONVERSATION_CHANGED,  // Cambió el log de la conversación abierta
    CONVERSATION_CLOSED,
    MESSAGE_SENT,
    NOTIFICATIONS_CHANGED,
    FEED_DISCONNECTED,
    FEED_RESUBSCRIBED,
    EVENT_DISCARDED,
    ACTION_FAILED
}
