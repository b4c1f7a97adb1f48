package com.chatdirecto.servicios.eventos;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Evento emitido cuando cambia un modelo de lectura o el estado del feed.
 */
public final class SyncEvent {

    private final SyncEventType type;
    private final Instant timestamp;
    private final Map<String, Object> payload;

    public SyncEvent(SyncEventType type, Map<String, Object> payload) {
        this.type = Objects.requireNonNull(type, "type");
        this.payload = payload != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(payload))
            : Collections.emptyMap();
        this.timestamp = Instant.now();
    }

    public SyncEventType getType() {
        return type;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public Object get(String key) {
        return payload.get(key);
    }

    @Override
    public String toString() {
        return type + payload.toString();
    }
}
