package com.chatdirecto.repositorios.feed;

import java.util.Objects;

import com.chatdirecto.repositorios.RowKind;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Cambio tal como llega por el feed: tipo de fila, tipo de cambio y la fila en JSON sin tipar.
 */
public final class FeedFrame {

    private final RowKind kind;
    private final ChangeType changeType;
    private final JsonNode record;

    public FeedFrame(RowKind kind, ChangeType changeType, JsonNode record) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.changeType = Objects.requireNonNull(changeType, "changeType");
        this.record = Objects.requireNonNull(record, "record");
    }

    public RowKind getKind() {
        return kind;
    }

    public ChangeType getChangeType() {
        return changeType;
    }

    public JsonNode getRecord() {
        return record;
    }

    public String rowId() {
        JsonNode id = record.get("id");
        return id != null && !id.isNull() ? id.asText() : null;
    }
}
