package com.chatdirecto.servicios.metrics;

import com.chatdirecto.servicios.eventos.SyncEvent;
import com.chatdirecto.servicios.eventos.SyncEventBus;
import com.chatdirecto.servicios.eventos.SyncEventType;
import com.chatdirecto.servicios.eventos.SyncObserver;

import java.util.Objects;

/**
 * Observador del bus que traduce eventos de sincronización a métricas Prometheus.
 */
public class MetricsSyncObserver implements SyncObserver {

    public MetricsSyncObserver(SyncEventBus eventBus) {
        Objects.requireNonNull(eventBus, "eventBus").subscribe(this);
    }

    @Override
    public void onEvent(SyncEvent event) {
        if (event == null || event.getType() == null) {
            return;
        }
        SyncEventType type = event.getType();
        switch (type) {
            case SESSION_STARTED -> SyncMetrics.onSessionStarted();
            case SESSION_ENDED -> SyncMetrics.onSessionEnded();
            case FRIEND_REQUEST_SENT -> SyncMetrics.recordAction("request_friend", true);
            case FRIEND_REQUEST_ANSWERED -> SyncMetrics.recordAction("respond", true);
            case MESSAGE_SENT -> SyncMetrics.recordAction("send", true);
            case ACTION_FAILED -> SyncMetrics.recordAction(String.valueOf(event.get("action")), false);
            case EVENT_DISCARDED -> SyncMetrics.recordDiscardedEvent(String.valueOf(event.get("reason")));
            default -> {
                // Los cambios de modelo no se miden
            }
        }
    }
}
