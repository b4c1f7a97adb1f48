package com.chatdirecto.servicios.metrics;

import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.util.Locale;

/**
 * Centraliza las métricas del motor de sincronización en el registro por defecto de Prometheus.
 * Quien embeba el cliente decide cómo exponerlas.
 */
public final class SyncMetrics {

    // --- Feed ---

    private static final Counter feedEvents = Counter.build()
        .name("chat_sync_feed_events_total")
        .help("Eventos del feed entregados a los manejadores por tipo de fila y de cambio.")
        .labelNames("kind", "change")
        .register();

    private static final Counter discardedEvents = Counter.build()
        .name("chat_sync_discarded_events_total")
        .help("Eventos descartados antes de aplicarse (época vieja, duplicado, contexto cerrado...).")
        .labelNames("reason")
        .register();

    private static final Gauge activeFeedConnections = Gauge.build()
        .name("chat_sync_active_feed_connections")
        .help("Conexiones del feed abiertas (una por tema y filtro).")
        .register();

    private static final Counter transportErrors = Counter.build()
        .name("chat_sync_transport_errors_total")
        .help("Caídas del transporte del feed por tipo de fila.")
        .labelNames("kind")
        .register();

    private static final Counter reconnects = Counter.build()
        .name("chat_sync_feed_reconnects_total")
        .help("Intentos de resuscripción al feed por resultado.")
        .labelNames("result")
        .register();

    // --- Acciones del usuario ---

    private static final Counter actions = Counter.build()
        .name("chat_sync_actions_total")
        .help("Acciones del usuario por tipo y resultado.")
        .labelNames("action", "result")
        .register();

    private static final Histogram mediaUploadSizeBytes = Histogram.build()
        .name("chat_sync_media_upload_size_bytes")
        .help("Tamaño de los adjuntos subidos en bytes.")
        .buckets(1024, 16384, 262144, 1048576, 4194304, 16777216, 52428800)
        .register();

    private static final Gauge activeSessions = Gauge.build()
        .name("chat_sync_active_sessions")
        .help("Sesiones iniciadas en este proceso.")
        .register();

    private SyncMetrics() {
    }

    public static void recordFeedEvent(String kind, String change) {
        feedEvents.labels(normalizeLabel(kind), normalizeLabel(change)).inc();
    }

    public static void recordDiscardedEvent(String reason) {
        discardedEvents.labels(normalizeLabel(reason)).inc();
    }

    public static void onFeedConnectionOpened() {
        activeFeedConnections.inc();
    }

    public static void onFeedConnectionClosed() {
        activeFeedConnections.dec();
    }

    public static void recordTransportError(String kind) {
        transportErrors.labels(normalizeLabel(kind)).inc();
    }

    public static void recordReconnect(boolean success) {
        reconnects.labels(success ? "success" : "failure").inc();
    }

    public static void recordAction(String action, boolean success) {
        actions.labels(normalizeLabel(action), success ? "success" : "failure").inc();
    }

    public static void recordMediaUpload(long sizeBytes) {
        if (sizeBytes > 0) {
            mediaUploadSizeBytes.observe(sizeBytes);
        }
    }

    public static void onSessionStarted() {
        activeSessions.inc();
    }

    public static void onSessionEnded() {
        activeSessions.dec();
    }

    private static String normalizeLabel(String raw) {
        if (raw == null || raw.isBlank()) {
            return "unknown";
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]+", "_");
        if (normalized.isEmpty()) {
            return "unknown";
        }
        return normalized.length() > 64 ? normalized.substring(0, 64) : normalized;
    }
}
