package com.chatdirecto.servicios.feed;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.chatdirecto.config.ClientConfig;
import com.chatdirecto.repositorios.feed.ChangeFeed;
import com.chatdirecto.repositorios.feed.FeedConnection;
import com.chatdirecto.repositorios.feed.FeedFrame;
import com.chatdirecto.repositorios.feed.FeedListener;
import com.chatdirecto.servicios.eventos.SyncEventBus;
import com.chatdirecto.servicios.eventos.SyncEventType;
import com.chatdirecto.servicios.metrics.SyncMetrics;

/**
 * Multiplexa manejadores sobre conexiones del feed: una conexión por par (tipo de fila, filtro),
 * abierta con el primer manejador y cerrada con el último.
 *
 * <p>Cada conexión pertenece a una época. Al caer el transporte la época avanza, así que lo que
 * quede en vuelo de la conexión anterior se descarta; la reconexión se reintenta con espera
 * exponencial y, cuando vuelve, cada manejador recibe {@link ChangeHandler#onResubscribed}.
 * Las entregas se hacen siempre en el loop del cliente.
 */
public class ChangeFeedSubscriber implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(ChangeFeedSubscriber.class.getName());

    private final ChangeFeed feed;
    private final Executor loop;
    private final ScheduledExecutorService scheduler;
    private final long initialDelayMs;
    private final long maxDelayMs;
    private final SyncEventBus eventBus;

    private final Map<String, Channel> channels = new HashMap<>();
    private boolean closed;

    public ChangeFeedSubscriber(ChangeFeed feed,
                                Executor loop,
                                ScheduledExecutorService scheduler,
                                ClientConfig config,
                                SyncEventBus eventBus) {
        this(feed, loop, scheduler, config.getReconnectInitialDelayMs(), config.getReconnectMaxDelayMs(), eventBus);
    }

    public ChangeFeedSubscriber(ChangeFeed feed,
                                Executor loop,
                                ScheduledExecutorService scheduler,
                                long initialDelayMs,
                                long maxDelayMs,
                                SyncEventBus eventBus) {
        this.feed = Objects.requireNonNull(feed, "feed");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        if (initialDelayMs <= 0 || maxDelayMs < initialDelayMs) {
            throw new IllegalArgumentException("Esperas de reconexión inválidas: " + initialDelayMs + "/" + maxDelayMs);
        }
        this.initialDelayMs = initialDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
    }

    /**
     * Registra {@code handler} sobre {@code topic}. Si el transporte no está disponible la
     * suscripción queda registrada y se conecta en segundo plano.
     *
     * @throws IllegalStateException si el suscriptor ya se cerró
     */
    public SubscriptionHandle subscribe(FeedTopic topic, ChangeHandler handler) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(handler, "handler");
        Registration registration;
        synchronized (this) {
            if (closed) {
                throw new IllegalStateException("El suscriptor del feed está cerrado");
            }
            Channel channel = channels.computeIfAbsent(topic.key(), key -> new Channel(topic));
            registration = new Registration(channel, topic, handler);
            channel.registrations.add(registration);
            if (channel.connection == null && !channel.reconnecting) {
                connect(channel);
            }
        }
        LOGGER.fine(() -> "Suscrito a " + topic + " (" + topic.key() + ")");
        return registration;
    }

    public void unsubscribe(SubscriptionHandle handle) {
        if (handle instanceof Registration) {
            release((Registration) handle);
        } else if (handle != null) {
            handle.close();
        }
    }

    public synchronized int connectionCount() {
        return (int) channels.values().stream().filter(channel -> channel.connection != null).count();
    }

    public synchronized int handlerCount(FeedTopic topic) {
        Channel channel = channels.get(topic.key());
        return channel != null ? channel.registrations.size() : 0;
    }

    @Override
    public void close() {
        List<Registration> registrations = new ArrayList<>();
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            for (Channel channel : channels.values()) {
                registrations.addAll(channel.registrations);
            }
        }
        registrations.forEach(this::release);
        LOGGER.fine("Suscriptor del feed cerrado");
    }

    static long backoffDelay(long initialDelayMs, long maxDelayMs, int attempt) {
        long delay = initialDelayMs;
        for (int i = 0; i < attempt && delay < maxDelayMs; i++) {
            delay *= 2;
        }
        return Math.min(delay, maxDelayMs);
    }

    // --- Conexiones ---

    // Requiere el monitor del suscriptor.
    private boolean connect(Channel channel) {
        long epoch = ++channel.epoch;
        FeedTopic topic = channel.topic;
        try {
            channel.connection = feed.connect(topic.getKind(), topic.getFilter(), new ChannelListener(channel, epoch));
            channel.attempts = 0;
            SyncMetrics.onFeedConnectionOpened();
            return true;
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, "No se pudo conectar el tema " + topic + ", se reintentará", ex);
            SyncMetrics.recordTransportError(topic.getKind().table());
            scheduleReconnect(channel);
            return false;
        }
    }

    // Requiere el monitor del suscriptor.
    private void scheduleReconnect(Channel channel) {
        long delay = backoffDelay(initialDelayMs, maxDelayMs, channel.attempts++);
        channel.reconnecting = true;
        try {
            scheduler.schedule(() -> reconnect(channel), delay, TimeUnit.MILLISECONDS);
            LOGGER.fine(() -> "Reconexión de " + channel.topic + " en " + delay + " ms");
        } catch (RejectedExecutionException ex) {
            channel.reconnecting = false;
            LOGGER.log(Level.WARNING, "No se pudo programar la reconexión de " + channel.topic, ex);
        }
    }

    private void reconnect(Channel channel) {
        boolean connected;
        long epoch;
        synchronized (this) {
            if (closed || channel.closed) {
                return;
            }
            channel.reconnecting = false;
            connected = connect(channel);
            epoch = channel.epoch;
        }
        SyncMetrics.recordReconnect(connected);
        if (connected) {
            LOGGER.info(() -> "Tema " + channel.topic + " resuscrito");
            dispatchOnLoop(() -> notifyResubscribed(channel, epoch));
        }
    }

    private void onTransportError(Channel channel, long epoch, Throwable cause) {
        synchronized (this) {
            if (channel.closed || channel.epoch != epoch) {
                return;
            }
            channel.epoch++;
            channel.connection = null;
            SyncMetrics.onFeedConnectionClosed();
            scheduleReconnect(channel);
        }
        SyncMetrics.recordTransportError(channel.topic.getKind().table());
        LOGGER.log(Level.WARNING, "Se perdió la conexión del tema " + channel.topic, cause);
        dispatchOnLoop(() -> eventBus.publish(SyncEventType.FEED_DISCONNECTED, Map.of("topic", channel.topic.getName())));
    }

    private void release(Registration registration) {
        FeedConnection toClose = null;
        Channel channel = registration.channel;
        synchronized (this) {
            if (!registration.active) {
                return;
            }
            registration.active = false;
            channel.registrations.remove(registration);
            if (channel.registrations.isEmpty()) {
                channel.closed = true;
                channel.epoch++;
                channels.remove(channel.topic.key(), channel);
                toClose = channel.connection;
                channel.connection = null;
            }
        }
        if (toClose != null) {
            toClose.close();
            SyncMetrics.onFeedConnectionClosed();
            LOGGER.fine(() -> "Conexión de " + channel.topic.key() + " cerrada");
        }
    }

    // --- Entregas ---

    private void onFrame(Channel channel, long epoch, FeedFrame frame) {
        if (channel.closed || channel.epoch != epoch) {
            SyncMetrics.recordDiscardedEvent("stale_epoch");
            return;
        }
        ChangeEvent event;
        try {
            event = ChangeEvent.decode(channel.topic, frame, epoch);
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.WARNING, "Fila ilegible en el tema " + channel.topic, ex);
            SyncMetrics.recordDiscardedEvent("malformed");
            return;
        }
        dispatchOnLoop(() -> deliver(channel, event));
    }

    private void deliver(Channel channel, ChangeEvent event) {
        if (channel.closed || channel.epoch != event.getEpoch()) {
            SyncMetrics.recordDiscardedEvent("stale_epoch");
            return;
        }
        SyncMetrics.recordFeedEvent(event.getKind().table(), event.getChangeType().name());
        for (Registration registration : channel.registrations) {
            if (!registration.active) {
                SyncMetrics.recordDiscardedEvent("closed_handle");
                continue;
            }
            try {
                registration.handler.onChange(event);
            } catch (RuntimeException ex) {
                LOGGER.log(Level.WARNING, "El manejador de " + registration.topic + " falló con " + event, ex);
            }
        }
    }

    private void notifyResubscribed(Channel channel, long epoch) {
        if (channel.closed || channel.epoch != epoch) {
            return;
        }
        for (Registration registration : channel.registrations) {
            if (!registration.active) {
                continue;
            }
            try {
                registration.handler.onResubscribed(registration.topic);
            } catch (RuntimeException ex) {
                LOGGER.log(Level.WARNING, "Falló la puesta al día de " + registration.topic, ex);
            }
        }
        eventBus.publish(SyncEventType.FEED_RESUBSCRIBED, Map.of("topic", channel.topic.getName()));
    }

    private void dispatchOnLoop(Runnable task) {
        try {
            loop.execute(task);
        } catch (RejectedExecutionException ex) {
            SyncMetrics.recordDiscardedEvent("loop_stopped");
            LOGGER.log(Level.FINE, "Loop detenido, entrega descartada", ex);
        }
    }

    private final class Channel {
        private final FeedTopic topic;
        private final List<Registration> registrations = new CopyOnWriteArrayList<>();
        private volatile long epoch;
        private volatile boolean closed;
        private FeedConnection connection;
        private boolean reconnecting;
        private int attempts;

        private Channel(FeedTopic topic) {
            this.topic = topic;
        }
    }

    private final class ChannelListener implements FeedListener {
        private final Channel channel;
        private final long epoch;

        private ChannelListener(Channel channel, long epoch) {
            this.channel = channel;
            this.epoch = epoch;
        }

        @Override
        public void onFrame(FeedFrame frame) {
            ChangeFeedSubscriber.this.onFrame(channel, epoch, frame);
        }

        @Override
        public void onTransportError(Throwable cause) {
            ChangeFeedSubscriber.this.onTransportError(channel, epoch, cause);
        }
    }

    private final class Registration implements SubscriptionHandle {
        private final Channel channel;
        private final FeedTopic topic;
        private final ChangeHandler handler;
        private volatile boolean active = true;

        private Registration(Channel channel, FeedTopic topic, ChangeHandler handler) {
            this.channel = channel;
            this.topic = topic;
            this.handler = handler;
        }

        @Override
        public FeedTopic getTopic() {
            return topic;
        }

        @Override
        public boolean isActive() {
            return active;
        }

        @Override
        public void close() {
            release(this);
        }
    }
}
