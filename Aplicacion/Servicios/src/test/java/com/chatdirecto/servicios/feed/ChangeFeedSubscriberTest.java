package com.chatdirecto.servicios.feed;

import com.chatdirecto.entidades.Notification;
import com.chatdirecto.entidades.NotificationKind;
import com.chatdirecto.repositorios.RowKind;
import com.chatdirecto.repositorios.feed.ChangeFeed;
import com.chatdirecto.repositorios.feed.ChangeType;
import com.chatdirecto.repositorios.feed.FeedConnection;
import com.chatdirecto.repositorios.feed.FeedFrame;
import com.chatdirecto.repositorios.feed.FeedListener;
import com.chatdirecto.repositorios.feed.RowFilter;
import com.chatdirecto.repositorios.feed.RowJson;
import com.chatdirecto.repositorios.memoria.InMemoryRemoteStore;
import com.chatdirecto.servicios.eventos.SyncEventBus;
import com.chatdirecto.servicios.eventos.SyncEventType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChangeFeedSubscriberTest {

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
    private final InMemoryRemoteStore store = new InMemoryRemoteStore();
    private final SyncEventBus eventBus = new SyncEventBus();
    private final FeedTopic topic = FeedTopic.notificationsFor("u1");

    @AfterEach
    void tearDown() throws InterruptedException {
        scheduler.shutdownNow();
        scheduler.awaitTermination(1, TimeUnit.SECONDS);
    }

    @Test
    void multiplexaManejadoresSobreUnaSolaConexion() {
        ChangeFeedSubscriber subscriber = subscriber(store.feed());
        RecordingHandler first = new RecordingHandler();
        RecordingHandler second = new RecordingHandler();

        SubscriptionHandle firstHandle = subscriber.subscribe(topic, first);
        SubscriptionHandle secondHandle = subscriber.subscribe(FeedTopic.notificationsFor("u1"), second);
        assertEquals(1, store.openConnections(RowKind.NOTIFICATION));

        store.notifications().insert(new Notification("u1", NotificationKind.MESSAGE, "hola", "u2")).join();
        store.notifications().insert(new Notification("u2", NotificationKind.MESSAGE, "para otro", "u1")).join();

        assertEquals(1, first.events.size());
        assertEquals(1, second.events.size());
        ChangeEvent event = first.events.get(0);
        assertEquals(RowKind.NOTIFICATION, event.getKind());
        assertEquals(ChangeType.INSERT, event.getChangeType());
        assertEquals("hola", event.notification().getContent());
        assertEquals(event.getRowId(), event.notification().getId());
        assertThrows(IllegalStateException.class, event::message);

        firstHandle.close();
        assertEquals(1, store.openConnections(RowKind.NOTIFICATION));
        secondHandle.close();
        secondHandle.close();
        assertEquals(0, store.openConnections(RowKind.NOTIFICATION));
        assertEquals(0, subscriber.connectionCount());
    }

    @Test
    void noEntregaEventosAUnHandleCerradoDuranteLaEntrega() {
        ChangeFeedSubscriber subscriber = subscriber(store.feed());
        AtomicReference<SubscriptionHandle> victim = new AtomicReference<>();
        RecordingHandler closed = new RecordingHandler();

        subscriber.subscribe(topic, event -> victim.get().close());
        victim.set(subscriber.subscribe(topic, closed));

        store.notifications().insert(new Notification("u1", NotificationKind.MESSAGE, "hola", "u2")).join();

        assertTrue(closed.events.isEmpty());
        assertFalse(victim.get().isActive());
        assertEquals(1, subscriber.handlerCount(topic));
    }

    @Test
    void unManejadorQueFallaNoAfectaALosDemas() {
        ChangeFeedSubscriber subscriber = subscriber(store.feed());
        RecordingHandler healthy = new RecordingHandler();
        subscriber.subscribe(topic, event -> {
            throw new IllegalStateException("roto");
        });
        subscriber.subscribe(topic, healthy);

        store.notifications().insert(new Notification("u1", NotificationKind.MESSAGE, "hola", "u2")).join();

        assertEquals(1, healthy.events.size());
    }

    @Test
    void reconectaTrasCaidaYAvisaAlDueno() throws InterruptedException {
        ChangeFeedSubscriber subscriber = subscriber(store.feed());
        RecordingHandler handler = new RecordingHandler();
        List<SyncEventType> announced = new CopyOnWriteArrayList<>();
        eventBus.subscribe(event -> announced.add(event.getType()));
        subscriber.subscribe(topic, handler);

        assertEquals(1, store.dropConnections(RowKind.NOTIFICATION));
        await(() -> handler.resubscribed.get() == 1, 2000);

        assertEquals(1, store.openConnections(RowKind.NOTIFICATION));
        assertTrue(announced.contains(SyncEventType.FEED_DISCONNECTED));
        assertTrue(announced.contains(SyncEventType.FEED_RESUBSCRIBED));
        store.notifications().insert(new Notification("u1", NotificationKind.MESSAGE, "de vuelta", "u2")).join();
        assertEquals(1, handler.events.size());
    }

    @Test
    void conexionRechazadaSeReintentaHastaConectar() throws InterruptedException {
        store.refuseConnects(2);
        ChangeFeedSubscriber subscriber = subscriber(store.feed());
        RecordingHandler handler = new RecordingHandler();

        SubscriptionHandle handle = subscriber.subscribe(topic, handler);
        assertTrue(handle.isActive());
        assertEquals(0, store.openConnections());

        await(() -> handler.resubscribed.get() == 1, 2000);
        assertEquals(1, store.openConnections(RowKind.NOTIFICATION));
    }

    @Test
    void descartaLoQueLlegaDeUnaEpocaAnterior() throws InterruptedException {
        CapturingFeed feed = new CapturingFeed();
        ChangeFeedSubscriber subscriber = subscriber(feed);
        RecordingHandler handler = new RecordingHandler();
        subscriber.subscribe(topic, handler);
        FeedListener firstConnection = feed.listeners.get(0);

        firstConnection.onTransportError(new IllegalStateException("socket cerrado"));
        await(() -> feed.listeners.size() == 2 && handler.resubscribed.get() == 1, 2000);

        firstConnection.onFrame(frame("viejo"));
        feed.listeners.get(1).onFrame(frame("nuevo"));

        assertEquals(1, handler.events.size());
        assertEquals("nuevo", handler.events.get(0).notification().getContent());
        assertEquals(3, handler.events.get(0).getEpoch());
    }

    @Test
    void filasIlegiblesSeDescartanSinCortarElTema() {
        CapturingFeed feed = new CapturingFeed();
        ChangeFeedSubscriber subscriber = subscriber(feed);
        RecordingHandler handler = new RecordingHandler();
        subscriber.subscribe(topic, handler);

        feed.listeners.get(0).onFrame(new FeedFrame(RowKind.NOTIFICATION, ChangeType.INSERT,
            RowJson.mapper().createObjectNode().put("content", "sin id")));
        feed.listeners.get(0).onFrame(frame("válido"));

        assertEquals(1, handler.events.size());
    }

    @Test
    void laEsperaDeReconexionCreceHastaElMaximo() {
        assertEquals(500, ChangeFeedSubscriber.backoffDelay(500, 30_000, 0));
        assertEquals(1000, ChangeFeedSubscriber.backoffDelay(500, 30_000, 1));
        assertEquals(16_000, ChangeFeedSubscriber.backoffDelay(500, 30_000, 5));
        assertEquals(30_000, ChangeFeedSubscriber.backoffDelay(500, 30_000, 6));
        assertEquals(30_000, ChangeFeedSubscriber.backoffDelay(500, 30_000, 60));
    }

    @Test
    void cerrarElSuscriptorLiberaTodasLasConexiones() {
        ChangeFeedSubscriber subscriber = subscriber(store.feed());
        subscriber.subscribe(topic, new RecordingHandler());
        subscriber.subscribe(FeedTopic.friendshipsTouching("u1"), new RecordingHandler());
        assertEquals(2, store.openConnections());

        subscriber.close();

        assertEquals(0, store.openConnections());
        assertThrows(IllegalStateException.class, () -> subscriber.subscribe(topic, new RecordingHandler()));
    }

    @Test
    void elAmbitoCierraTodoAunqueUnCierreFalle() {
        ChangeFeedSubscriber subscriber = subscriber(store.feed());
        SubscriptionScope scope = new SubscriptionScope("prueba");
        SubscriptionHandle live = scope.open(subscriber, topic, new RecordingHandler());
        IllegalStateException boom = new IllegalStateException("fallo al cerrar");
        IllegalStateException second = new IllegalStateException("otro fallo");
        scope.track(new FailingHandle(topic, boom));
        scope.track(new FailingHandle(topic, second));

        IllegalStateException thrown = assertThrows(IllegalStateException.class, scope::close);

        assertSame(second, thrown);
        assertSame(boom, thrown.getSuppressed()[0]);
        assertFalse(live.isActive());
        assertEquals(0, store.openConnections());
        SubscriptionHandle late = subscriber.subscribe(topic, new RecordingHandler());
        assertThrows(IllegalStateException.class, () -> scope.track(late));
        assertFalse(late.isActive());
    }

    private ChangeFeedSubscriber subscriber(ChangeFeed feed) {
        return new ChangeFeedSubscriber(feed, Runnable::run, scheduler, 1, 4, eventBus);
    }

    private static FeedFrame frame(String content) {
        Notification notification = new Notification("u1", NotificationKind.MESSAGE, content, "u2");
        notification.setId(content + "-id");
        return new FeedFrame(RowKind.NOTIFICATION, ChangeType.INSERT, RowJson.toRecord(notification));
    }

    private void await(BooleanSupplier condition, long timeoutMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        if (!condition.getAsBoolean()) {
            throw new AssertionError("Timeout esperando condición");
        }
    }

    private static final class RecordingHandler implements ChangeHandler {
        private final List<ChangeEvent> events = new CopyOnWriteArrayList<>();
        private final AtomicInteger resubscribed = new AtomicInteger();

        @Override
        public void onChange(ChangeEvent event) {
            events.add(event);
        }

        @Override
        public void onResubscribed(FeedTopic topic) {
            resubscribed.incrementAndGet();
        }
    }

    private static final class CapturingFeed implements ChangeFeed {
        private final List<FeedListener> listeners = new CopyOnWriteArrayList<>();

        @Override
        public FeedConnection connect(RowKind kind, RowFilter filter, FeedListener listener) {
            listeners.add(listener);
            return new FeedConnection() {
                private boolean open = true;

                @Override
                public boolean isOpen() {
                    return open;
                }

                @Override
                public void close() {
                    open = false;
                }
            };
        }
    }

    private static final class FailingHandle implements SubscriptionHandle {
        private final FeedTopic topic;
        private final RuntimeException failure;

        private FailingHandle(FeedTopic topic, RuntimeException failure) {
            this.topic = topic;
            this.failure = failure;
        }

        @Override
        public FeedTopic getTopic() {
            return topic;
        }

        @Override
        public boolean isActive() {
            return true;
        }

        @Override
        public void close() {
            throw failure;
        }
    }
}
