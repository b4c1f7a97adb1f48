package com.chatdirecto.repositorios.memoria;

import com.chatdirecto.entidades.Friendship;
import com.chatdirecto.entidades.FriendshipStatus;
import com.chatdirecto.entidades.MediaAttachment;
import com.chatdirecto.entidades.MediaKind;
import com.chatdirecto.entidades.Message;
import com.chatdirecto.entidades.Notification;
import com.chatdirecto.entidades.NotificationKind;
import com.chatdirecto.entidades.Profile;
import com.chatdirecto.repositorios.RowKind;
import com.chatdirecto.repositorios.excepciones.ConflictException;
import com.chatdirecto.repositorios.excepciones.ForbiddenException;
import com.chatdirecto.repositorios.excepciones.InvalidRowException;
import com.chatdirecto.repositorios.excepciones.NotFoundException;
import com.chatdirecto.repositorios.excepciones.TransportException;
import com.chatdirecto.repositorios.feed.ChangeType;
import com.chatdirecto.repositorios.feed.FeedConnection;
import com.chatdirecto.repositorios.feed.FeedFrame;
import com.chatdirecto.repositorios.feed.FeedListener;
import com.chatdirecto.repositorios.feed.RowFilter;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryRemoteStoreTest {

    private final InMemoryRemoteStore store = new InMemoryRemoteStore();

    @Test
    void elParDeAmistadEsUnicoSinImportarElOrden() {
        Profile ana = store.createProfile("ana");
        Profile beto = store.createProfile("beto");

        Friendship created = store.friendships().insert(new Friendship(ana.getId(), beto.getId())).join();

        assertNotNull(created.getId());
        assertEquals(FriendshipStatus.PENDING, created.getStatus());
        Throwable failure = failureOf(store.friendships().insert(new Friendship(beto.getId(), ana.getId())));
        assertInstanceOf(ConflictException.class, failure);
        assertEquals(409, ((ConflictException) failure).getCode());
        assertInstanceOf(InvalidRowException.class,
            failureOf(store.friendships().insert(new Friendship(ana.getId(), ana.getId()))));
    }

    @Test
    void soloElDestinatarioRespondeYSoloDesdePendiente() {
        Profile ana = store.createProfile("ana");
        Profile beto = store.createProfile("beto");
        Friendship pending = store.friendships().insert(new Friendship(ana.getId(), beto.getId())).join();

        assertInstanceOf(ForbiddenException.class,
            failureOf(store.friendships().updateStatus(pending.getId(), FriendshipStatus.ACCEPTED, ana.getId())));
        assertInstanceOf(NotFoundException.class,
            failureOf(store.friendships().updateStatus("missing", FriendshipStatus.ACCEPTED, beto.getId())));

        Friendship accepted = store.friendships().updateStatus(pending.getId(), FriendshipStatus.ACCEPTED, beto.getId()).join();
        assertEquals(FriendshipStatus.ACCEPTED, accepted.getStatus());
        assertInstanceOf(InvalidRowException.class,
            failureOf(store.friendships().updateStatus(pending.getId(), FriendshipStatus.REJECTED, beto.getId())));
    }

    @Test
    void elFeedEntregaSoloFilasQueCumplenElFiltro() {
        RecordingListener listener = new RecordingListener();
        FeedConnection connection = store.feed().connect(RowKind.MESSAGE,
            RowFilter.and(RowFilter.eq("sender_id", "a"), RowFilter.eq("receiver_id", "b")), listener);

        store.messages().insert(new Message("a", "b", "hola", null)).join();
        store.messages().insert(new Message("a", "c", "otra conversación", null)).join();
        store.messages().markReadFrom("a", "b").join();

        assertEquals(2, listener.frames.size());
        assertEquals(ChangeType.INSERT, listener.frames.get(0).getChangeType());
        assertEquals(ChangeType.UPDATE, listener.frames.get(1).getChangeType());
        assertTrue(listener.frames.get(1).getRecord().get("read").asBoolean());

        connection.close();
        store.messages().insert(new Message("a", "b", "después de cerrar", null)).join();
        assertEquals(2, listener.frames.size());
        assertFalse(connection.isOpen());
    }

    @Test
    void mensajesSinCuerpoSeRechazanYLosAdjuntosSeConservan() {
        assertInstanceOf(InvalidRowException.class,
            failureOf(store.messages().insert(new Message("a", "b", "  ", null))));

        MediaAttachment gif = new MediaAttachment("memory://chat-media/a/1.gif", MediaKind.GIF, "1.gif");
        store.messages().insert(new Message("a", "b", null, gif)).join();
        store.messages().insert(new Message("b", "a", "respuesta", null)).join();

        List<Message> conversation = store.messages().findConversation("b", "a").join();
        assertEquals(2, conversation.size());
        assertEquals(MediaKind.GIF, conversation.get(0).getMediaType());
        assertEquals("respuesta", conversation.get(1).getContent());
        assertTrue(conversation.get(0).getCreatedAt().isBefore(conversation.get(1).getCreatedAt()));
    }

    @Test
    void notificacionesRecientesPrimeroYMarcadoSoloPorElDueno() {
        for (int i = 0; i < 3; i++) {
            store.notifications().insert(new Notification("u1", NotificationKind.MESSAGE, "n" + i, null)).join();
        }

        List<Notification> recent = store.notifications().findRecentFor("u1", 2).join();
        assertEquals(2, recent.size());
        assertEquals("n2", recent.get(0).getContent());

        assertInstanceOf(ForbiddenException.class,
            failureOf(store.notifications().markRead(recent.get(0).getId(), "u2")));
        assertTrue(store.notifications().markRead(recent.get(0).getId(), "u1").join().isRead());
    }

    @Test
    void retencionDelFeedYCaidasDelTransporte() {
        RecordingListener listener = new RecordingListener();
        store.feed().connect(RowKind.NOTIFICATION, RowFilter.eq("user_id", "u1"), listener);

        store.holdFeed();
        store.notifications().insert(new Notification("u1", NotificationKind.FRIEND_REQUEST, "hola", null)).join();
        assertTrue(listener.frames.isEmpty());
        store.releaseFeed();
        assertEquals(1, listener.frames.size());

        assertEquals(1, store.dropConnections(RowKind.NOTIFICATION));
        assertEquals(1, listener.errors.size());
        assertEquals(0, store.openConnections(RowKind.NOTIFICATION));

        store.refuseConnects(1);
        assertThrows(TransportException.class,
            () -> store.feed().connect(RowKind.NOTIFICATION, RowFilter.all(), new RecordingListener()));
        store.feed().connect(RowKind.NOTIFICATION, RowFilter.all(), new RecordingListener());
        assertEquals(1, store.openConnections());
    }

    @Test
    void fallosProgramadosAfectanSoloALaSiguienteOperacion() {
        store.failNext(RowKind.MESSAGE, new TransportException("sin red"));

        assertInstanceOf(TransportException.class,
            failureOf(store.messages().insert(new Message("a", "b", "hola", null))));
        store.messages().insert(new Message("a", "b", "hola", null)).join();
        assertEquals(1, store.rowCount(RowKind.MESSAGE));
    }

    @Test
    void busquedaPorNombreIgnoraMayusculasYExcluyeAlUsuario() {
        Profile ana = store.createProfile("ana");
        store.createProfile("Anabel");
        store.createProfile("beto");

        List<Profile> found = store.profiles().searchByUsername("AN", ana.getId(), 10).join();

        assertEquals(1, found.size());
        assertEquals("Anabel", found.get(0).getUsername());
        assertInstanceOf(ConflictException.class,
            assertThrows(CompletionException.class, () -> store.createProfile("ANA")).getCause());
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        CompletionException error = assertThrows(CompletionException.class, future::join);
        return error.getCause();
    }

    private static final class RecordingListener implements FeedListener {
        private final List<FeedFrame> frames = new ArrayList<>();
        private final List<Throwable> errors = new ArrayList<>();

        @Override
        public void onFrame(FeedFrame frame) {
            frames.add(frame);
        }

        @Override
        public void onTransportError(Throwable cause) {
            errors.add(cause);
        }
    }
}
