package com.chatdirecto.servicios.sincronizacion;

import com.chatdirecto.entidades.Friendship;
import com.chatdirecto.entidades.FriendshipStatus;
import com.chatdirecto.entidades.Notification;
import com.chatdirecto.entidades.NotificationKind;
import com.chatdirecto.entidades.Profile;
import com.chatdirecto.repositorios.RowKind;
import com.chatdirecto.repositorios.excepciones.ConflictException;
import com.chatdirecto.repositorios.excepciones.ForbiddenException;
import com.chatdirecto.repositorios.excepciones.NotFoundException;
import com.chatdirecto.repositorios.feed.ChangeType;
import com.chatdirecto.servicios.eventos.SyncEventType;
import com.chatdirecto.servicios.feed.ChangeEvent;
import com.chatdirecto.servicios.feed.FeedTopic;
import com.chatdirecto.servicios.validacion.ValidationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FriendshipSynchronizerTest {

    private SyncFixture fixture = new SyncFixture();

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void solicitudCreaFilaPendienteYNotificaAlDestinatario() {
        Profile ana = fixture.store.createProfile("ana");
        Profile beto = fixture.store.createProfile("beto");
        FriendshipSynchronizer sync = started(ana);

        Friendship request = sync.requestFriend(beto.getId()).join();

        assertEquals(FriendshipStatus.PENDING, request.getStatus());
        assertEquals(ana.getId(), request.getRequesterId());
        assertEquals(1, sync.pendingOutgoing().size());
        assertTrue(sync.friends().isEmpty());
        List<Notification> received = fixture.store.notifications().findRecentFor(beto.getId(), 10).join();
        assertEquals(1, received.size());
        assertEquals(NotificationKind.FRIEND_REQUEST, received.get(0).getType());
        assertEquals(FriendshipSynchronizer.FRIEND_REQUEST_TEXT, received.get(0).getContent());
        assertEquals(ana.getId(), received.get(0).getRelatedId());
        assertTrue(fixture.eventTypes().contains(SyncEventType.FRIEND_REQUEST_SENT));
    }

    @Test
    void solicitudRepetidaEnCualquierSentidoEsConflicto() {
        Profile ana = fixture.store.createProfile("ana");
        Profile beto = fixture.store.createProfile("beto");
        FriendshipSynchronizer anaSync = started(ana);
        FriendshipSynchronizer betoSync = started(beto);
        anaSync.requestFriend(beto.getId()).join();

        Throwable pending = failureOf(betoSync.requestFriend(ana.getId()));
        assertInstanceOf(ConflictException.class, pending);
        assertEquals("Ya existe una solicitud de amistad entre ambos usuarios", pending.getMessage());

        betoSync.respond(betoSync.pendingIncoming().get(0).getId(), true).join();
        Throwable accepted = failureOf(anaSync.requestFriend(beto.getId()));
        assertEquals("Ya son amigos", accepted.getMessage());
        assertEquals(1, fixture.store.rowCount(RowKind.FRIENDSHIP));
        assertTrue(fixture.eventTypes().contains(SyncEventType.ACTION_FAILED));
    }

    @Test
    void validaAntesDeLlamarAlAlmacen() {
        Profile ana = fixture.store.createProfile("ana");
        FriendshipSynchronizer sync = started(ana);

        assertInstanceOf(ValidationException.class, failureOf(sync.requestFriend(ana.getId())));
        assertInstanceOf(ValidationException.class, failureOf(sync.requestFriend("  ")));
        assertInstanceOf(ValidationException.class, failureOf(sync.respond(null, true)));
        assertEquals(0, fixture.store.rowCount(RowKind.FRIENDSHIP));
    }

    @Test
    void aceptarActualizaLasListasDeAmbosYAvisaAlSolicitante() {
        Profile ana = fixture.store.createProfile("ana");
        Profile beto = fixture.store.createProfile("beto");
        FriendshipSynchronizer anaSync = started(ana);
        FriendshipSynchronizer betoSync = started(beto);

        Friendship request = anaSync.requestFriend(beto.getId()).join();
        assertEquals(1, betoSync.pendingIncoming().size());

        betoSync.respond(request.getId(), true).join();

        assertEquals(List.of("beto"), usernames(anaSync.friends()));
        assertEquals(List.of("ana"), usernames(betoSync.friends()));
        assertTrue(betoSync.pendingIncoming().isEmpty());
        List<Notification> anaNotifications = fixture.store.notifications().findRecentFor(ana.getId(), 10).join();
        assertEquals(NotificationKind.FRIEND_ACCEPTED, anaNotifications.get(0).getType());
        assertEquals(beto.getId(), anaNotifications.get(0).getRelatedId());
    }

    @Test
    void rechazarNoAgregaAmigosNiNotifica() {
        Profile ana = fixture.store.createProfile("ana");
        Profile beto = fixture.store.createProfile("beto");
        FriendshipSynchronizer anaSync = started(ana);
        FriendshipSynchronizer betoSync = started(beto);
        Friendship request = anaSync.requestFriend(beto.getId()).join();

        Friendship rejected = betoSync.respond(request.getId(), false).join();

        assertEquals(FriendshipStatus.REJECTED, rejected.getStatus());
        assertTrue(anaSync.friends().isEmpty());
        assertTrue(anaSync.pendingOutgoing().isEmpty());
        assertTrue(fixture.store.notifications().findRecentFor(ana.getId(), 10).join().isEmpty());
    }

    @Test
    void soloElDestinatarioPuedeResponderYElEstadoLocalNoCambia() {
        Profile ana = fixture.store.createProfile("ana");
        Profile beto = fixture.store.createProfile("beto");
        FriendshipSynchronizer anaSync = started(ana);
        Friendship request = anaSync.requestFriend(beto.getId()).join();

        assertInstanceOf(ForbiddenException.class, failureOf(anaSync.respond(request.getId(), true)));

        assertEquals(FriendshipStatus.PENDING, anaSync.friendships().get(0).getStatus());
        assertTrue(anaSync.friends().isEmpty());
    }

    @Test
    void unEstadoFinalNoSeSobrescribeYLaReentregaEsIdempotente() {
        Profile ana = fixture.store.createProfile("ana");
        Profile beto = fixture.store.createProfile("beto");
        FriendshipSynchronizer anaSync = started(ana);
        FriendshipSynchronizer betoSync = started(beto);
        Friendship request = anaSync.requestFriend(beto.getId()).join();
        Friendship accepted = betoSync.respond(request.getId(), true).join();
        FeedTopic topic = FeedTopic.friendshipsTouching(ana.getId());

        anaSync.onChange(ChangeEvent.of(topic, ChangeType.UPDATE, accepted.getId(), accepted));
        Friendship bogus = copy(accepted, FriendshipStatus.REJECTED);
        anaSync.onChange(ChangeEvent.of(topic, ChangeType.UPDATE, bogus.getId(), bogus));
        Friendship stale = copy(accepted, FriendshipStatus.PENDING);
        anaSync.onChange(ChangeEvent.of(topic, ChangeType.INSERT, stale.getId(), stale));

        assertEquals(1, anaSync.friendships().size());
        assertEquals(FriendshipStatus.ACCEPTED, anaSync.friendships().get(0).getStatus());
        assertEquals(List.of("beto"), usernames(anaSync.friends()));
        assertEquals(2, fixture.count(SyncEventType.EVENT_DISCARDED));
    }

    @Test
    void laCarreraDeSolicitudesMutuasDevuelveElConflictoDelAlmacen() {
        fixture.close();
        SyncFixture.QueuedLoop loop = new SyncFixture.QueuedLoop();
        fixture = new SyncFixture(loop);
        Profile ana = fixture.store.createProfile("ana");
        Profile beto = fixture.store.createProfile("beto");
        FriendshipSynchronizer anaSync = new FriendshipSynchronizer(fixture.session(ana));
        anaSync.start();
        loop.runAll();

        CompletableFuture<Friendship> request = anaSync.requestFriend(beto.getId());
        fixture.store.friendships().insert(new Friendship(beto.getId(), ana.getId())).join();
        loop.runAll();

        Throwable failure = failureOf(request);
        assertInstanceOf(ConflictException.class, failure);
        assertTrue(failure.getMessage().contains("friendships_pair_key"));
        assertEquals(1, fixture.store.rowCount(RowKind.FRIENDSHIP));
        assertEquals(1, anaSync.pendingIncoming().size());
    }

    @Test
    void reconectarVuelveACargarLasAmistades() {
        Profile ana = fixture.store.createProfile("ana");
        Profile beto = fixture.store.createProfile("beto");
        FriendshipSynchronizer anaSync = started(ana);
        fixture.store.holdFeed();
        fixture.store.friendships().insert(new Friendship(beto.getId(), ana.getId())).join();
        assertTrue(anaSync.pendingIncoming().isEmpty());

        anaSync.onResubscribed(FeedTopic.friendshipsTouching(ana.getId()));

        assertEquals(1, anaSync.pendingIncoming().size());
        fixture.store.releaseFeed();
        assertEquals(1, anaSync.friendships().size());
    }

    @Test
    void responderUnaSolicitudInexistenteEsNotFoundYNoTocaElEstado() {
        Profile ana = fixture.store.createProfile("ana");
        Profile beto = fixture.store.createProfile("beto");
        FriendshipSynchronizer anaSync = started(ana);
        FriendshipSynchronizer betoSync = started(beto);
        anaSync.requestFriend(beto.getId()).join();
        fixture.events.clear();

        assertInstanceOf(NotFoundException.class, failureOf(betoSync.respond("inexistente", true)));

        assertEquals(1, betoSync.friendships().size());
        assertEquals(FriendshipStatus.PENDING, betoSync.friendships().get(0).getStatus());
        assertEquals(1, betoSync.pendingIncoming().size());
        assertTrue(betoSync.friends().isEmpty());
        assertEquals(List.of(SyncEventType.ACTION_FAILED), fixture.eventTypes());
    }

    @Test
    void lasRespuestasQueLleganTrasCerrarLaSesionNoPublicanAmigos() {
        fixture.close();
        SyncFixture.QueuedLoop loop = new SyncFixture.QueuedLoop();
        fixture = new SyncFixture(loop);
        Profile ana = fixture.store.createProfile("ana");
        Profile beto = fixture.store.createProfile("beto");
        Friendship accepted = fixture.store.friendships().insert(new Friendship(ana.getId(), beto.getId())).join();
        fixture.store.friendships().updateStatus(accepted.getId(), FriendshipStatus.ACCEPTED, beto.getId()).join();
        SessionContext session = fixture.session(ana);
        FriendshipSynchronizer anaSync = new FriendshipSynchronizer(session);

        CompletableFuture<List<Profile>> started = anaSync.start();
        session.close();
        loop.runAll();

        assertTrue(started.join().isEmpty());
        assertTrue(anaSync.friendships().isEmpty());
        assertEquals(0, fixture.count(SyncEventType.FRIENDS_CHANGED));
    }

    private FriendshipSynchronizer started(Profile profile) {
        FriendshipSynchronizer sync = new FriendshipSynchronizer(fixture.session(profile));
        sync.start().join();
        return sync;
    }

    private static Friendship copy(Friendship source, FriendshipStatus status) {
        Friendship copy = new Friendship(source.getRequesterId(), source.getAddresseeId());
        copy.setId(source.getId());
        copy.setCreatedAt(source.getCreatedAt());
        copy.setStatus(status);
        return copy;
    }

    private static List<String> usernames(List<Profile> profiles) {
        return profiles.stream().map(Profile::getUsername).collect(Collectors.toList());
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        return assertThrows(CompletionException.class, future::join).getCause();
    }
}
