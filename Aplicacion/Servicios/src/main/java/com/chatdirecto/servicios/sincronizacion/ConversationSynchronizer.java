package com.chatdirecto.servicios.sincronizacion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import com.chatdirecto.entidades.MediaAttachment;
import com.chatdirecto.entidades.Message;
import com.chatdirecto.entidades.Notification;
import com.chatdirecto.entidades.NotificationKind;
import com.chatdirecto.repositorios.MessageRepository;
import com.chatdirecto.repositorios.excepciones.UploadException;
import com.chatdirecto.servicios.eventos.SyncEventType;
import com.chatdirecto.servicios.feed.ChangeEvent;
import com.chatdirecto.servicios.feed.ChangeHandler;
import com.chatdirecto.servicios.feed.FeedTopic;
import com.chatdirecto.servicios.feed.SubscriptionScope;
import com.chatdirecto.servicios.metrics.SyncMetrics;
import com.chatdirecto.servicios.validacion.ValidationException;

/**
 * Log ordenado de la conversación abierta. Solo hay una conversación viva a la vez: abrir otra
 * cierra antes el ámbito de suscripciones de la anterior.
 *
 * <p>Los mensajes se identifican por id. El eco del feed de un mensaje propio que ya está en el
 * log se descarta, llegue antes o después de la confirmación de la escritura. Cada continuación
 * asíncrona lleva la generación de la conversación para la que se emitió y se descarta si esa
 * conversación ya no está abierta.
 */
public class ConversationSynchronizer {

    private static final Logger LOGGER = Logger.getLogger(ConversationSynchronizer.class.getName());

    static final String MESSAGE_NOTIFICATION_PREFIX = "Nuevo mensaje de ";

    private static final Comparator<Message> CHRONOLOGICAL = Comparator
        .comparing(Message::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(Message::getId);

    private final SessionContext session;
    private final MessageRepository messages;

    private final List<Message> log = new ArrayList<>();
    private final Map<String, Message> byId = new HashMap<>();
    private long generation;
    private String friendId;
    private SubscriptionScope scope;

    public ConversationSynchronizer(SessionContext session) {
        this.session = Objects.requireNonNull(session, "session");
        this.messages = session.getStore().messages();
    }

    /**
     * Abre la conversación con {@code friendId}: se suscribe a sus mensajes, trae el historial
     * completo y marca como leídos los recibidos. El futuro termina con el log tras la carga,
     * o se cancela si entretanto se abrió otra conversación.
     */
    public CompletableFuture<List<Message>> open(String friendId) {
        if (friendId == null || friendId.isBlank()) {
            return fail("open", new ValidationException("Debes elegir con quién conversar"));
        }
        if (friendId.equals(session.userId())) {
            return fail("open", new ValidationException("No puedes abrir una conversación contigo mismo"));
        }
        closeCurrent();
        long gen = ++generation;
        this.friendId = friendId;
        this.scope = new SubscriptionScope("conversation-" + friendId);
        scope.open(session.getSubscriber(), FeedTopic.conversation(session.userId(), friendId), new LogHandler(gen));
        session.getEventBus().publish(SyncEventType.CONVERSATION_OPENED, Map.of("friendId", friendId));
        LOGGER.fine(() -> "Conversación con " + friendId + " abierta (generación " + gen + ")");

        return fetch(gen, friendId)
            .thenApply(snapshot -> {
                markReadInBackground(gen, friendId, unreadFrom(friendId, snapshot));
                return snapshot;
            })
            .whenComplete((snapshot, error) -> {
                if (error != null && !(SessionContext.unwrap(error) instanceof CancellationException)) {
                    session.reportFailure("open", error);
                }
            });
    }

    /**
     * Envía un mensaje a la conversación abierta. El texto se recorta y, si queda vacío, se
     * omite; hace falta texto o adjunto. El adjunto se sube primero y, si la subida falla,
     * no se escribe ninguna fila.
     */
    public CompletableFuture<Message> send(String content, MediaUpload media) {
        String body = content != null && !content.isBlank() ? content.trim() : null;
        if (friendId == null) {
            return fail("send", new ValidationException("No hay ninguna conversación abierta"));
        }
        if (body == null && media == null) {
            return fail("send", new ValidationException("El mensaje necesita texto o un archivo adjunto"));
        }
        if (media != null && media.size() == 0) {
            return fail("send", new ValidationException("El archivo " + media.getFileName() + " está vacío"));
        }
        long maxBytes = session.getConfig().getMaxMediaBytes();
        if (media != null && media.size() > maxBytes) {
            return fail("send", new ValidationException("El archivo supera el máximo de "
                + (maxBytes / (1024 * 1024)) + " MB"));
        }
        long gen = generation;
        String receiverId = friendId;
        String me = session.userId();

        CompletableFuture<MediaAttachment> attachment = media == null
            ? CompletableFuture.completedFuture(null)
            : upload(media);
        return attachment
            .thenCompose(uploaded -> messages.insert(new Message(me, receiverId, body, uploaded)))
            .thenApplyAsync(row -> {
                if (gen == generation) {
                    merge(row, false);
                    publishChanged();
                }
                session.getEventBus().publish(SyncEventType.MESSAGE_SENT, Map.of(
                    "messageId", row.getId(),
                    "receiverId", receiverId));
                return row;
            }, session.getLoop())
            .thenCompose(row -> session.notifyBestEffort(new Notification(receiverId, NotificationKind.MESSAGE,
                    MESSAGE_NOTIFICATION_PREFIX + session.username(), me))
                .thenApply(ignored -> row))
            .whenComplete((row, error) -> {
                if (error != null) {
                    session.reportFailure("send", error);
                }
            });
    }

    /**
     * Cierra la conversación abierta, si la hay, y vacía el log.
     */
    public void close() {
        if (closeCurrent()) {
            session.getEventBus().publish(SyncEventType.CONVERSATION_CLOSED, Map.of());
        }
    }

    public List<Message> messages() {
        return Collections.unmodifiableList(new ArrayList<>(log));
    }

    public Optional<String> currentFriend() {
        return Optional.ofNullable(friendId);
    }

    public boolean isOpen() {
        return friendId != null;
    }

    private boolean closeCurrent() {
        SubscriptionScope previous = scope;
        if (previous == null) {
            return false;
        }
        scope = null;
        generation++;
        friendId = null;
        try {
            previous.close();
        } finally {
            log.clear();
            byId.clear();
        }
        return true;
    }

    private CompletableFuture<List<Message>> fetch(long gen, String friend) {
        return messages.findConversation(session.userId(), friend)
            .thenApplyAsync(rows -> {
                if (gen != generation) {
                    discard("stale_conversation", null);
                    throw new CancellationException("La conversación con " + friend + " ya no está abierta");
                }
                rows.forEach(row -> merge(row, false));
                publishChanged();
                return messages();
            }, session.getLoop());
    }

    private static Set<String> unreadFrom(String senderId, List<Message> snapshot) {
        return snapshot.stream()
            .filter(message -> senderId.equals(message.getSenderId()) && !message.isRead())
            .map(Message::getId)
            .collect(Collectors.toSet());
    }

    /**
     * Marca en el almacén los mensajes recibidos de {@code friend}. Localmente solo se marcan
     * los que estaban sin leer en el historial cargado: lo que llegue por el feed mientras tanto
     * sigue sin leer en el almacén y conserva su estado.
     */
    private void markReadInBackground(long gen, String friend, Set<String> loadedUnread) {
        messages.markReadFrom(friend, session.userId())
            .whenCompleteAsync((count, error) -> {
                if (error != null) {
                    LOGGER.log(Level.WARNING, "No se pudieron marcar como leídos los mensajes de " + friend,
                        SessionContext.unwrap(error));
                    return;
                }
                if (gen == generation && count > 0) {
                    markReadLocally(loadedUnread);
                }
            }, session.getLoop());
    }

    private void markReadLocally(Set<String> ids) {
        boolean changed = false;
        for (Message message : log) {
            if (ids.contains(message.getId()) && !message.isRead()) {
                message.setRead(true);
                changed = true;
            }
        }
        if (changed) {
            publishChanged();
        }
    }

    private CompletableFuture<MediaAttachment> upload(MediaUpload media) {
        String bucket = session.getConfig().getMediaBucket();
        String path = session.userId() + "/" + session.getClock().millis() + "." + media.extension();
        return session.getStore().blobs()
            .upload(bucket, path, media.getContent(), media.getContentType())
            .handle((url, error) -> {
                if (error != null) {
                    Throwable cause = SessionContext.unwrap(error);
                    throw cause instanceof UploadException
                        ? (UploadException) cause
                        : new UploadException("No se pudo subir " + media.getFileName(), cause);
                }
                if (url == null || url.isBlank()) {
                    throw new UploadException("El almacenamiento no devolvió la URL de " + media.getFileName());
                }
                SyncMetrics.recordMediaUpload(media.size());
                return new MediaAttachment(url, media.kind(), media.getFileName());
            });
    }

    /**
     * Incorpora una fila al log. Un insert del feed con un id conocido es el eco de algo ya
     * aplicado y se descarta; cualquier otra fila con id conocido reemplaza a la local sin
     * perder la marca de leído.
     */
    private boolean merge(Message incoming, boolean feedInsert) {
        if (incoming == null || incoming.getId() == null || !incoming.belongsTo(session.userId(), friendId)) {
            discard("foreign_conversation", incoming != null ? incoming.getId() : null);
            return false;
        }
        Message current = byId.get(incoming.getId());
        if (current == null) {
            byId.put(incoming.getId(), incoming);
            log.add(incoming);
            log.sort(CHRONOLOGICAL);
            return true;
        }
        if (feedInsert) {
            discard("duplicate", incoming.getId());
            return false;
        }
        boolean wasRead = current.isRead();
        incoming.setRead(wasRead || incoming.isRead());
        byId.put(incoming.getId(), incoming);
        log.set(log.indexOf(current), incoming);
        return wasRead != incoming.isRead();
    }

    private void discard(String reason, String rowId) {
        LOGGER.fine(() -> "Mensaje " + rowId + " descartado: " + reason);
        session.getEventBus().publish(SyncEventType.EVENT_DISCARDED, rowId != null
            ? Map.of("reason", reason, "rowId", rowId)
            : Map.of("reason", reason));
    }

    private void publishChanged() {
        session.getEventBus().publish(SyncEventType.CONVERSATION_CHANGED, Map.of(
            "friendId", friendId,
            "messages", log.size()));
    }

    private <T> CompletableFuture<T> fail(String action, RuntimeException error) {
        session.reportFailure(action, error);
        return CompletableFuture.failedFuture(error);
    }

    private final class LogHandler implements ChangeHandler {
        private final long gen;

        private LogHandler(long gen) {
            this.gen = gen;
        }

        @Override
        public void onChange(ChangeEvent event) {
            if (gen != generation) {
                discard("stale_conversation", event.getRowId());
                return;
            }
            if (merge(event.message(), event.isInsert())) {
                publishChanged();
            }
        }

        @Override
        public void onResubscribed(FeedTopic topic) {
            if (gen != generation) {
                return;
            }
            fetch(gen, friendId).whenComplete((ignored, error) -> {
                if (error != null && !(SessionContext.unwrap(error) instanceof CancellationException)) {
                    LOGGER.log(Level.WARNING, "No se pudo poner al día la conversación tras reconectar",
                        SessionContext.unwrap(error));
                }
            });
        }
    }
}
