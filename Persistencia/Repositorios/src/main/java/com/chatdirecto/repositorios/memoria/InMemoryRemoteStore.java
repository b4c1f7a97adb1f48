package com.chatdirecto.repositorios.memoria;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import com.chatdirecto.entidades.Friendship;
import com.chatdirecto.entidades.FriendshipStatus;
import com.chatdirecto.entidades.Message;
import com.chatdirecto.entidades.Notification;
import com.chatdirecto.entidades.Profile;
import com.chatdirecto.repositorios.BlobStorage;
import com.chatdirecto.repositorios.FriendshipRepository;
import com.chatdirecto.repositorios.MessageRepository;
import com.chatdirecto.repositorios.NotificationRepository;
import com.chatdirecto.repositorios.ProfileRepository;
import com.chatdirecto.repositorios.RemoteStore;
import com.chatdirecto.repositorios.RowKind;
import com.chatdirecto.repositorios.excepciones.ConflictException;
import com.chatdirecto.repositorios.excepciones.ForbiddenException;
import com.chatdirecto.repositorios.excepciones.InvalidRowException;
import com.chatdirecto.repositorios.excepciones.NotFoundException;
import com.chatdirecto.repositorios.excepciones.TransportException;
import com.chatdirecto.repositorios.excepciones.UploadException;
import com.chatdirecto.repositorios.feed.ChangeFeed;
import com.chatdirecto.repositorios.feed.ChangeType;
import com.chatdirecto.repositorios.feed.FeedConnection;
import com.chatdirecto.repositorios.feed.FeedFrame;
import com.chatdirecto.repositorios.feed.FeedListener;
import com.chatdirecto.repositorios.feed.RowFilter;
import com.chatdirecto.repositorios.feed.RowJson;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Almacén remoto completo en memoria. Aplica las mismas reglas que el servidor real
 * (unicidad del par de amistad, transiciones, propiedad de filas) y empuja cada cambio
 * por el feed a las conexiones cuyo filtro coincide.
 *
 * <p>Las filas se guardan como JSON, así que todo lo que sale del almacén es una copia.
 * Los cambios se entregan de forma síncrona al terminar la escritura y antes de completar
 * el futuro, salvo que el feed esté retenido con {@link #holdFeed()}.
 */
public class InMemoryRemoteStore implements RemoteStore {

    private static final Logger LOGGER = Logger.getLogger(InMemoryRemoteStore.class.getName());
    private static final String BLOB_URL_PREFIX = "memory://";

    private final Object lock = new Object();
    private final Clock clock;
    private final Map<RowKind, Map<String, ObjectNode>> tables = new EnumMap<>(RowKind.class);
    private final Map<String, byte[]> blobs = new ConcurrentHashMap<>();
    private final List<MemoryConnection> connections = new CopyOnWriteArrayList<>();
    private final Map<RowKind, Deque<RuntimeException>> scheduledFailures = new EnumMap<>(RowKind.class);
    private final List<FeedFrame> outbox = new ArrayList<>();
    private final Deque<FeedFrame> heldFrames = new ArrayDeque<>();

    private Instant lastTimestamp = Instant.EPOCH;
    private boolean feedHeld;
    private int refusedConnects;
    private volatile RuntimeException uploadFailure;

    private final ProfileRepository profiles = new MemoryProfiles();
    private final FriendshipRepository friendships = new MemoryFriendships();
    private final MessageRepository messages = new MemoryMessages();
    private final NotificationRepository notifications = new MemoryNotifications();
    private final BlobStorage blobStorage = new MemoryBlobs();
    private final ChangeFeed feed = new MemoryFeed();

    public InMemoryRemoteStore() {
        this(Clock.systemUTC());
    }

    public InMemoryRemoteStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        for (RowKind kind : RowKind.values()) {
            tables.put(kind, new LinkedHashMap<>());
            scheduledFailures.put(kind, new ArrayDeque<>());
        }
    }

    @Override
    public ProfileRepository profiles() {
        return profiles;
    }

    @Override
    public FriendshipRepository friendships() {
        return friendships;
    }

    @Override
    public MessageRepository messages() {
        return messages;
    }

    @Override
    public NotificationRepository notifications() {
        return notifications;
    }

    @Override
    public BlobStorage blobs() {
        return blobStorage;
    }

    @Override
    public ChangeFeed feed() {
        return feed;
    }

    // --- Administración ---

    /**
     * Registra un perfil con nombre de usuario ya asignado.
     */
    public Profile createProfile(String username) {
        Profile profile = new Profile(UUID.randomUUID().toString(), username);
        return putProfile(profile);
    }

    public Profile putProfile(Profile profile) {
        Objects.requireNonNull(profile.getId(), "profile.id");
        return run(RowKind.PROFILE, () -> {
            String username = profile.getUsername();
            if (username != null && rows(RowKind.PROFILE, Profile.class).stream()
                    .anyMatch(p -> username.equalsIgnoreCase(p.getUsername()) && !p.getId().equals(profile.getId()))) {
                throw new ConflictException("El nombre de usuario ya está en uso");
            }
            Instant now = nextTimestamp();
            if (profile.getCreatedAt() == null) {
                profile.setCreatedAt(now);
            }
            profile.setUpdatedAt(now);
            boolean existed = table(RowKind.PROFILE).containsKey(profile.getId());
            return write(RowKind.PROFILE, profile.getId(), profile,
                existed ? ChangeType.UPDATE : ChangeType.INSERT, Profile.class);
        }).join();
    }

    /**
     * Hace fallar la próxima operación sobre filas {@code kind}.
     */
    public void failNext(RowKind kind, RuntimeException failure) {
        synchronized (lock) {
            scheduledFailures.get(kind).add(Objects.requireNonNull(failure, "failure"));
        }
    }

    public void failUploads(RuntimeException failure) {
        this.uploadFailure = failure;
    }

    /**
     * Retiene los cambios del feed hasta {@link #releaseFeed()}; las escrituras se confirman antes
     * de que llegue su eco.
     */
    public void holdFeed() {
        synchronized (lock) {
            feedHeld = true;
        }
    }

    public void releaseFeed() {
        List<FeedFrame> pending;
        synchronized (lock) {
            feedHeld = false;
            pending = new ArrayList<>(heldFrames);
            heldFrames.clear();
        }
        deliver(pending);
    }

    /**
     * Corta todas las conexiones abiertas sobre filas {@code kind} como lo haría una caída del transporte.
     */
    public int dropConnections(RowKind kind) {
        int dropped = 0;
        for (MemoryConnection connection : connections) {
            if (connection.kind == kind && connection.open) {
                connection.open = false;
                connections.remove(connection);
                dropped++;
                connection.listener.onTransportError(new TransportException("Conexión del feed perdida"));
            }
        }
        return dropped;
    }

    /**
     * Rechaza los próximos {@code attempts} intentos de conexión al feed.
     */
    public void refuseConnects(int attempts) {
        synchronized (lock) {
            refusedConnects = attempts;
        }
    }

    public int openConnections() {
        return (int) connections.stream().filter(c -> c.open).count();
    }

    public int openConnections(RowKind kind) {
        return (int) connections.stream().filter(c -> c.open && c.kind == kind).count();
    }

    public int rowCount(RowKind kind) {
        synchronized (lock) {
            return table(kind).size();
        }
    }

    public Optional<byte[]> blob(String bucket, String path) {
        return Optional.ofNullable(blobs.get(bucket + "/" + path));
    }

    // --- Núcleo ---

    private <T> CompletableFuture<T> run(RowKind kind, Supplier<T> operation) {
        T result;
        List<FeedFrame> frames;
        try {
            synchronized (lock) {
                RuntimeException failure = scheduledFailures.get(kind).poll();
                if (failure != null) {
                    throw failure;
                }
                result = operation.get();
                frames = drainOutbox();
            }
        } catch (RuntimeException e) {
            synchronized (lock) {
                outbox.clear();
            }
            return CompletableFuture.failedFuture(e);
        }
        deliver(frames);
        return CompletableFuture.completedFuture(result);
    }

    private List<FeedFrame> drainOutbox() {
        if (feedHeld) {
            heldFrames.addAll(outbox);
            outbox.clear();
            return List.of();
        }
        List<FeedFrame> frames = new ArrayList<>(outbox);
        outbox.clear();
        return frames;
    }

    private void deliver(List<FeedFrame> frames) {
        for (FeedFrame frame : frames) {
            for (MemoryConnection connection : connections) {
                if (!connection.open || connection.kind != frame.getKind() || !connection.filter.matches(frame.getRecord())) {
                    continue;
                }
                try {
                    connection.listener.onFrame(new FeedFrame(frame.getKind(), frame.getChangeType(), frame.getRecord().deepCopy()));
                } catch (RuntimeException e) {
                    LOGGER.log(Level.WARNING, "El receptor del feed falló procesando " + frame.getKind(), e);
                }
            }
        }
    }

    private Map<String, ObjectNode> table(RowKind kind) {
        return tables.get(kind);
    }

    private <T> List<T> rows(RowKind kind, Class<T> type) {
        return table(kind).values().stream()
            .map(record -> RowJson.fromRecord(record, type))
            .collect(Collectors.toList());
    }

    private <T> List<T> rows(RowKind kind, Class<T> type, Predicate<T> filter) {
        return rows(kind, type).stream().filter(filter).collect(Collectors.toList());
    }

    private <T> Optional<T> row(RowKind kind, String id, Class<T> type) {
        ObjectNode record = id != null ? table(kind).get(id) : null;
        return Optional.ofNullable(record).map(r -> RowJson.fromRecord(r, type));
    }

    private <T> T write(RowKind kind, String id, Object row, ChangeType changeType, Class<T> type) {
        ObjectNode record = RowJson.toRecord(row);
        table(kind).put(id, record);
        outbox.add(new FeedFrame(kind, changeType, record.deepCopy()));
        return RowJson.fromRecord(record, type);
    }

    private Instant nextTimestamp() {
        Instant now = clock.instant();
        if (!now.isAfter(lastTimestamp)) {
            now = lastTimestamp.plusNanos(1_000);
        }
        lastTimestamp = now;
        return now;
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new InvalidRowException(message);
        }
    }

    // --- Repositorios ---

    private final class MemoryProfiles implements ProfileRepository {

        @Override
        public CompletableFuture<Optional<Profile>> findById(String id) {
            return run(RowKind.PROFILE, () -> row(RowKind.PROFILE, id, Profile.class));
        }

        @Override
        public CompletableFuture<List<Profile>> findByIds(Collection<String> ids) {
            Set<String> wanted = new HashSet<>(ids);
            return run(RowKind.PROFILE, () -> rows(RowKind.PROFILE, Profile.class, p -> wanted.contains(p.getId())));
        }

        @Override
        public CompletableFuture<List<Profile>> searchByUsername(String fragment, String excludeId, int limit) {
            String needle = fragment.toLowerCase(Locale.ROOT);
            return run(RowKind.PROFILE, () -> rows(RowKind.PROFILE, Profile.class).stream()
                .filter(p -> p.getUsername() != null)
                .filter(p -> !p.getId().equals(excludeId))
                .filter(p -> p.getUsername().toLowerCase(Locale.ROOT).contains(needle))
                .sorted(Comparator.comparing(Profile::getUsername))
                .limit(Math.max(0, limit))
                .collect(Collectors.toList()));
        }
    }

    private final class MemoryFriendships implements FriendshipRepository {

        @Override
        public CompletableFuture<Friendship> insert(Friendship friendship) {
            return run(RowKind.FRIENDSHIP, () -> {
                String requester = friendship.getRequesterId();
                String addressee = friendship.getAddresseeId();
                require(requester != null && addressee != null, "requester_id y addressee_id son obligatorios");
                require(!requester.equals(addressee), "Un usuario no puede ser amigo de sí mismo");
                require(friendship.getStatus() == null || friendship.getStatus() == FriendshipStatus.PENDING,
                    "Una amistad nueva debe estar pendiente");
                if (!rows(RowKind.FRIENDSHIP, Friendship.class, f -> f.isBetween(requester, addressee)).isEmpty()) {
                    throw new ConflictException("duplicate key value violates unique constraint \"friendships_pair_key\"");
                }
                Friendship row = new Friendship(requester, addressee);
                row.setId(newId());
                row.setCreatedAt(nextTimestamp());
                return write(RowKind.FRIENDSHIP, row.getId(), row, ChangeType.INSERT, Friendship.class);
            });
        }

        @Override
        public CompletableFuture<Friendship> updateStatus(String id, FriendshipStatus status, String actingUserId) {
            return run(RowKind.FRIENDSHIP, () -> {
                Friendship row = row(RowKind.FRIENDSHIP, id, Friendship.class)
                    .orElseThrow(() -> new NotFoundException("Amistad inexistente: " + id));
                if (!Objects.equals(actingUserId, row.getAddresseeId())) {
                    throw new ForbiddenException("Solo el destinatario puede responder la solicitud");
                }
                require(row.getStatus().canTransitionTo(status),
                    "Transición no permitida: " + row.getStatus().wireValue() + " -> " + (status != null ? status.wireValue() : null));
                row.setStatus(status);
                return write(RowKind.FRIENDSHIP, row.getId(), row, ChangeType.UPDATE, Friendship.class);
            });
        }

        @Override
        public CompletableFuture<Optional<Friendship>> findById(String id) {
            return run(RowKind.FRIENDSHIP, () -> row(RowKind.FRIENDSHIP, id, Friendship.class));
        }

        @Override
        public CompletableFuture<Optional<Friendship>> findBetween(String a, String b) {
            return run(RowKind.FRIENDSHIP, () -> rows(RowKind.FRIENDSHIP, Friendship.class, f -> f.isBetween(a, b))
                .stream().findFirst());
        }

        @Override
        public CompletableFuture<List<Friendship>> findTouching(String userId) {
            return run(RowKind.FRIENDSHIP, () -> rows(RowKind.FRIENDSHIP, Friendship.class, f -> f.involves(userId)));
        }

        @Override
        public CompletableFuture<List<Friendship>> findPendingFor(String addresseeId) {
            return run(RowKind.FRIENDSHIP, () -> rows(RowKind.FRIENDSHIP, Friendship.class,
                f -> addresseeId.equals(f.getAddresseeId()) && f.getStatus() == FriendshipStatus.PENDING));
        }
    }

    private final class MemoryMessages implements MessageRepository {

        @Override
        public CompletableFuture<Message> insert(Message message) {
            return run(RowKind.MESSAGE, () -> {
                require(message.getSenderId() != null && message.getReceiverId() != null,
                    "sender_id y receiver_id son obligatorios");
                require(message.hasBody(), "El mensaje necesita contenido o un adjunto");
                Message row = new Message(message.getSenderId(), message.getReceiverId(), message.getContent(), message.getMedia());
                row.setId(newId());
                row.setRead(false);
                row.setCreatedAt(nextTimestamp());
                return write(RowKind.MESSAGE, row.getId(), row, ChangeType.INSERT, Message.class);
            });
        }

        @Override
        public CompletableFuture<List<Message>> findConversation(String a, String b) {
            return run(RowKind.MESSAGE, () -> rows(RowKind.MESSAGE, Message.class, m -> m.belongsTo(a, b)).stream()
                .sorted(Comparator.comparing(Message::getCreatedAt))
                .collect(Collectors.toList()));
        }

        @Override
        public CompletableFuture<Integer> markReadFrom(String senderId, String receiverId) {
            return run(RowKind.MESSAGE, () -> {
                List<Message> unread = rows(RowKind.MESSAGE, Message.class,
                    m -> senderId.equals(m.getSenderId()) && receiverId.equals(m.getReceiverId()) && !m.isRead());
                for (Message message : unread) {
                    message.setRead(true);
                    write(RowKind.MESSAGE, message.getId(), message, ChangeType.UPDATE, Message.class);
                }
                return unread.size();
            });
        }
    }

    private final class MemoryNotifications implements NotificationRepository {

        @Override
        public CompletableFuture<Notification> insert(Notification notification) {
            return run(RowKind.NOTIFICATION, () -> {
                require(notification.getUserId() != null && notification.getType() != null,
                    "user_id y type son obligatorios");
                Notification row = new Notification(notification.getUserId(), notification.getType(),
                    notification.getContent(), notification.getRelatedId());
                row.setId(newId());
                row.setRead(false);
                row.setCreatedAt(nextTimestamp());
                return write(RowKind.NOTIFICATION, row.getId(), row, ChangeType.INSERT, Notification.class);
            });
        }

        @Override
        public CompletableFuture<List<Notification>> findRecentFor(String userId, int limit) {
            return run(RowKind.NOTIFICATION, () -> rows(RowKind.NOTIFICATION, Notification.class,
                    n -> userId.equals(n.getUserId())).stream()
                .sorted(Comparator.comparing(Notification::getCreatedAt).reversed())
                .limit(Math.max(0, limit))
                .collect(Collectors.toList()));
        }

        @Override
        public CompletableFuture<Notification> markRead(String id, String actingUserId) {
            return run(RowKind.NOTIFICATION, () -> {
                Notification row = row(RowKind.NOTIFICATION, id, Notification.class)
                    .orElseThrow(() -> new NotFoundException("Notificación inexistente: " + id));
                if (!Objects.equals(actingUserId, row.getUserId())) {
                    throw new ForbiddenException("La notificación pertenece a otro usuario");
                }
                if (row.isRead()) {
                    return row;
                }
                row.setRead(true);
                return write(RowKind.NOTIFICATION, row.getId(), row, ChangeType.UPDATE, Notification.class);
            });
        }
    }

    private final class MemoryBlobs implements BlobStorage {

        @Override
        public CompletableFuture<String> upload(String bucket, String path, byte[] content, String contentType) {
            RuntimeException failure = uploadFailure;
            if (failure != null) {
                return CompletableFuture.failedFuture(failure);
            }
            if (bucket == null || path == null || content == null) {
                return CompletableFuture.failedFuture(new UploadException("Bucket, ruta y contenido son obligatorios"));
            }
            blobs.put(bucket + "/" + path, content.clone());
            LOGGER.fine(() -> "Adjunto almacenado en " + bucket + "/" + path + " (" + content.length + " bytes)");
            return CompletableFuture.completedFuture(BLOB_URL_PREFIX + bucket + "/" + path);
        }
    }

    private final class MemoryFeed implements ChangeFeed {

        @Override
        public FeedConnection connect(RowKind kind, RowFilter filter, FeedListener listener) {
            synchronized (lock) {
                if (refusedConnects > 0) {
                    refusedConnects--;
                    throw new TransportException("Feed no disponible");
                }
            }
            MemoryConnection connection = new MemoryConnection(
                Objects.requireNonNull(kind, "kind"),
                Objects.requireNonNull(filter, "filter"),
                Objects.requireNonNull(listener, "listener"));
            connections.add(connection);
            LOGGER.fine(() -> "Conexión de feed abierta sobre " + kind.table() + " con filtro " + filter);
            return connection;
        }
    }

    private final class MemoryConnection implements FeedConnection {
        private final RowKind kind;
        private final RowFilter filter;
        private final FeedListener listener;
        private volatile boolean open = true;

        private MemoryConnection(RowKind kind, RowFilter filter, FeedListener listener) {
            this.kind = kind;
            this.filter = filter;
            this.listener = listener;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void close() {
            open = false;
            connections.remove(this);
        }
    }
}
