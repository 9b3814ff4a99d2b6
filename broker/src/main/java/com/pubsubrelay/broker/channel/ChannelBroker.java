package com.pubsubrelay.broker.channel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pubsubrelay.broker.auth.TokenValidator;
import com.pubsubrelay.broker.metrics.MetricsService;
import com.pubsubrelay.broker.store.ChannelInfo;
import com.pubsubrelay.broker.store.MessageRow;
import com.pubsubrelay.broker.store.MessageStore;
import com.pubsubrelay.broker.store.PersistenceException;
import com.pubsubrelay.core.codec.DecodedAction;
import com.pubsubrelay.core.codec.WireCodec;
import com.pubsubrelay.core.error.ProtocolException;
import com.pubsubrelay.core.error.SerializationException;
import com.pubsubrelay.core.msg.ClientAction;
import com.pubsubrelay.core.msg.CloseCode;
import com.pubsubrelay.core.msg.FrameKind;
import com.pubsubrelay.core.msg.PresenceAction;
import com.pubsubrelay.core.msg.PresencePayload;
import com.pubsubrelay.core.msg.PublishAction;
import com.pubsubrelay.core.msg.ServerFrame;
import com.pubsubrelay.core.msg.UpdateMetadataAction;
import com.pubsubrelay.core.msg.WireFrame;
import com.pubsubrelay.core.util.JsonUtils;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Channel-based pub/sub core: joins, publishes, metadata updates, disconnects and shutdown.
 * <p>
 * Every piece of registry state and every store call runs on a single-threaded scheduler (the
 * broker loop). A persisted publish therefore inserts and fans out before any other store write
 * starts, which keeps broadcast order equal to id order within a channel.
 * </p>
 * <p>
 * Lifecycle of a connection:
 * <ol>
 *   <li>token validated (may complete on any thread), result moved onto the loop</li>
 *   <li>channel identity bound against the store ({@code contextId} rules)</li>
 *   <li>presence history replayed, then the requested backlog, then {@code ready}</li>
 *   <li>{@code join} or {@code update} presence persisted and broadcast</li>
 *   <li>frames served until {@link #disconnect(Connection)}, which runs once per connection</li>
 * </ol>
 * </p>
 */
public class ChannelBroker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ChannelBroker.class);

    static final String PERSISTENCE_FAILED = "persistence failed";
    static final String METADATA_NOT_OBJECT = "metadata must be an object";

    private static final Set<String> PRESENCE_TYPES = Set.of(PresencePayload.TYPE);

    private final MessageStore store;
    private final TokenValidator tokenValidator;
    private final MetricsService metricsService;
    private final Broadcaster broadcaster;
    @Getter
    private final ChannelRegistry registry = new ChannelRegistry();
    private final Scheduler loop;

    private volatile boolean shuttingDown;

    public ChannelBroker(MessageStore store, TokenValidator tokenValidator, MetricsService metricsService) {
        this.store = store;
        this.tokenValidator = tokenValidator;
        this.metricsService = metricsService;
        this.broadcaster = new Broadcaster(metricsService);
        this.loop = Schedulers.newSingle("broker-loop");
        metricsService.bindActivityGauges(registry::getActiveConnections, registry::getActiveChannels);
    }

    public boolean isShuttingDown() {
        return shuttingDown;
    }

    /**
     * Authenticates and binds a new connection.
     * <p>
     * On success the returned connection is {@link ConnectionState#OPEN}: its outbound queue already
     * holds the replay frames and {@code ready}.
     * </p>
     *
     * @param request join parameters
     * @param link    transport handle used to terminate the connection on shutdown
     * @return the bound connection, or a {@link JoinRejectedException} carrying the close code
     */
    public Mono<Connection> join(JoinRequest request, ConnectionLink link) {
        if (shuttingDown) {
            return Mono.error(new JoinRejectedException(CloseCode.GOING_AWAY));
        }
        if (request.getToken() == null) {
            metricsService.recordConnectionRejected(CloseCode.UNAUTHORIZED.reason());
            return Mono.error(new AuthException());
        }

        return tokenValidator.validate(request.getToken())
                .onErrorMap(err -> {
                    log.warn("Token validation failed: {}", err.getMessage());
                    return new AuthException();
                })
                .switchIfEmpty(Mono.error(AuthException::new))
                .publishOn(loop)
                .map(clientId -> bind(clientId, request, link))
                .doOnError(JoinRejectedException.class, err -> {
                    log.info("Join rejected for channel {}: {}", request.getChannel(), err.getMessage());
                    metricsService.recordConnectionRejected(err.getCloseCode().reason());
                });
    }

    private Connection bind(String clientId, JoinRequest request, ConnectionLink link) {
        if (shuttingDown) {
            throw new JoinRejectedException(CloseCode.GOING_AWAY);
        }
        String channel = request.getChannel();
        if (channel == null || channel.isBlank()) {
            throw new JoinRejectedException(CloseCode.CHANNEL_REQUIRED);
        }
        ObjectNode requestedMetadata = parseMetadata(request.getMetadata());
        String contextId = resolveContextId(channel, request.getContextId(), clientId);

        // Store reads happen before the registry is touched, so a failing read leaves no trace
        List<MessageRow> presenceHistory = store.queryByType(channel, PRESENCE_TYPES, 0);
        List<MessageRow> backlog = request.getSinceId() == null
                ? List.of()
                : store.query(channel, request.getSinceId()).stream()
                        .filter(row -> !PresencePayload.TYPE.equals(row.getType()))
                        .collect(Collectors.toList());

        Connection connection = new Connection(clientId, channel, null, link);
        ChannelState state = registry.register(connection);

        Participant participant = state.getParticipant(clientId);
        PresenceAction presenceEvent = null;
        if (participant == null) {
            participant = new Participant(clientId,
                    requestedMetadata != null ? requestedMetadata : JsonUtils.newObject());
            state.putParticipant(participant);
            presenceEvent = PresenceAction.JOIN;
        } else {
            participant.addConnection();
            if (requestedMetadata != null && !requestedMetadata.equals(participant.getMetadata())) {
                applyMetadata(state, participant, requestedMetadata);
                presenceEvent = PresenceAction.UPDATE;
            }
        }
        connection.setMetadata(participant.getMetadata());

        connection.setState(ConnectionState.REPLAYING);
        presenceHistory.forEach(row -> broadcaster.unicast(connection, toReplayFrame(row)));
        backlog.forEach(row -> broadcaster.unicast(connection, toReplayFrame(row)));
        metricsService.recordReplayFrames(presenceHistory.size() + backlog.size());

        connection.setState(ConnectionState.READY);
        broadcaster.unicast(connection, ServerFrame.ready(contextId));
        connection.setState(ConnectionState.OPEN);
        metricsService.recordConnectionOpened();
        log.info("Client {} joined channel {} as connection {} ({} presence, {} backlog replayed)",
                clientId, channel, connection.getId(), presenceHistory.size(), backlog.size());

        if (presenceEvent != null) {
            try {
                publishPresence(state, clientId, presenceEvent, participant.getMetadata(), null, null);
            } catch (PersistenceException e) {
                log.warn("Failed to persist {} for {} in {}", presenceEvent, clientId, channel, e);
                broadcaster.sendError(connection, PERSISTENCE_FAILED, null);
            }
        }
        return connection;
    }

    private static ObjectNode parseMetadata(String raw) {
        if (raw == null) {
            return null;
        }
        JsonNode node;
        try {
            node = JsonUtils.readTree(raw);
        } catch (IllegalArgumentException e) {
            throw new JoinRejectedException(CloseCode.INVALID_METADATA);
        }
        if (!JsonUtils.isPlainObject(node)) {
            throw new JoinRejectedException(CloseCode.INVALID_METADATA);
        }
        return (ObjectNode) node;
    }

    /**
     * Binds the connection to the channel's identity.
     *
     * @return the channel's context id, {@code null} for a context-free channel
     */
    private String resolveContextId(String channel, String requested, String clientId) {
        Optional<ChannelInfo> existing = store.getChannel(channel);
        if (existing.isEmpty()) {
            if (requested == null) {
                return null;
            }
            store.createChannel(channel, requested, clientId);
            // Another creator may have won; its identity is the one that counts
            return store.getChannel(channel)
                    .map(ChannelInfo::getContextId)
                    .orElseThrow(() -> new PersistenceException("Channel row missing after create: " + channel));
        }

        String bound = existing.get().getContextId();
        if (bound != null) {
            if (requested != null && !requested.equals(bound)) {
                throw new ChannelIdentityException(CloseCode.CONTEXT_ID_MISMATCH);
            }
            return bound;
        }
        if (requested != null) {
            throw new ChannelIdentityException(CloseCode.CHANNEL_HAS_NO_CONTEXT);
        }
        return null;
    }

    /**
     * Handles one inbound frame of an open connection. Frames of a connection must be passed in
     * arrival order, each after the previous one completed.
     */
    public Mono<Void> handleFrame(Connection connection, WireFrame frame) {
        return Mono.<Void>fromRunnable(() -> onFrame(connection, frame)).subscribeOn(loop);
    }

    private void onFrame(Connection connection, WireFrame frame) {
        if (!connection.isOpen()) {
            log.debug("Ignoring frame for {} in state {}", connection.getId(), connection.getState());
            return;
        }
        metricsService.recordNetworkInboundWs(frame.size());

        ChannelState state = registry.find(connection.getChannel()).orElse(null);
        if (state == null) {
            return;
        }

        try {
            DecodedAction decoded = WireCodec.decode(frame);
            ClientAction action = decoded.getAction();
            if (action instanceof PublishAction) {
                publish(state, connection, (PublishAction) action, decoded.getAttachment());
            } else if (action instanceof UpdateMetadataAction) {
                updateMetadata(state, connection, (UpdateMetadataAction) action);
            }
        } catch (ProtocolException e) {
            log.debug("Rejected frame from {}: {}", connection.getClientId(), e.getMessage());
            broadcaster.sendError(connection, e.getMessage(), e.getRef());
        }
    }

    private void publish(ChannelState state, Connection sender, PublishAction publish, byte[] attachment) {
        long startNanos = System.nanoTime();
        long ts = System.currentTimeMillis();

        String payloadJson;
        try {
            payloadJson = JsonUtils.writeValueAsString(publish.getPayload());
        } catch (IllegalArgumentException e) {
            throw new SerializationException(publish.getRef(), e);
        }

        ServerFrame.ServerFrameBuilder frame = ServerFrame.builder()
                .type(publish.getType())
                .payload(publish.getPayload())
                .senderId(sender.getClientId())
                .ts(ts)
                .senderMetadata(sender.getMetadata())
                .attachment(attachment);

        if (publish.isPersist()) {
            long id;
            try {
                id = store.insert(state.getName(), publish.getType(), payloadJson, sender.getClientId(), ts,
                        sender.getMetadata(), attachment);
            } catch (PersistenceException e) {
                log.warn("Failed to persist {} from {} in {}", publish.getType(), sender.getClientId(),
                        state.getName(), e);
                broadcaster.sendError(sender, PERSISTENCE_FAILED, publish.getRef());
                return;
            }
            frame.kind(FrameKind.PERSISTED).id(id);
        } else {
            frame.kind(FrameKind.EPHEMERAL);
        }

        broadcaster.broadcast(state, frame.build(), sender, publish.getRef());
        metricsService.recordPublish(publish.isPersist());
        metricsService.recordPublishLatency(startNanos);
    }

    private void updateMetadata(ChannelState state, Connection sender, UpdateMetadataAction update) {
        if (!JsonUtils.isPlainObject(update.getPayload())) {
            throw new ProtocolException(METADATA_NOT_OBJECT, update.getRef());
        }
        Participant participant = state.getParticipant(sender.getClientId());
        if (participant == null) {
            return;
        }
        ObjectNode metadata = (ObjectNode) update.getPayload();
        applyMetadata(state, participant, metadata);

        try {
            publishPresence(state, sender.getClientId(), PresenceAction.UPDATE, metadata, sender, update.getRef());
        } catch (PersistenceException e) {
            log.warn("Failed to persist metadata update from {} in {}", sender.getClientId(), state.getName(), e);
            broadcaster.sendError(sender, PERSISTENCE_FAILED, update.getRef());
        }
    }

    /**
     * Replaces a participant's metadata and the snapshot held by each of its connections.
     */
    private static void applyMetadata(ChannelState state, Participant participant, ObjectNode metadata) {
        participant.setMetadata(metadata);
        for (Connection connection : state.getConnections()) {
            if (connection.getClientId().equals(participant.getId())) {
                connection.setMetadata(metadata);
            }
        }
    }

    private void publishPresence(ChannelState state, String clientId, PresenceAction action, ObjectNode metadata,
                                 Connection origin, JsonNode ref) {
        PresencePayload presence = new PresencePayload(action, metadata);
        long ts = System.currentTimeMillis();
        long id = store.insert(state.getName(), PresencePayload.TYPE, JsonUtils.writeValueAsString(presence),
                clientId, ts, metadata, null);

        ServerFrame frame = ServerFrame.builder()
                .kind(FrameKind.PERSISTED)
                .id(id)
                .type(PresencePayload.TYPE)
                .payload(JsonUtils.mapper().valueToTree(presence))
                .senderId(clientId)
                .ts(ts)
                .senderMetadata(metadata)
                .build();
        broadcaster.broadcast(state, frame, origin, ref);
    }

    private static ServerFrame toReplayFrame(MessageRow row) {
        return ServerFrame.builder()
                .kind(FrameKind.REPLAY)
                .id(row.getId())
                .type(row.getType())
                .payload(JsonUtils.readTree(row.getPayload()))
                .senderId(row.getSenderId())
                .ts(row.getTs())
                .senderMetadata(JsonUtils.readObjectOrNull(row.getSenderMetadata()))
                .attachment(row.getAttachment())
                .build();
    }

    /**
     * Runs the close bookkeeping of a connection. Safe to call repeatedly and for any close cause;
     * only the first call has an effect.
     */
    public Mono<Void> disconnect(Connection connection) {
        return Mono.<Void>fromRunnable(() -> leave(connection)).subscribeOn(loop);
    }

    private void leave(Connection connection) {
        ConnectionState previous = connection.getState();
        if (previous == ConnectionState.CLOSING || previous == ConnectionState.CLOSED) {
            return;
        }
        connection.setState(ConnectionState.CLOSING);
        connection.completeOutbound();

        registry.unregister(connection).ifPresent(state -> {
            Participant participant = state.getParticipant(connection.getClientId());
            if (participant == null || participant.removeConnection() > 0) {
                return;
            }
            state.removeParticipant(participant.getId());
            try {
                publishPresence(state, participant.getId(), PresenceAction.LEAVE, participant.getMetadata(), null, null);
            } catch (PersistenceException e) {
                log.debug("Leave of {} in {} not persisted: {}", participant.getId(), state.getName(),
                        e.getMessage());
            }
        });

        connection.setState(ConnectionState.CLOSED);
        log.info("Connection {} of {} left channel {}", connection.getId(), connection.getClientId(),
                connection.getChannel());
    }

    /**
     * Stops accepting joins, terminates every live connection (persisting their leave events), then
     * closes the store. All of it runs on the loop, after any frame already queued there.
     */
    public Mono<Void> shutdown() {
        shuttingDown = true;
        return Mono.<Void>fromRunnable(() -> {
            List<Connection> connections = registry.allConnections();
            log.info("Terminating {} connection(s)", connections.size());
            for (Connection connection : connections) {
                leave(connection);
                try {
                    connection.getLink().close(CloseCode.GOING_AWAY);
                } catch (RuntimeException e) {
                    log.warn("Failed to close connection {}: {}", connection.getId(), e.getMessage());
                }
            }
            store.close();
        }).subscribeOn(loop);
    }

    /**
     * Disposes the broker loop. Call after {@link #shutdown()} and after the transport is gone.
     */
    @Override
    public void close() {
        loop.dispose();
    }
}
