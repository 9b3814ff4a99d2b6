package com.pubsubrelay.broker.store;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Heap-backed store for tests and {@code STORE_TYPE=memory}.
 * <p>
 * Same contract as {@link SqliteMessageStore}: one global id sequence starting at 1,
 * insert-if-absent channel creation. All methods synchronize on the store.
 * </p>
 */
public class InMemoryMessageStore extends AbstractMessageStore {

    private final List<MessageRow> messages = new ArrayList<>();
    private final Map<String, ChannelInfo> channels = new HashMap<>();
    private long nextId = 1;

    @Override
    public void init() {
        // nothing to set up
    }

    @Override
    public synchronized void createChannel(String channel, String contextId, String createdBy) {
        ensureOpen();
        channels.putIfAbsent(channel, new ChannelInfo(contextId, System.currentTimeMillis(), createdBy));
    }

    @Override
    public synchronized Optional<ChannelInfo> getChannel(String channel) {
        ensureOpen();
        return Optional.ofNullable(channels.get(channel));
    }

    @Override
    public synchronized long insert(String channel, String type, String payload, String senderId, long ts,
                                    ObjectNode senderMetadata, byte[] attachment) {
        ensureOpen();
        long id = nextId++;
        messages.add(MessageRow.builder()
                .id(id)
                .channel(channel)
                .type(type)
                .payload(payload)
                .senderId(senderId)
                .ts(ts)
                .senderMetadata(serializeMetadata(senderMetadata))
                .attachment(attachment)
                .build());
        return id;
    }

    @Override
    public synchronized List<MessageRow> query(String channel, long sinceId) {
        ensureOpen();
        return messages.stream()
                .filter(row -> row.getChannel().equals(channel) && row.getId() > sinceId)
                .collect(Collectors.toList());
    }

    @Override
    protected synchronized List<MessageRow> doQueryByType(String channel, Set<String> types, long sinceId) {
        return messages.stream()
                .filter(row -> row.getChannel().equals(channel) && row.getId() > sinceId)
                .filter(row -> types.contains(row.getType()))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized void close() {
        if (markClosed()) {
            reset();
        }
    }

    /**
     * Snapshot of every stored row, in insertion order.
     */
    public synchronized List<MessageRow> getAll() {
        return List.copyOf(messages);
    }

    /**
     * Drops all rows and channels and restarts the id sequence.
     */
    public synchronized void clear() {
        reset();
    }

    private void reset() {
        messages.clear();
        channels.clear();
        nextId = 1;
    }
}
