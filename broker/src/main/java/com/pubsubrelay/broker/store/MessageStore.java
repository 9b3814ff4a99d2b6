package com.pubsubrelay.broker.store;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Append-only message log plus the channel identity table.
 * <p>
 * This interface is intentionally blocking. The broker runs every call on its single loop
 * scheduler, so implementations only need to make each call atomic; they must still serialize
 * conflicting writes themselves.
 * </p>
 * <p>
 * <b>Ordering:</b> ids returned by {@link #insert} are unique and strictly increasing. Queries
 * return rows in ascending id order with no gaps or duplicates relative to what was inserted.
 * </p>
 */
public interface MessageStore extends AutoCloseable {

    /**
     * Creates the schema. Safe to call more than once.
     */
    void init();

    /**
     * Creates a channel row if none exists. Losing a creation race is not an error; callers
     * re-read with {@link #getChannel} to learn the winning identity.
     */
    void createChannel(String channel, String contextId, String createdBy);

    Optional<ChannelInfo> getChannel(String channel);

    /**
     * Appends a message.
     *
     * @param channel        channel name
     * @param type           application type ({@code "presence"} is reserved)
     * @param payload        JSON text
     * @param senderId       sender identity
     * @param ts             server receive time (epoch millis)
     * @param senderMetadata sender metadata snapshot, may be {@code null}
     * @param attachment     raw attachment, may be {@code null}
     * @return the assigned id
     */
    long insert(String channel, String type, String payload, String senderId, long ts,
                ObjectNode senderMetadata, byte[] attachment);

    /**
     * Rows of a channel with {@code id > sinceId}, ascending.
     */
    List<MessageRow> query(String channel, long sinceId);

    /**
     * Rows of a channel with {@code id > sinceId} whose type is in {@code types}, ascending.
     * An empty type set yields an empty list.
     */
    List<MessageRow> queryByType(String channel, Collection<String> types, long sinceId);

    /**
     * Flushes to durable media and releases the store. Flush failures are logged, not thrown.
     */
    @Override
    void close();
}
