package com.pubsubrelay.broker.store;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pubsubrelay.core.util.JsonUtils;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Validation and helpers shared by the store implementations.
 */
public abstract class AbstractMessageStore implements MessageStore {

    private volatile boolean closed;

    @Override
    public final List<MessageRow> queryByType(String channel, Collection<String> types, long sinceId) {
        if (types.isEmpty()) {
            return List.of();
        }
        ensureOpen();
        return doQueryByType(channel, Set.copyOf(types), sinceId);
    }

    /**
     * Called with a non-empty type set.
     */
    protected abstract List<MessageRow> doQueryByType(String channel, Set<String> types, long sinceId);

    protected static String serializeMetadata(ObjectNode metadata) {
        return metadata != null ? JsonUtils.writeValueAsString(metadata) : null;
    }

    protected final void ensureOpen() {
        if (closed) {
            throw new PersistenceException("Store is closed");
        }
    }

    /**
     * Marks the store closed.
     *
     * @return {@code true} on the first call only
     */
    protected final synchronized boolean markClosed() {
        if (closed) {
            return false;
        }
        closed = true;
        return true;
    }

    public boolean isClosed() {
        return closed;
    }
}
