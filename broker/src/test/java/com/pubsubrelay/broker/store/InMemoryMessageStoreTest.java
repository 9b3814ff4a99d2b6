package com.pubsubrelay.broker.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryMessageStoreTest extends MessageStoreContract {

    @Override
    protected MessageStore createStore() {
        return new InMemoryMessageStore();
    }

    @Test
    @DisplayName("Should expose all rows and restart ids after clear")
    void testGetAllAndClear() {
        InMemoryMessageStore memory = (InMemoryMessageStore) store;
        memory.insert("a", "chat", "{}", "alice", 1L, null, null);
        memory.insert("b", "chat", "{}", "bob", 2L, null, null);
        memory.createChannel("a", "ctx", "alice");

        assertEquals(2, memory.getAll().size());

        memory.clear();

        assertTrue(memory.getAll().isEmpty());
        assertTrue(memory.getChannel("a").isEmpty());
        assertEquals(1L, memory.insert("a", "chat", "{}", "alice", 3L, null, null));
    }
}
