package com.pubsubrelay.broker.store;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pubsubrelay.core.util.JsonUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every {@link MessageStore} must share. Subclasses supply the implementation.
 */
abstract class MessageStoreContract {

    protected MessageStore store;

    protected abstract MessageStore createStore() throws Exception;

    @BeforeEach
    void setUpStore() throws Exception {
        store = createStore();
        store.init();
    }

    @AfterEach
    void tearDownStore() {
        store.close();
    }

    private long insert(String channel, String type, String payload) {
        return store.insert(channel, type, payload, "alice", System.currentTimeMillis(), null, null);
    }

    @Test
    @DisplayName("Should assign strictly increasing ids without duplicates")
    void testIdsStrictlyIncrease() {
        List<Long> assigned = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            assigned.add(insert("room", "chat", "{\"n\":" + i + "}"));
        }

        List<Long> queried = store.query("room", 0).stream().map(MessageRow::getId).collect(Collectors.toList());

        assertEquals(assigned, queried);
        for (int i = 1; i < queried.size(); i++) {
            assertTrue(queried.get(i) > queried.get(i - 1), "ids must strictly increase");
        }
    }

    @Test
    @DisplayName("Should return exactly the suffix after sinceId")
    void testQuerySuffix() {
        List<Long> ids = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            ids.add(insert("room", "chat", "{}"));
        }

        for (int k = 0; k <= ids.size(); k++) {
            long sinceId = k == 0 ? 0 : ids.get(k - 1);
            List<Long> expected = ids.subList(k, ids.size());
            List<Long> actual = store.query("room", sinceId).stream()
                    .map(MessageRow::getId).collect(Collectors.toList());
            assertEquals(expected, actual, "suffix after " + sinceId);
        }
    }

    @Test
    @DisplayName("Should keep channels apart")
    void testChannelIsolation() {
        insert("a", "chat", "{}");
        insert("b", "chat", "{}");
        insert("a", "chat", "{}");

        assertEquals(2, store.query("a", 0).size());
        assertEquals(1, store.query("b", 0).size());
        assertTrue(store.query("c", 0).isEmpty());
    }

    @Test
    @DisplayName("Should round-trip every column")
    void testRowContents() {
        ObjectNode metadata = JsonUtils.newObject().put("name", "Alice");
        byte[] attachment = {0, 1, 2, (byte) 255};
        long id = store.insert("room", "file", "{\"name\":\"a.bin\"}", "alice", 1234L, metadata, attachment);

        MessageRow row = store.query("room", 0).get(0);

        assertEquals(id, row.getId());
        assertEquals("room", row.getChannel());
        assertEquals("file", row.getType());
        assertEquals("{\"name\":\"a.bin\"}", row.getPayload());
        assertEquals("alice", row.getSenderId());
        assertEquals(1234L, row.getTs());
        assertEquals(metadata, JsonUtils.readTree(row.getSenderMetadata()));
        assertArrayEquals(attachment, row.getAttachment());
    }

    @Test
    @DisplayName("Should keep a 1 MiB attachment intact and visible after sinceId")
    void testLargeAttachment() {
        byte[] attachment = new byte[1024 * 1024];
        new Random(42).nextBytes(attachment);
        long before = insert("room", "chat", "{}");
        long id = store.insert("room", "file", "{\"name\":\"big.bin\"}", "alice", 1L, null, attachment);

        List<MessageRow> rows = store.query("room", before);

        assertEquals(1, rows.size());
        assertEquals(id, rows.get(0).getId());
        assertEquals(attachment.length, rows.get(0).getAttachment().length);
        assertArrayEquals(attachment, rows.get(0).getAttachment());
    }

    @Test
    @DisplayName("Should leave optional columns null when absent")
    void testNullOptionalColumns() {
        insert("room", "chat", "{}");

        MessageRow row = store.query("room", 0).get(0);

        assertNull(row.getSenderMetadata());
        assertNull(row.getAttachment());
        assertFalse(row.hasAttachment());
    }

    @Test
    @DisplayName("Should filter by type and short-circuit an empty type set")
    void testQueryByType() {
        insert("room", "presence", "{\"action\":\"join\"}");
        long chat = insert("room", "chat", "{}");
        insert("room", "presence", "{\"action\":\"leave\"}");
        insert("room", "cursor", "{}");

        List<MessageRow> presence = store.queryByType("room", Set.of("presence"), 0);
        assertEquals(2, presence.size());
        assertTrue(presence.get(0).getId() < presence.get(1).getId());

        assertEquals(3, store.queryByType("room", Set.of("presence", "cursor"), 0).size());
        assertEquals(2, store.queryByType("room", Set.of("presence", "cursor"), chat).size());
        assertTrue(store.queryByType("room", Set.of(), 0).isEmpty());
    }

    @Test
    @DisplayName("Should keep the first channel identity on repeated create")
    void testCreateChannelIfAbsent() {
        assertEquals(Optional.empty(), store.getChannel("room"));

        store.createChannel("room", "ctx-1", "alice");
        store.createChannel("room", "ctx-2", "bob");

        ChannelInfo info = store.getChannel("room").orElseThrow();
        assertEquals("ctx-1", info.getContextId());
        assertEquals("alice", info.getCreatedBy());
        assertTrue(info.getCreatedAt() > 0);
    }

    @Test
    @DisplayName("Should settle concurrent channel creation on exactly one winner")
    void testConcurrentCreateChannel() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<String>> results = new ArrayList<>();
            for (String contextId : List.of("ctx-a", "ctx-b")) {
                results.add(executor.submit(() -> {
                    start.await();
                    store.createChannel("race", contextId, "creator-" + contextId);
                    return store.getChannel("race").orElseThrow().getContextId();
                }));
            }
            start.countDown();

            String first = results.get(0).get(10, TimeUnit.SECONDS);
            String second = results.get(1).get(10, TimeUnit.SECONDS);
            assertEquals(first, second, "both creators must observe the same winner");
            assertTrue(Set.of("ctx-a", "ctx-b").contains(first));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should fail every operation after close, and tolerate a second close")
    void testClosedStore() {
        insert("room", "chat", "{}");
        store.close();
        store.close();

        assertThrows(PersistenceException.class, () -> store.query("room", 0));
        assertThrows(PersistenceException.class, () -> insert("room", "chat", "{}"));
        assertThrows(PersistenceException.class, () -> store.getChannel("room"));
        assertThrows(PersistenceException.class, () -> store.queryByType("room", Set.of("chat"), 0));
    }
}
