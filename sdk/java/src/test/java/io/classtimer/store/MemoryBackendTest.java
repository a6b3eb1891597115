package io.classtimer.store;

import io.classtimer.exception.QuotaExceededException;
import io.classtimer.exception.StorageErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Memory Backend Tests")
class MemoryBackendTest {

    private MemoryBackend backend;

    @BeforeEach
    void setUp() {
        backend = new MemoryBackend();
    }

    @Test
    @DisplayName("Set and get value")
    void testSetAndGet() {
        backend.set("key1", "value1");

        assertTrue(backend.get("key1").isPresent());
        assertEquals("value1", backend.get("key1").get());
    }

    @Test
    @DisplayName("Get returns empty for non-existent key")
    void testGetNonExistent() {
        assertTrue(backend.get("nonexistent").isEmpty());
    }

    @Test
    @DisplayName("Delete removes key")
    void testDelete() {
        backend.set("key1", "value1");
        assertTrue(backend.exists("key1"));

        assertTrue(backend.delete("key1"));
        assertFalse(backend.exists("key1"));
        assertFalse(backend.delete("key1"));
    }

    @Test
    @DisplayName("Keys keep insertion order")
    void testKeysOrder() {
        backend.set("b", "1");
        backend.set("a", "2");
        backend.set("c", "3");
        backend.set("b", "4");

        assertEquals(List.of("b", "a", "c"), backend.keys());
        assertEquals(3, backend.count());
    }

    @Test
    @DisplayName("Size sums key and value lengths")
    void testSize() {
        backend.set("ab", "cde");
        backend.set("f", "g");

        assertEquals(7, backend.size());
    }

    @Test
    @DisplayName("Writes beyond the quota are refused")
    void testQuota() {
        MemoryBackend limited = new MemoryBackend(10);
        limited.set("key", "12345");

        QuotaExceededException e = assertThrows(QuotaExceededException.class,
            () -> limited.set("other", "123"));
        assertEquals(StorageErrorCode.QUOTA_EXCEEDED, e.getCode());
        assertEquals("other", e.getKey());
        assertEquals(10, e.getQuota());
        assertTrue(e.getMessage().contains("10 characters"));
        assertFalse(limited.exists("other"));
    }

    @Test
    @DisplayName("Overwriting within the quota counts only the new value")
    void testQuotaOverwrite() {
        MemoryBackend limited = new MemoryBackend(10);
        limited.set("key", "1234567");
        limited.set("key", "7654321");

        assertEquals("7654321", limited.get("key").get());
    }

    @Test
    @DisplayName("Negative quota is rejected")
    void testNegativeQuota() {
        assertThrows(IllegalArgumentException.class, () -> new MemoryBackend(-2));
    }

    @Test
    @DisplayName("Clear and close remove all data")
    void testClearAndClose() {
        backend.set("key1", "value1");
        backend.set("key2", "value2");
        backend.clear();
        assertEquals(0, backend.count());

        backend.set("key3", "value3");
        backend.close();
        assertTrue(backend.keys().isEmpty());
    }

    @Test
    @DisplayName("Backend name is memory")
    void testBackendName() {
        assertEquals("memory", backend.getBackendName());
    }
}
