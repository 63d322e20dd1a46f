package com.counter.cluster;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StorageNodeAddressTest
{
    // Bu test port ve veritabanı içeren redis adresinin çözümlendiğini doğrular.
    @Test
    void parses_full_redis_address()
    {
        StorageNodeAddress address = StorageNodeAddress.parse("redis://redis1:6380/2");
        assertEquals("redis", address.scheme());
        assertEquals("redis1", address.host());
        assertEquals(6380, address.port());
        assertEquals(2, address.database());
        assertEquals("redis1:6380", address.nodeId());
        assertFalse(address.inMemory());
        assertEquals("redis://redis1:6380/2", address.toString());
    }

    // Bu test port verilmediğinde varsayılan redis portunun kullanıldığını gösterir.
    @Test
    void redis_port_defaults_to_6379()
    {
        StorageNodeAddress address = StorageNodeAddress.parse(" redis://localhost ");
        assertEquals(6379, address.port());
        assertEquals(-1, address.database());
    }

    // Bu test bellek içi düğüm adresinin adını kimlik olarak kullandığını doğrular.
    @Test
    void parses_memory_address()
    {
        StorageNodeAddress address = StorageNodeAddress.parse("mem://node-a");
        assertTrue(address.inMemory());
        assertEquals("node-a", address.nodeId());
        assertEquals("mem://node-a", address.toString());
    }

    // Bu test hatalı adreslerin başlangıçta reddedildiğini gösterir.
    @Test
    void rejects_malformed_addresses()
    {
        List<String> malformed = List.of("", "localhost:6379", "http://host:80", "redis://", "redis://host:abc",
                "redis://host:70000", "redis://:6379", "redis://host/db");
        for (String raw : malformed) {
            assertThrows(IllegalArgumentException.class, () -> StorageNodeAddress.parse(raw), raw);
        }
        assertThrows(IllegalArgumentException.class, () -> StorageNodeAddress.parse(null));
    }
}
