package com.counter.core;

/**
 * Önbellekte tutulan son bilinen sayaç değeri ile eklenme ve son kullanma
 * zamanlarını taşıyan kayıttır.
 *
 * @param seeded değer depolamadan okunup bekleyen artışla birleştirildiyse
 *               {@code true}; yalnızca yerel artışlardan açılan kayıtlarda {@code false}
 */
record CacheEntry(long value, long insertedAtMillis, long expireAtMillis, boolean seeded) {
    boolean expired(long now) {
        return now >= expireAtMillis;
    }
}
